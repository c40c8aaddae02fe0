package me.golemcore.verifybot.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.verifybot.domain.loop.ModerationLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;

/**
 * Spring configuration that starts the moderation loop once the application
 * context is ready.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Logs startup information (version, storage location, polling)</li>
 * <li>Starts {@link ModerationLoop} unless {@code bot.daemon.enabled=false}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final ModerationLoop moderationLoop;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Verify Bot v{} starting...", version);
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Long poll: {}s, updates: {}",
                properties.getTelegram().getPollTimeoutSeconds(), properties.getTelegram().getAllowedUpdates());

        if (!properties.getDaemon().isEnabled()) {
            log.info("Moderation loop disabled (bot.daemon.enabled=false)");
            return;
        }
        moderationLoop.start();
    }
}
