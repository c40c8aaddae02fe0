package me.golemcore.verifybot.infrastructure.logging;

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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Raises the application loggers to TRACE when {@code bot.verbose=true}, so
 * every reconciler decision branch (including skipped events) is logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VerboseLoggingConfigurer {

    static final String APPLICATION_LOGGER = "me.golemcore.verifybot";

    private final BotProperties properties;

    @PostConstruct
    void apply() {
        if (!properties.isVerbose()) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext loggerContext)) {
            log.warn("[Logging] Verbose mode requested but Logback is not the active backend");
            return;
        }
        Logger logger = loggerContext.getLogger(APPLICATION_LOGGER);
        logger.setLevel(Level.TRACE);
        log.info("[Logging] Verbose mode enabled, tracing {}", APPLICATION_LOGGER);
    }
}
