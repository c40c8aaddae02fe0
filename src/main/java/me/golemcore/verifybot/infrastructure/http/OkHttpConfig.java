package me.golemcore.verifybot.infrastructure.http;

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

import me.golemcore.verifybot.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Builds the one {@link OkHttpClient} behind every Bot API request.
 *
 * <p>
 * {@code getUpdates} holds the connection open for up to
 * {@code bot.telegram.poll-timeout-seconds}, so the read timeout is raised to
 * that wait plus the connect timeout when the configured value is shorter.
 * Moderation calls use the same bounds and count as failed once they elapse.
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final BotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        BotProperties.HttpProperties http = properties.getHttp();
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(effectiveReadTimeoutMillis(properties), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .build();
    }

    static long effectiveReadTimeoutMillis(BotProperties properties) {
        BotProperties.HttpProperties http = properties.getHttp();
        long longPollMillis = TimeUnit.SECONDS.toMillis(properties.getTelegram().getPollTimeoutSeconds());
        return Math.max(http.getReadTimeout(), longPollMillis + http.getConnectTimeout());
    }
}
