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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix and built once
 * at startup:
 * <ul>
 * <li>{@link TelegramProperties} - Bot API token and long polling</li>
 * <li>{@link StorageProperties} - shared flat files (groups, ledger,
 * offset)</li>
 * <li>{@link OracleProperties} - verification database outage handling</li>
 * <li>{@link LedgerProperties} - restriction ledger pruning</li>
 * <li>{@link HttpProperties} - OkHttp client timeouts</li>
 * </ul>
 *
 * <p>
 * The verification database itself is configured with the standard
 * {@code spring.datasource.*} keys.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private StorageProperties storage = new StorageProperties();
    private OracleProperties oracle = new OracleProperties();
    private LedgerProperties ledger = new LedgerProperties();
    private DaemonProperties daemon = new DaemonProperties();
    private HttpProperties http = new HttpProperties();
    private boolean verbose = false;

    @Data
    public static class TelegramProperties {
        private String token;
        private int pollTimeoutSeconds = 30;
        private int retryDelaySeconds = 5;
        private List<String> allowedUpdates = new ArrayList<>(
                List.of("chat_member", "message", "my_chat_member"));
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.verifybot";
        private String groupsFile = "groups_list.inc";
        private String restrictedUsersFile = "restricted_users.inc";
        private String offsetFile = "telegram_offset.inc";
        private int writeAttempts = 3;
        private long writeRetryDelayMillis = 200;
    }

    @Data
    public static class OracleProperties {
        private int failurePauseSeconds = 15;
    }

    @Data
    public static class LedgerProperties {
        /**
         * How often ledger entries of since-verified users are dropped. Zero
         * disables pruning.
         */
        private Duration pruneInterval = Duration.ofHours(1);
    }

    @Data
    public static class DaemonProperties {
        private boolean enabled = true;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 75000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
