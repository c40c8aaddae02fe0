package me.golemcore.verifybot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.ArrayList;
import java.util.List;

/**
 * Main application class for the verification gate bot.
 *
 * <p>
 * The bot keeps Telegram groups closed to unverified newcomers: every user who
 * joins a managed group is restricted until the external verification web flow
 * links the account to a wiki identity. While restricted, the user's messages
 * are deleted in groups that opted in.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters) around a single moderation
 * loop:
 *
 * <pre>
 * Input Layer        → TelegramUpdateSource (long polling)
 * Domain Layer       → ModerationLoop, MembershipReconciler
 * Infrastructure     → Telegram/Storage/Verification Adapters
 * </pre>
 *
 * <h2>Command line</h2>
 * <p>
 * {@code -v} / {@code --verbose} traces every reconciler decision. Any Spring
 * property can be passed as {@code --bot.key=value}.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VerifyBotApplication {

    static final String VERBOSE_PROPERTY = "--bot.verbose=true";

    public static void main(String[] args) {
        SpringApplication.run(VerifyBotApplication.class, translateArguments(args));
    }

    /**
     * Rewrites the short verbosity switches into the bound property.
     */
    static String[] translateArguments(String[] args) {
        List<String> translated = new ArrayList<>(args.length);
        for (String arg : args) {
            if ("-v".equals(arg) || "--verbose".equals(arg)) {
                translated.add(VERBOSE_PROPERTY);
            } else {
                translated.add(arg);
            }
        }
        return translated.toArray(new String[0]);
    }

}
