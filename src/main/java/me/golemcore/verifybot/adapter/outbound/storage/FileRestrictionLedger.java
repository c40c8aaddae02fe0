package me.golemcore.verifybot.adapter.outbound.storage;

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
import me.golemcore.verifybot.port.outbound.RestrictionLedgerPort;
import me.golemcore.verifybot.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Restriction ledger stored as newline-delimited user ids.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileRestrictionLedger implements RestrictionLedgerPort {

    private final StoragePort storage;
    private final BotProperties properties;

    @Override
    public Set<Long> load() {
        return parse(storage.readText(fileName()));
    }

    @Override
    public boolean add(long userId) {
        Set<Long> ledger = load();
        if (!ledger.add(userId)) {
            return false;
        }
        storage.writeTextAtomic(fileName(), serialize(ledger));
        return true;
    }

    @Override
    public boolean remove(long userId) {
        Set<Long> ledger = load();
        if (!ledger.remove(userId)) {
            return false;
        }
        storage.writeTextAtomic(fileName(), serialize(ledger));
        return true;
    }

    static Set<Long> parse(String content) {
        Set<Long> ledger = new LinkedHashSet<>();
        if (content == null) {
            return ledger;
        }
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                ledger.add(Long.parseLong(line));
            } catch (NumberFormatException e) {
                log.warn("[Storage] Skipping malformed restriction ledger line: {}", line);
            }
        }
        return ledger;
    }

    static String serialize(Set<Long> ledger) {
        StringBuilder sb = new StringBuilder();
        for (Long userId : ledger) {
            sb.append(userId).append('\n');
        }
        return sb.toString();
    }

    private String fileName() {
        return properties.getStorage().getRestrictedUsersFile();
    }
}
