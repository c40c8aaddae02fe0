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

import me.golemcore.verifybot.domain.model.GroupConfig;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import me.golemcore.verifybot.port.outbound.GroupRegistryPort;
import me.golemcore.verifybot.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Group registry stored as newline-delimited {@code groupId[:flag]} lines.
 *
 * <p>
 * A line without a flag is a legacy entry and means {@code false}. Flags accept
 * {@code 1}, {@code true}, {@code on} and {@code yes} as true. Malformed lines
 * are skipped on read and dropped by the next rewrite.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileGroupRegistry implements GroupRegistryPort {

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "on", "yes");

    private final StoragePort storage;
    private final BotProperties properties;

    @Override
    public Map<Long, GroupConfig> load() {
        return parse(storage.readText(fileName()));
    }

    @Override
    public void upsert(long groupId, boolean deleteMessagesFromRestricted) {
        Map<Long, GroupConfig> groups = load();
        groups.put(groupId, new GroupConfig(groupId, deleteMessagesFromRestricted));
        storage.writeTextAtomic(fileName(), serialize(groups));
    }

    @Override
    public boolean putIfAbsent(long groupId, boolean deleteMessagesFromRestricted) {
        Map<Long, GroupConfig> groups = load();
        if (groups.containsKey(groupId)) {
            return false;
        }
        groups.put(groupId, new GroupConfig(groupId, deleteMessagesFromRestricted));
        storage.writeTextAtomic(fileName(), serialize(groups));
        return true;
    }

    @Override
    public boolean remove(long groupId) {
        Map<Long, GroupConfig> groups = load();
        if (groups.remove(groupId) == null) {
            return false;
        }
        storage.writeTextAtomic(fileName(), serialize(groups));
        return true;
    }

    static Map<Long, GroupConfig> parse(String content) {
        Map<Long, GroupConfig> groups = new LinkedHashMap<>();
        if (content == null) {
            return groups;
        }
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            int separator = line.indexOf(':');
            String idPart = separator >= 0 ? line.substring(0, separator).trim() : line;
            boolean flag = separator >= 0 && parseFlag(line.substring(separator + 1));
            try {
                long groupId = Long.parseLong(idPart);
                groups.put(groupId, new GroupConfig(groupId, flag));
            } catch (NumberFormatException e) {
                log.warn("[Storage] Skipping malformed group registry line: {}", line);
            }
        }
        return groups;
    }

    static String serialize(Map<Long, GroupConfig> groups) {
        StringBuilder sb = new StringBuilder();
        for (GroupConfig config : groups.values()) {
            sb.append(config.getGroupId())
                    .append(':')
                    .append(config.isDeleteMessagesFromRestricted())
                    .append('\n');
        }
        return sb.toString();
    }

    private static boolean parseFlag(String value) {
        return TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private String fileName() {
        return properties.getStorage().getGroupsFile();
    }
}
