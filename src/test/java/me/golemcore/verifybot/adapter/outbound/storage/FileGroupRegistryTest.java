package me.golemcore.verifybot.adapter.outbound.storage;

import me.golemcore.verifybot.domain.model.GroupConfig;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileGroupRegistryTest {

    private static final long GROUP_ID = -100123L;

    @TempDir
    Path tempDir;

    private FileGroupRegistry registry;
    private Path groupsFile;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        registry = new FileGroupRegistry(storage, properties);
        groupsFile = tempDir.resolve(properties.getStorage().getGroupsFile());
    }

    @Test
    void shouldLoadEmptyRegistryWhenFileIsMissing() {
        assertTrue(registry.load().isEmpty());
    }

    @Test
    void shouldParseLegacyAndFlaggedLines() throws IOException {
        Files.writeString(groupsFile, "-1001\n-1002:true\n-1003:false\n\n-1004:yes\n-1005:1\n-1006:On\n-1007:nope\n");

        Map<Long, GroupConfig> groups = registry.load();

        assertEquals(List.of(-1001L, -1002L, -1003L, -1004L, -1005L, -1006L, -1007L), List.copyOf(groups.keySet()));
        assertFalse(groups.get(-1001L).isDeleteMessagesFromRestricted());
        assertTrue(groups.get(-1002L).isDeleteMessagesFromRestricted());
        assertFalse(groups.get(-1003L).isDeleteMessagesFromRestricted());
        assertTrue(groups.get(-1004L).isDeleteMessagesFromRestricted());
        assertTrue(groups.get(-1005L).isDeleteMessagesFromRestricted());
        assertTrue(groups.get(-1006L).isDeleteMessagesFromRestricted());
        assertFalse(groups.get(-1007L).isDeleteMessagesFromRestricted());
    }

    @Test
    void shouldSkipMalformedLines() throws IOException {
        Files.writeString(groupsFile, "not-a-group\n-1001:true\r\n");

        Map<Long, GroupConfig> groups = registry.load();

        assertEquals(1, groups.size());
        assertTrue(groups.get(-1001L).isDeleteMessagesFromRestricted());
    }

    @Test
    void shouldAddGroupWithFlagOffThenRemoveIt() throws IOException {
        assertTrue(registry.putIfAbsent(GROUP_ID, false));
        assertEquals("-100123:false\n", Files.readString(groupsFile));

        assertTrue(registry.remove(GROUP_ID));
        assertTrue(registry.load().isEmpty());
        assertFalse(registry.remove(GROUP_ID));
    }

    @Test
    void putIfAbsentShouldKeepExistingFlag() throws IOException {
        Files.writeString(groupsFile, "-100123:true\n");

        assertFalse(registry.putIfAbsent(GROUP_ID, false));

        assertTrue(registry.load().get(GROUP_ID).isDeleteMessagesFromRestricted());
    }

    @Test
    void upsertShouldOverwriteFlag() {
        registry.upsert(GROUP_ID, false);
        registry.upsert(GROUP_ID, true);

        assertTrue(registry.load().get(GROUP_ID).isDeleteMessagesFromRestricted());
        assertEquals(1, registry.load().size());
    }

    @Test
    void shouldPreserveLinesAppendedByOtherWriters() throws IOException {
        registry.putIfAbsent(GROUP_ID, false);
        Files.writeString(groupsFile, "-100777:true\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        registry.putIfAbsent(-100888L, false);

        Map<Long, GroupConfig> groups = registry.load();
        assertEquals(List.of(GROUP_ID, -100777L, -100888L), List.copyOf(groups.keySet()));
        assertTrue(groups.get(-100777L).isDeleteMessagesFromRestricted());
    }
}
