package me.golemcore.verifybot.domain.loop;

import me.golemcore.verifybot.domain.model.BotMembershipChanged;
import me.golemcore.verifybot.domain.model.ChatKind;
import me.golemcore.verifybot.domain.model.GroupConfig;
import me.golemcore.verifybot.domain.model.MemberStatus;
import me.golemcore.verifybot.domain.model.MessagePosted;
import me.golemcore.verifybot.domain.model.ModerationEvent;
import me.golemcore.verifybot.domain.model.OracleUnavailableException;
import me.golemcore.verifybot.domain.model.StorageException;
import me.golemcore.verifybot.domain.model.TelegramUser;
import me.golemcore.verifybot.domain.model.UpdateBatch;
import me.golemcore.verifybot.domain.model.UserMembershipChanged;
import me.golemcore.verifybot.domain.service.LedgerPruningService;
import me.golemcore.verifybot.domain.service.MembershipReconciler;
import me.golemcore.verifybot.domain.service.ProcessExitService;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import me.golemcore.verifybot.port.inbound.UpdateSourcePort;
import me.golemcore.verifybot.port.outbound.CursorPort;
import me.golemcore.verifybot.port.outbound.VerificationOraclePort;
import me.golemcore.verifybot.testsupport.FakeChatPlatform;
import me.golemcore.verifybot.testsupport.InMemoryGroupRegistry;
import me.golemcore.verifybot.testsupport.InMemoryRestrictionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModerationLoopTest {

    private static final long GROUP_ID = -100123L;

    private UpdateSourcePort updateSource;
    private CursorPort cursorStore;
    private InMemoryGroupRegistry groupRegistry;
    private InMemoryRestrictionLedger restrictionLedger;
    private FakeChatPlatform platform;
    private VerificationOraclePort oracle;
    private LedgerPruningService ledgerPruningService;
    private ProcessExitService processExitService;
    private BotProperties properties;
    private ModerationLoop loop;

    @BeforeEach
    void setUp() {
        updateSource = mock(UpdateSourcePort.class);
        cursorStore = mock(CursorPort.class);
        groupRegistry = new InMemoryGroupRegistry();
        restrictionLedger = new InMemoryRestrictionLedger();
        platform = new FakeChatPlatform();
        oracle = mock(VerificationOraclePort.class);
        when(oracle.findVerifiedIdentity(anyLong())).thenReturn(Optional.empty());
        ledgerPruningService = mock(LedgerPruningService.class);
        processExitService = mock(ProcessExitService.class);
        properties = new BotProperties();
        properties.getLedger().setPruneInterval(Duration.ZERO);

        MembershipReconciler reconciler = new MembershipReconciler(
                groupRegistry, restrictionLedger, platform, oracle);
        loop = spy(new ModerationLoop(updateSource, cursorStore, groupRegistry, restrictionLedger,
                reconciler, ledgerPruningService, processExitService, properties));
        doNothing().when(loop).sleepSeconds(anyInt());
    }

    @Test
    void shouldStoreCursorOnceAfterWholeBatch() {
        when(cursorStore.load()).thenReturn(100L);
        when(updateSource.fetch(100L)).thenReturn(new UpdateBatch(List.of(
                new BotMembershipChanged(101, GROUP_ID, ChatKind.SUPERGROUP, MemberStatus.ADMINISTRATOR),
                new MessagePosted(103, GROUP_ID, 1, 5L)), 104));

        int processed = loop.runIteration();

        assertEquals(2, processed);
        verify(cursorStore).store(104L);
        assertTrue(groupRegistry.load().containsKey(GROUP_ID));
    }

    @Test
    void shouldNotStoreCursorForEmptyPoll() {
        when(cursorStore.load()).thenReturn(100L);
        when(updateSource.fetch(100L)).thenReturn(UpdateBatch.empty());

        assertEquals(0, loop.runIteration());

        verify(cursorStore, never()).store(anyLong());
    }

    @Test
    void shouldAdvanceCursorPastUnhandledUpdates() {
        when(cursorStore.load()).thenReturn(100L);
        when(updateSource.fetch(100L)).thenReturn(new UpdateBatch(List.of(), 105));

        loop.runIteration();

        verify(cursorStore).store(105L);
    }

    @Test
    void shouldNeverMoveCursorBackwards() {
        when(cursorStore.load()).thenReturn(200L);
        when(updateSource.fetch(200L)).thenReturn(new UpdateBatch(List.of(
                new MessagePosted(150, GROUP_ID, 1, 5L)), 150));

        loop.runIteration();

        verify(cursorStore, never()).store(anyLong());
    }

    @Test
    void shouldPruneLedgerBeforeLoadingState() {
        when(updateSource.fetch(anyLong())).thenReturn(UpdateBatch.empty());

        loop.runIteration();

        var order = inOrder(ledgerPruningService, cursorStore, updateSource);
        order.verify(ledgerPruningService).pruneIfDue();
        order.verify(cursorStore).load();
        order.verify(updateSource).fetch(0L);
    }

    @Test
    void shouldPickUpExternalRegistryEditsOnEveryIteration() {
        platform.post(GROUP_ID, 555);
        restrictionLedger.add(7L);
        when(cursorStore.load()).thenReturn(0L, 1L);
        when(updateSource.fetch(0L)).thenReturn(new UpdateBatch(List.of(), 1));
        when(updateSource.fetch(1L)).thenReturn(new UpdateBatch(List.of(
                new MessagePosted(2, GROUP_ID, 555, 7L)), 2));

        loop.runIteration();
        // admin panel enables deletion between iterations
        groupRegistry.upsert(GROUP_ID, true);
        loop.runIteration();

        assertEquals(Set.of(GROUP_ID + "/555"), platform.getDeletedMessages());
    }

    @Test
    void shouldDeleteLaterMessagesOfUserRestrictedEarlierInSameBatch() {
        groupRegistry.upsert(GROUP_ID, true);
        platform.setStatus(GROUP_ID, 7L, MemberStatus.MEMBER);
        platform.post(GROUP_ID, 555);
        when(updateSource.fetch(0L)).thenReturn(new UpdateBatch(List.of(
                join(1, 7L),
                new MessagePosted(2, GROUP_ID, 555, 7L)), 2));

        loop.runIteration();

        assertEquals(Set.of(GROUP_ID + "/555"), platform.getDeletedMessages());
        assertEquals(Set.of(7L), restrictionLedger.load());
    }

    @Test
    void shouldReachSameStateWhenBatchIsRedelivered() {
        List<ModerationEvent> events = List.of(
                new BotMembershipChanged(1, GROUP_ID, ChatKind.SUPERGROUP, MemberStatus.ADMINISTRATOR),
                join(2, 42L),
                join(3, 7L),
                new MessagePosted(4, GROUP_ID, 555, 7L),
                confirmRestricted(5, 42L),
                new BotMembershipChanged(6, -100999L, ChatKind.GROUP, MemberStatus.MEMBER),
                new BotMembershipChanged(7, -100999L, ChatKind.GROUP, MemberStatus.LEFT));

        Snapshot once = runScenario(events, 1);
        Snapshot twice = runScenario(events, 2);

        assertEquals(once, twice);
        assertEquals(Set.of(7L), once.ledger());
        assertEquals(Set.of(GROUP_ID + "/555"), once.deleted());
        assertEquals(2, once.restrictCalls());
    }

    @Test
    void shouldNotAdvanceCursorWhenOracleIsUnavailable() {
        when(updateSource.fetch(0L)).thenReturn(new UpdateBatch(List.of(join(1, 42L)), 1));
        when(oracle.findVerifiedIdentity(42L))
                .thenThrow(new OracleUnavailableException("down", new SQLException("refused")));

        assertThrows(OracleUnavailableException.class, () -> loop.runIteration());

        verify(cursorStore, never()).store(anyLong());
    }

    @Test
    void shouldExitProcessWhenOracleIsUnavailable() {
        when(updateSource.fetch(0L)).thenReturn(new UpdateBatch(List.of(join(1, 42L)), 1));
        when(oracle.findVerifiedIdentity(42L))
                .thenThrow(new OracleUnavailableException("down", new SQLException("refused")));

        loop.start();

        verify(processExitService, timeout(2000)).exit(eq(ModerationLoop.ORACLE_FAILURE_EXIT_CODE), anyString());
        verify(loop, timeout(2000)).sleepSeconds(properties.getOracle().getFailurePauseSeconds());
        verify(cursorStore, never()).store(anyLong());
        loop.stop();
        assertFalse(loop.isRunning());
    }

    @Test
    void shouldAbandonBatchWhenStateWriteFails() {
        CursorPort failingCursor = mock(CursorPort.class);
        doThrow(new StorageException("disk full", new IOException("ENOSPC"))).when(failingCursor).store(anyLong());
        ModerationLoop failingLoop = new ModerationLoop(updateSource, failingCursor, groupRegistry,
                restrictionLedger, new MembershipReconciler(groupRegistry, restrictionLedger, platform, oracle),
                ledgerPruningService, processExitService, properties);
        when(updateSource.fetch(0L)).thenReturn(new UpdateBatch(List.of(
                new BotMembershipChanged(1, GROUP_ID, ChatKind.SUPERGROUP, MemberStatus.MEMBER)), 1));

        assertThrows(StorageException.class, failingLoop::runIteration);
        verify(processExitService, never()).exit(anyInt(), anyString());
    }

    private Snapshot runScenario(List<ModerationEvent> events, int deliveries) {
        InMemoryGroupRegistry registry = new InMemoryGroupRegistry();
        InMemoryRestrictionLedger ledger = new InMemoryRestrictionLedger();
        FakeChatPlatform fakePlatform = new FakeChatPlatform();
        registry.upsert(GROUP_ID, true);
        fakePlatform.setStatus(GROUP_ID, 42L, MemberStatus.MEMBER);
        fakePlatform.setStatus(GROUP_ID, 7L, MemberStatus.MEMBER);
        fakePlatform.post(GROUP_ID, 555);

        UpdateSourcePort source = mock(UpdateSourcePort.class);
        when(source.fetch(anyLong())).thenReturn(new UpdateBatch(events, events.size()));
        ModerationLoop scenarioLoop = new ModerationLoop(source, mock(CursorPort.class), registry, ledger,
                new MembershipReconciler(registry, ledger, fakePlatform, oracle),
                ledgerPruningService, processExitService, properties);

        for (int i = 0; i < deliveries; i++) {
            scenarioLoop.runIteration();
        }
        return new Snapshot(registry.load(), ledger.load(), fakePlatform.getDeletedMessages(),
                fakePlatform.getStatuses().size(), fakePlatform.getRestrictCalls().size());
    }

    private static UserMembershipChanged join(long updateId, long userId) {
        return new UserMembershipChanged(updateId, GROUP_ID, ChatKind.SUPERGROUP,
                new TelegramUser(userId, "user" + userId, false), MemberStatus.LEFT, MemberStatus.MEMBER);
    }

    private static UserMembershipChanged confirmRestricted(long updateId, long userId) {
        return new UserMembershipChanged(updateId, GROUP_ID, ChatKind.SUPERGROUP,
                new TelegramUser(userId, "user" + userId, false), MemberStatus.MEMBER, MemberStatus.RESTRICTED);
    }

    private record Snapshot(Map<Long, GroupConfig> groups, Set<Long> ledger, Set<String> deleted,
            int trackedMembers, int restrictCalls) {
    }
}
