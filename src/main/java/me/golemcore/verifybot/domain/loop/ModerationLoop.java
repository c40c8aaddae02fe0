package me.golemcore.verifybot.domain.loop;

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

import me.golemcore.verifybot.domain.model.ModerationEvent;
import me.golemcore.verifybot.domain.model.OracleUnavailableException;
import me.golemcore.verifybot.domain.model.ReconciliationState;
import me.golemcore.verifybot.domain.model.StorageException;
import me.golemcore.verifybot.domain.model.UpdateBatch;
import me.golemcore.verifybot.domain.service.LedgerPruningService;
import me.golemcore.verifybot.domain.service.MembershipReconciler;
import me.golemcore.verifybot.domain.service.ProcessExitService;
import me.golemcore.verifybot.infrastructure.config.BotProperties;
import me.golemcore.verifybot.port.inbound.UpdateSourcePort;
import me.golemcore.verifybot.port.outbound.CursorPort;
import me.golemcore.verifybot.port.outbound.GroupRegistryPort;
import me.golemcore.verifybot.port.outbound.RestrictionLedgerPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The single moderation worker.
 *
 * <p>
 * Each iteration runs strictly in sequence:
 * <ol>
 * <li>prune the restriction ledger if due</li>
 * <li>reload group registry and restriction ledger, picking up edits made by
 * the web admin surface</li>
 * <li>load the cursor and long-poll for the next batch (the only blocking
 * point)</li>
 * <li>reconcile the events in increasing update id order</li>
 * <li>store the advanced cursor, once for the whole batch</li>
 * </ol>
 *
 * <p>
 * A crash mid-batch reprocesses the batch, which the idempotent handlers
 * tolerate. A failed state file write abandons the batch without storing the
 * cursor. An unreachable verification store is fatal: the loop logs, pauses
 * and exits the process so the supervisor restarts it with clean state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModerationLoop {

    static final int ORACLE_FAILURE_EXIT_CODE = 1;

    private final UpdateSourcePort updateSource;
    private final CursorPort cursorStore;
    private final GroupRegistryPort groupRegistry;
    private final RestrictionLedgerPort restrictionLedger;
    private final MembershipReconciler reconciler;
    private final LedgerPruningService ledgerPruningService;
    private final ProcessExitService processExitService;
    private final BotProperties properties;

    private volatile boolean running = false;
    private ExecutorService worker;

    /**
     * Start the loop on a dedicated non-daemon thread.
     */
    public synchronized void start() {
        if (running) {
            log.debug("[Moderation] Loop already running");
            return;
        }
        running = true;
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "moderation-loop");
            t.setDaemon(false);
            return t;
        });
        worker.submit(this::run);
        log.info("[Moderation] Loop started");
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        if (worker == null) {
            return;
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Moderation] Loop did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Moderation] Loop stopped");
    }

    public boolean isRunning() {
        return running;
    }

    void run() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                runIteration();
            } catch (OracleUnavailableException e) {
                handleOracleFailure(e);
                return;
            } catch (StorageException e) {
                log.error("[Moderation] State write failed, batch will be reprocessed", e);
                sleepSeconds(properties.getTelegram().getRetryDelaySeconds());
            } catch (RuntimeException e) {
                log.error("[Moderation] Unexpected error in moderation loop", e);
                sleepSeconds(properties.getTelegram().getRetryDelaySeconds());
            }
        }
    }

    /**
     * One pass of the loop.
     *
     * @return number of events reconciled
     * @throws OracleUnavailableException
     *             if the verification store is unreachable; the cursor is not
     *             advanced
     * @throws StorageException
     *             if a state file write failed; the cursor is not advanced
     */
    public int runIteration() {
        ledgerPruningService.pruneIfDue();

        ReconciliationState state = new ReconciliationState(groupRegistry.load(), restrictionLedger.load());
        long cursor = cursorStore.load();

        UpdateBatch batch = updateSource.fetch(cursor);
        if (batch.isEmpty()) {
            return 0;
        }

        for (ModerationEvent event : batch.events()) {
            log.trace("[Moderation] Reconciling {}", event);
            reconciler.reconcile(event, state);
        }

        long nextCursor = Math.max(cursor, batch.lastUpdateId());
        if (nextCursor > cursor) {
            cursorStore.store(nextCursor);
        }
        log.debug("[Moderation] Batch done: {} events, cursor {} -> {}", batch.events().size(), cursor, nextCursor);
        return batch.events().size();
    }

    private void handleOracleFailure(OracleUnavailableException e) {
        int pauseSeconds = properties.getOracle().getFailurePauseSeconds();
        log.error("[Moderation] Verification database unavailable: {}", e.getMessage(), e);
        log.info("[Moderation] Exiting in {} seconds for a clean restart", pauseSeconds);
        sleepSeconds(pauseSeconds);
        running = false;
        processExitService.exit(ORACLE_FAILURE_EXIT_CODE, "verification database unavailable");
    }

    void sleepSeconds(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
