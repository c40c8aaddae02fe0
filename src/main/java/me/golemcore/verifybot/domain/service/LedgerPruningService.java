package me.golemcore.verifybot.domain.service;

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
import me.golemcore.verifybot.port.outbound.VerificationOraclePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drops restriction ledger entries of users who completed verification since
 * they were restricted, so their messages stop being deleted.
 *
 * <p>
 * Only the ledger hint is touched; lifting the platform restriction stays with
 * the verification web flow. Runs at most once per
 * {@code bot.ledger.prune-interval}, the first time on the first iteration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerPruningService {

    private final RestrictionLedgerPort restrictionLedger;
    private final VerificationOraclePort verificationOracle;
    private final BotProperties properties;
    private final Clock clock;

    private Instant lastRun;

    /**
     * @return number of entries removed, 0 when pruning is not due
     */
    public int pruneIfDue() {
        Duration interval = properties.getLedger().getPruneInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return 0;
        }
        Instant now = clock.instant();
        if (lastRun != null && now.isBefore(lastRun.plus(interval))) {
            return 0;
        }
        lastRun = now;
        return prune();
    }

    int prune() {
        int removed = 0;
        for (Long userId : restrictionLedger.load()) {
            if (verificationOracle.isVerified(userId) && restrictionLedger.remove(userId)) {
                log.info("[Moderation] Pruned verified user {} from restricted users list", userId);
                removed++;
            }
        }
        log.debug("[Moderation] Ledger pruning removed {} entries", removed);
        return removed;
    }
}
