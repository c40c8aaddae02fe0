package me.golemcore.verifybot.adapter.outbound.verification;

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

import me.golemcore.verifybot.domain.model.OracleUnavailableException;
import me.golemcore.verifybot.domain.model.VerifiedIdentity;
import me.golemcore.verifybot.port.outbound.VerificationOraclePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Verification oracle backed by the {@code verifications} table of the web
 * flow.
 *
 * <p>
 * A row counts as verified when its {@code w_id} (linked wiki user id) is not
 * null. Any database error is reported as {@link OracleUnavailableException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcVerificationOracle implements VerificationOraclePort {

    static final String SELECT_BY_TELEGRAM_ID_SQL = "SELECT t_id, w_id, w_username FROM verifications "
            + "WHERE t_id = ? AND w_id IS NOT NULL";

    private static final RowMapper<VerifiedIdentity> ROW_MAPPER = (rs, rowNum) -> new VerifiedIdentity(
            rs.getLong("t_id"),
            rs.getLong("w_id"),
            rs.getString("w_username"));

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<VerifiedIdentity> findVerifiedIdentity(long telegramUserId) {
        List<VerifiedIdentity> rows;
        try {
            rows = jdbcTemplate.query(SELECT_BY_TELEGRAM_ID_SQL, ROW_MAPPER, telegramUserId);
        } catch (DataAccessException e) {
            throw new OracleUnavailableException("Verification lookup failed for user " + telegramUserId, e);
        }
        if (rows.isEmpty()) {
            log.trace("[Oracle] No linked identity for user {}", telegramUserId);
            return Optional.empty();
        }
        return Optional.of(rows.get(0));
    }
}
