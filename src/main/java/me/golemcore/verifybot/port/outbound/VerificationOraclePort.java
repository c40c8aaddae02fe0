package me.golemcore.verifybot.port.outbound;

import me.golemcore.verifybot.domain.model.VerifiedIdentity;

import java.util.Optional;

/**
 * Read-only view of the verification records written by the web flow.
 */
public interface VerificationOraclePort {

    /**
     * @return the linked identity if the platform user is verified
     * @throws me.golemcore.verifybot.domain.model.OracleUnavailableException
     *             if the record store cannot be queried
     */
    Optional<VerifiedIdentity> findVerifiedIdentity(long telegramUserId);

    default boolean isVerified(long telegramUserId) {
        return findVerifiedIdentity(telegramUserId).isPresent();
    }
}
