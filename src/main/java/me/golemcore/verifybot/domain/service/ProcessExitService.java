package me.golemcore.verifybot.domain.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Terminates the daemon so the process supervisor restarts it with freshly
 * loaded state.
 */
@Service
@Slf4j
public class ProcessExitService {

    @SuppressWarnings({ "PMD.DoNotTerminateVM", "java:S1147" })
    public void exit(int statusCode, String reason) {
        log.warn("[Moderation] Terminating with status {}: {}", statusCode, reason);
        System.exit(statusCode); // NOSONAR
    }
}
