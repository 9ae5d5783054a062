package com.botstate.session;

import com.botstate.config.SessionConfig;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs one state cycle when the application is ready, if enabled with
 * {@code botstate.session.run-on-startup}. Failures are logged and leave the snapshot
 * at its previous revision.
 */
@Component
public class StartupCycleRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupCycleRunner.class);

    private final StateSessionService stateSessionService;
    private final SessionConfig sessionConfig;

    public StartupCycleRunner(StateSessionService stateSessionService, SessionConfig sessionConfig) {
        this.stateSessionService = stateSessionService;
        this.sessionConfig = sessionConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!sessionConfig.isRunOnStartup()) {
            log.debug("[SESSION] Startup cycle disabled");
            return;
        }
        Set<String> targets = new TreeSet<>(sessionConfig.getRebalanceTargets());
        log.info("[SESSION] Starting startup cycle, rebalanceTargets={}", targets);
        try {
            SessionCycleResult result = stateSessionService.runCycle(targets);
            log.info(
                    "[SESSION] Startup cycle completed: {} mismatches, persist={}, revision={}, duration={}ms",
                    result.getReconciliation().getTotalMismatches(),
                    result.getPersist().getStatus(),
                    result.getPersist().getRevision(),
                    result.getDurationMs());
        } catch (RuntimeException e) {
            log.error("[SESSION] Startup cycle failed", e);
        }
    }
}
