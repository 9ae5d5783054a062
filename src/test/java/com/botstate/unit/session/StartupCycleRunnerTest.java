package com.botstate.unit.session;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.botstate.config.SessionConfig;
import com.botstate.domain.enums.PersistStatus;
import com.botstate.domain.model.ReconciliationResult;
import com.botstate.exception.ConflictException;
import com.botstate.session.SessionCycleResult;
import com.botstate.session.StartupCycleRunner;
import com.botstate.session.StateSessionService;
import com.botstate.snapshot.PersistResult;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StartupCycleRunnerTest {

    @Mock
    private StateSessionService stateSessionService;

    private SessionConfig sessionConfig;
    private StartupCycleRunner startupCycleRunner;

    @BeforeEach
    void setUp() {
        sessionConfig = new SessionConfig();
        startupCycleRunner = new StartupCycleRunner(stateSessionService, sessionConfig);
    }

    @Test
    @DisplayName("does nothing unless enabled")
    void disabledByDefault() {
        startupCycleRunner.onApplicationReady();

        verify(stateSessionService, never()).runCycle(any());
    }

    @Test
    @DisplayName("runs one cycle with the configured rebalance targets")
    void runsCycle() {
        sessionConfig.setRunOnStartup(true);
        sessionConfig.setRebalanceTargets(List.of("035720", "005930"));
        when(stateSessionService.runCycle(Set.of("005930", "035720"))).thenReturn(SessionCycleResult.builder()
                .reconciliation(ReconciliationResult.builder().build())
                .persist(PersistResult.builder().status(PersistStatus.NO_CHANGES).revision("rev-1").build())
                .build());

        startupCycleRunner.onApplicationReady();

        verify(stateSessionService).runCycle(Set.of("005930", "035720"));
    }

    @Test
    @DisplayName("a failed cycle is logged and does not stop the application")
    void failureIsContained() {
        sessionConfig.setRunOnStartup(true);
        when(stateSessionService.runCycle(any())).thenThrow(new ConflictException("rev-1", "rev-2"));

        startupCycleRunner.onApplicationReady();

        verify(stateSessionService).runCycle(Set.of());
    }
}
