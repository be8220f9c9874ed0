package com.adaptivetrader.unit.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.adaptivetrader.core.engine.TradingEngine;
import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.event.PositionEvent;
import com.adaptivetrader.event.PositionEventType;
import com.adaptivetrader.exception.PersistenceException;
import com.adaptivetrader.persistence.EngineState;
import com.adaptivetrader.persistence.EngineStatePersistenceService;
import com.adaptivetrader.persistence.EngineStateStore;
import com.adaptivetrader.persistence.PersistenceConfig;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EngineStatePersistenceServiceTest {

    @Mock
    private EngineStateStore engineStateStore;

    @Mock
    private TradingEngine tradingEngine;

    private PersistenceConfig config;
    private EngineStatePersistenceService service;

    @BeforeEach
    void setUp() {
        config = new PersistenceConfig();
        config.setEnabled(true);
        service = new EngineStatePersistenceService(
                config, engineStateStore, tradingEngine, Clock.systemUTC());
    }

    @Test
    @DisplayName("Startup hands the stored state to the engine")
    void restoresOnStartup() {
        EngineState state = EngineState.builder().build();
        when(engineStateStore.load()).thenReturn(Optional.of(state));

        service.restoreOnStartup();

        verify(tradingEngine).restoreState(state);
    }

    @Test
    @DisplayName("Closed position only marks state dirty; the next flush writes it")
    void closeDefersWriteToFlush() {
        service.onPositionEvent(new PositionEvent(this, new Position(), PositionEventType.CLOSED));

        verify(engineStateStore, never()).save(any());
        verifyNoInteractions(tradingEngine);

        when(tradingEngine.captureState(any())).thenAnswer(invocation -> EngineState.builder()
                .savedAt(invocation.getArgument(0))
                .build());
        service.flush();
        service.flush();

        ArgumentCaptor<EngineState> captor = ArgumentCaptor.forClass(EngineState.class);
        verify(engineStateStore, times(1)).save(captor.capture());
        assertThat(captor.getValue().getSavedAt()).isNotNull();
    }

    @Test
    @DisplayName("Failed flush keeps the state dirty and retries on the next run")
    void failedFlushRetries() {
        when(tradingEngine.captureState(any())).thenReturn(EngineState.builder().build());
        doThrow(new PersistenceException("Cannot write engine state", new IOException("disk full")))
                .doNothing()
                .when(engineStateStore)
                .save(any());

        service.onPositionEvent(new PositionEvent(this, new Position(), PositionEventType.OPENED));
        service.flush();
        service.flush();

        verify(engineStateStore, times(2)).save(any());
    }

    @Test
    @DisplayName("Scheduled flush skips the write when nothing changed")
    void flushSkipsWhenClean() {
        service.flush();

        verify(engineStateStore, never()).save(any());
    }

    @Test
    @DisplayName("Disabled persistence never touches the store")
    void disabled() {
        config.setEnabled(false);

        service.restoreOnStartup();
        service.onPositionEvent(new PositionEvent(this, new Position(), PositionEventType.CLOSED));
        service.saveOnShutdown();

        verifyNoInteractions(engineStateStore);
    }
}
