package com.adaptivetrader.persistence;

import com.adaptivetrader.core.engine.TradingEngine;
import com.adaptivetrader.event.PositionEvent;
import com.adaptivetrader.exception.PersistenceException;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps pattern memory and open positions on disk across restarts.
 *
 * <p>Loads once the application is ready and saves on shutdown. Position events only mark
 * the state dirty; the write happens on the scheduler thread in {@link #flush}, never on
 * the thread that holds the engine lock. Does nothing when
 * {@code adaptivetrader.persistence.enabled} is false.
 */
@Service
public class EngineStatePersistenceService {

    private static final Logger log = LoggerFactory.getLogger(EngineStatePersistenceService.class);

    private final PersistenceConfig persistenceConfig;
    private final EngineStateStore engineStateStore;
    private final TradingEngine tradingEngine;
    private final Clock clock;

    private final AtomicBoolean dirty = new AtomicBoolean(false);

    public EngineStatePersistenceService(
            PersistenceConfig persistenceConfig,
            EngineStateStore engineStateStore,
            TradingEngine tradingEngine,
            Clock clock) {
        this.persistenceConfig = persistenceConfig;
        this.engineStateStore = engineStateStore;
        this.tradingEngine = tradingEngine;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restoreOnStartup() {
        if (!persistenceConfig.isEnabled()) {
            log.info("Engine state persistence disabled");
            return;
        }
        engineStateStore.load().ifPresent(tradingEngine::restoreState);
    }

    @EventListener
    @Order(30)
    public void onPositionEvent(PositionEvent event) {
        if (persistenceConfig.isEnabled()) {
            dirty.set(true);
        }
    }

    @Scheduled(fixedDelayString = "${adaptivetrader.persistence.flush-interval:PT1M}")
    public void flush() {
        if (!persistenceConfig.isEnabled() || !dirty.getAndSet(false)) {
            return;
        }
        try {
            engineStateStore.save(snapshot());
        } catch (PersistenceException e) {
            dirty.set(true);
            log.error("Engine state flush failed, will retry: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        if (!persistenceConfig.isEnabled()) {
            return;
        }
        engineStateStore.save(snapshot());
        log.info("Engine state saved on shutdown to {}", persistenceConfig.getFile());
    }

    EngineState snapshot() {
        return tradingEngine.captureState(LocalDateTime.now(clock));
    }
}
