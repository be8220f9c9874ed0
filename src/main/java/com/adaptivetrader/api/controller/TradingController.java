package com.adaptivetrader.api.controller;

import com.adaptivetrader.api.dto.request.ClosePositionRequest;
import com.adaptivetrader.api.dto.request.EvaluateTradeRequest;
import com.adaptivetrader.api.dto.request.PriceTickRequest;
import com.adaptivetrader.core.engine.TradingEngine;
import com.adaptivetrader.domain.model.MarketContext;
import com.adaptivetrader.domain.model.TradeDecision;
import com.adaptivetrader.domain.model.TradeRecord;
import com.adaptivetrader.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints that drive the engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/trading/evaluate -- evaluate a signal set, opening a position when approved</li>
 *   <li>POST /api/trading/ticks -- feed a price tick, returns trades closed by it</li>
 *   <li>POST /api/trading/positions/{symbol}/close -- manual close at a given price</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trading")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    private final TradingEngine tradingEngine;

    public TradingController(TradingEngine tradingEngine) {
        this.tradingEngine = tradingEngine;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<TradeDecision> evaluate(@Valid @RequestBody EvaluateTradeRequest request) {
        MarketContext context = MarketContext.builder()
                .price(request.getPrice())
                .signalStrength(request.getSignalStrength())
                .volatility(request.getVolatility())
                .atr(request.getAtr())
                .build();
        TradeDecision decision =
                tradingEngine.evaluateTrade(request.getSymbol(), request.getSignals(), request.getCapital(), context);
        return ResponseEntity.ok(decision);
    }

    @PostMapping("/ticks")
    public ResponseEntity<List<TradeRecord>> tick(@Valid @RequestBody PriceTickRequest request) {
        return ResponseEntity.ok(tradingEngine.onPriceTick(request.getSymbol(), request.getPrice()));
    }

    @PostMapping("/positions/{symbol}/close")
    public ResponseEntity<TradeRecord> close(
            @PathVariable String symbol, @Valid @RequestBody ClosePositionRequest request) {
        log.info("Manual close requested for {} @ {}", symbol, request.getExitPrice());
        TradeRecord record = tradingEngine
                .closePosition(symbol, request.getExitPrice())
                .orElseThrow(() -> new ResourceNotFoundException("Open position", symbol));
        return ResponseEntity.ok(record);
    }
}
