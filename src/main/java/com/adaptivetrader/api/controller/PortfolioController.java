package com.adaptivetrader.api.controller;

import com.adaptivetrader.core.engine.TradingEngine;
import com.adaptivetrader.domain.model.PortfolioSummary;
import com.adaptivetrader.domain.model.Position;
import com.adaptivetrader.domain.model.RiskMetrics;
import com.adaptivetrader.domain.model.TradeRecord;
import com.adaptivetrader.ledger.PositionLedger;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the book and risk state.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/portfolio/summary -- open count, exposure, unrealized and realized P&L</li>
 *   <li>GET /api/portfolio/positions -- open positions</li>
 *   <li>GET /api/portfolio/trades -- closed trade history</li>
 *   <li>GET /api/portfolio/risk -- current risk metrics</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/portfolio")
public class PortfolioController {

    private final TradingEngine tradingEngine;
    private final PositionLedger positionLedger;

    public PortfolioController(TradingEngine tradingEngine, PositionLedger positionLedger) {
        this.tradingEngine = tradingEngine;
        this.positionLedger = positionLedger;
    }

    @GetMapping("/summary")
    public ResponseEntity<PortfolioSummary> summary() {
        return ResponseEntity.ok(tradingEngine.portfolioSummary());
    }

    @GetMapping("/positions")
    public ResponseEntity<List<Position>> positions() {
        return ResponseEntity.ok(positionLedger.openPositions());
    }

    @GetMapping("/trades")
    public ResponseEntity<List<TradeRecord>> trades() {
        return ResponseEntity.ok(positionLedger.tradeHistory());
    }

    @GetMapping("/risk")
    public ResponseEntity<RiskMetrics> risk() {
        return ResponseEntity.ok(tradingEngine.riskMetrics());
    }
}
