package com.adaptivetrader.api.controller;

import com.adaptivetrader.core.engine.TradingEngine;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PatternReportEntry;
import com.adaptivetrader.domain.model.PatternStats;
import com.adaptivetrader.domain.model.SignalScoreReport;
import com.adaptivetrader.exception.ResourceNotFoundException;
import com.adaptivetrader.pattern.PatternMemory;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pattern memory report and per-signal weights.
 *
 * <p>Single patterns are looked up by their signals, one {@code signals} parameter per label,
 * e.g. {@code /api/patterns/lookup?signals=MACD_CROSS&signals=RSI_LOW&signals=VOL_SPIKE}.
 * Order and case do not matter.
 */
@RestController
@RequestMapping("/api/patterns")
public class PatternController {

    private final TradingEngine tradingEngine;
    private final PatternMemory patternMemory;

    public PatternController(TradingEngine tradingEngine, PatternMemory patternMemory) {
        this.tradingEngine = tradingEngine;
        this.patternMemory = patternMemory;
    }

    @GetMapping
    public ResponseEntity<List<PatternReportEntry>> report() {
        return ResponseEntity.ok(tradingEngine.patternReport());
    }

    @GetMapping("/signals")
    public ResponseEntity<SignalScoreReport> signals() {
        return ResponseEntity.ok(patternMemory.signalReport());
    }

    @GetMapping("/lookup")
    public ResponseEntity<PatternStats> pattern(@RequestParam("signals") List<String> signals) {
        Pattern pattern = Pattern.of(signals);
        return ResponseEntity.ok(patternMemory
                .stats(pattern)
                .orElseThrow(() -> new ResourceNotFoundException("Pattern", pattern.key())));
    }
}
