package com.adaptivetrader.persistence;

import com.adaptivetrader.domain.model.PatternReportEntry;
import com.adaptivetrader.domain.model.Position;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The persisted document: pattern table and open positions. Trade history and risk
 * metrics are rebuilt at runtime and are not stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineState {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private LocalDateTime savedAt;

    @Builder.Default
    private List<PatternReportEntry> patterns = new ArrayList<>();

    @Builder.Default
    private List<Position> positions = new ArrayList<>();
}
