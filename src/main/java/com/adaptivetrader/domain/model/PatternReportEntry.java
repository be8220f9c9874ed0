package com.adaptivetrader.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One row of the pattern report: the pattern, a copy of its stats, its win rate
 * (null when the pattern has no outcomes yet) and the mean weight of its signals.
 */
@Value
@Builder
@Jacksonized
public class PatternReportEntry {

    Pattern pattern;
    PatternStats stats;
    Double winRate;
    Double tradeScore;
}
