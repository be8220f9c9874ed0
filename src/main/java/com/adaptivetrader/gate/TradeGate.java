package com.adaptivetrader.gate;

import com.adaptivetrader.domain.enums.DecisionReason;
import com.adaptivetrader.domain.enums.UnseenPatternPolicy;
import com.adaptivetrader.domain.model.Pattern;
import com.adaptivetrader.domain.model.PatternStats;
import com.adaptivetrader.pattern.PatternMemory;
import java.util.Collection;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a signal set may trade, based on the pattern's history.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>At least {@code minSignals} distinct signals, else INSUFFICIENT_SIGNALS</li>
 *   <li>Unseen pattern: approve as NEW_PATTERN (or reject under the DENY policy)</li>
 *   <li>Fewer than {@code minSampleSize} outcomes: approve as EXPLORING</li>
 *   <li>Win rate below {@code minWinRate}: LOW_WIN_RATE</li>
 *   <li>Loss streak at or above {@code maxConsecutiveLosses}: CONSECUTIVE_LOSSES</li>
 *   <li>Otherwise PATTERN_QUALIFIED</li>
 * </ol>
 *
 * <p>Missing history approves by default (fail-open) so new patterns can be learned.
 * The gate only reads pattern memory; outcomes are recorded by the position ledger.
 */
@Component
public class TradeGate {

    private static final Logger log = LoggerFactory.getLogger(TradeGate.class);

    private final PatternMemory patternMemory;
    private final TradeGateConfig tradeGateConfig;

    public TradeGate(PatternMemory patternMemory, TradeGateConfig tradeGateConfig) {
        this.patternMemory = patternMemory;
        this.tradeGateConfig = tradeGateConfig;
    }

    public GateResult evaluate(Collection<String> signals) {
        Pattern pattern = patternMemory.identify(signals);

        if (pattern.size() < tradeGateConfig.getMinSignals()) {
            log.debug("Gate rejected {}: {} signals < {}", pattern, pattern.size(), tradeGateConfig.getMinSignals());
            return GateResult.rejected(
                    DecisionReason.INSUFFICIENT_SIGNALS,
                    pattern,
                    "Only " + pattern.size() + " signals, minimum is " + tradeGateConfig.getMinSignals());
        }

        Optional<PatternStats> maybeStats = patternMemory.stats(pattern);
        if (maybeStats.isEmpty() || maybeStats.get().getTotalObservations() == 0) {
            if (tradeGateConfig.getUnseenPatternPolicy() == UnseenPatternPolicy.DENY) {
                return GateResult.rejected(
                        DecisionReason.UNSEEN_PATTERN, pattern, "Pattern has no history and unseen patterns are denied");
            }
            return GateResult.approved(DecisionReason.NEW_PATTERN, pattern, "New pattern, exploring");
        }

        PatternStats stats = maybeStats.get();
        int observations = stats.getTotalObservations();
        if (observations < tradeGateConfig.getMinSampleSize()) {
            return GateResult.approved(
                    DecisionReason.EXPLORING,
                    pattern,
                    "Pattern has " + observations + " of " + tradeGateConfig.getMinSampleSize() + " samples");
        }

        double winRate = stats.getWinRate().orElse(0.0);
        if (winRate < tradeGateConfig.getMinWinRate()) {
            log.info("Gate rejected {}: win rate {} < {}", pattern, winRate, tradeGateConfig.getMinWinRate());
            return GateResult.rejected(
                    DecisionReason.LOW_WIN_RATE,
                    pattern,
                    String.format("Win rate %.2f below minimum %.2f", winRate, tradeGateConfig.getMinWinRate()));
        }

        if (stats.getConsecutiveLosses() >= tradeGateConfig.getMaxConsecutiveLosses()) {
            log.info("Gate rejected {}: {} consecutive losses", pattern, stats.getConsecutiveLosses());
            return GateResult.rejected(
                    DecisionReason.CONSECUTIVE_LOSSES,
                    pattern,
                    stats.getConsecutiveLosses() + " consecutive losses, limit is "
                            + tradeGateConfig.getMaxConsecutiveLosses());
        }

        return GateResult.approved(
                DecisionReason.PATTERN_QUALIFIED, pattern, String.format("Win rate %.2f over %d trades", winRate, observations));
    }
}
