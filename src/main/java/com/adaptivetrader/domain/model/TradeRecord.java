package com.adaptivetrader.domain.model;

import com.adaptivetrader.domain.enums.ExitReason;
import com.adaptivetrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only history entry written when a position closes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRecord {

    private String positionId;
    private String symbol;
    private PositionSide side;
    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private BigDecimal quantity;
    private BigDecimal realizedPnl;

    /** Realized P&L as a percentage of entry notional. */
    private BigDecimal returnPercent;

    private ExitReason exitReason;
    private LocalDateTime entryTime;
    private LocalDateTime exitTime;
    private Duration holdingTime;
    private Pattern pattern;

    public boolean isWin() {
        return realizedPnl != null && realizedPnl.signum() > 0;
    }
}
