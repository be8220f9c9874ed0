package com.adaptivetrader.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.List;
import lombok.Data;

/**
 * Signal set plus market context for one trade evaluation.
 */
@Data
public class EvaluateTradeRequest {

    @NotBlank
    private String symbol;

    @NotNull
    private List<String> signals;

    @NotNull
    @Positive
    private BigDecimal capital;

    /** Reference price used for sizing and as the paper fill price. */
    @NotNull
    @Positive
    private BigDecimal price;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double signalStrength;

    @PositiveOrZero
    private double volatility;

    @Positive
    private double atr;
}
