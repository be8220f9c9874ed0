package com.adaptivetrader.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Manual close of the open position on a symbol at the given price.
 */
@Data
public class ClosePositionRequest {

    @NotNull
    @Positive
    private BigDecimal exitPrice;
}
