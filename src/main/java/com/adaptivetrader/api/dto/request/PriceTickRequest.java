package com.adaptivetrader.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

@Data
public class PriceTickRequest {

    @NotBlank
    private String symbol;

    @NotNull
    @Positive
    private BigDecimal price;
}
