package com.swapengine.orderapi.api;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

public record ExecuteOrderRequest(
    @NotBlank String tokenIn,
    @NotBlank String tokenOut,
    @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal amount) {}
