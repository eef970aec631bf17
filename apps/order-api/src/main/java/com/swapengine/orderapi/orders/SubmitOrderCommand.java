package com.swapengine.orderapi.orders;

import java.math.BigDecimal;

public record SubmitOrderCommand(String tokenIn, String tokenOut, BigDecimal amount) {}
