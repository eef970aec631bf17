package com.swapengine.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

/** Work item placed on the order queue by the submission layer. */
public record OrderSubmittedV1(
    String orderId, String tokenIn, String tokenOut, BigDecimal amount, Instant submittedAt) {}
