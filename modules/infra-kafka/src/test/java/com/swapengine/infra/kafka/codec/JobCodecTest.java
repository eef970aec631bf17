package com.swapengine.infra.kafka.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.MalformedJobException;
import com.swapengine.infra.kafka.contract.payload.OrderSubmittedV1;
import com.swapengine.infra.kafka.support.Jobs;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class JobCodecTest {
  private final JobCodec codec = JobCodec.withDefaults();

  @Test
  void encodesInstantsAsIsoStrings() {
    String json = codec.encode(Jobs.orderSubmitted("ord-1"));

    assertTrue(json.contains("\"enqueuedAt\":\"2026-03-01T12:00:00Z\""), json);
    assertTrue(json.contains("\"orderId\":\"ord-1\""), json);
  }

  @Test
  void decodesPayloadWithExactAmount() {
    JobEnvelope<OrderSubmittedV1> job = Jobs.orderSubmitted("ord-1");

    JobEnvelope<OrderSubmittedV1> decoded =
        codec.decode(codec.encode(job), OrderSubmittedV1.class);

    assertEquals(job.jobId(), decoded.jobId());
    assertEquals(new BigDecimal("100.25"), decoded.payload().amount());
    assertEquals(Jobs.SUBMITTED_AT, decoded.payload().submittedAt());
  }

  @Test
  void ignoresPropertiesAddedByNewerProducers() {
    String json =
        codec.encode(Jobs.orderSubmitted("ord-1")).replaceFirst("\\{", "{\"priority\":7,");

    JobEnvelope<OrderSubmittedV1> decoded = codec.decode(json, OrderSubmittedV1.class);

    assertEquals("ord-1", decoded.orderId());
  }

  @Test
  void rejectsUnreadableBodies() {
    assertThrows(MalformedJobException.class, () -> codec.decode("{not-json", OrderSubmittedV1.class));
    assertThrows(MalformedJobException.class, () -> codec.decode(" ", OrderSubmittedV1.class));
    assertThrows(
        MalformedJobException.class,
        () -> codec.decode("{\"jobType\":\"OrderSubmitted\"}", OrderSubmittedV1.class));
  }
}
