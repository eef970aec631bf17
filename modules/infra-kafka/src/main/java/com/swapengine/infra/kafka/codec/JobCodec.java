package com.swapengine.infra.kafka.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.swapengine.infra.kafka.contract.JobEnvelope;
import com.swapengine.infra.kafka.contract.MalformedJobException;

/**
 * JSON form of {@link JobEnvelope}. Instants are ISO-8601 strings, decimals stay {@code
 * BigDecimal}, and unknown properties are ignored so newer producers do not break older workers.
 */
public class JobCodec {
  private final ObjectMapper objectMapper;

  public JobCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static JobCodec withDefaults() {
    return new JobCodec(defaultObjectMapper());
  }

  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
  }

  public String encode(JobEnvelope<?> job) {
    try {
      return objectMapper.writeValueAsString(job);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Job " + job.jobId() + " could not be serialized", ex);
    }
  }

  public <T> JobEnvelope<T> decode(String json, Class<T> payloadType) {
    if (json == null || json.isBlank()) {
      throw new MalformedJobException("Job record has an empty body");
    }
    JavaType jobType =
        objectMapper.getTypeFactory().constructParametricType(JobEnvelope.class, payloadType);
    try {
      return objectMapper.readValue(json, jobType);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new MalformedJobException("Job body is not a valid " + payloadType.getSimpleName(), ex);
    }
  }
}
