package com.swapengine.infra.kafka.contract;

import java.nio.charset.StandardCharsets;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;

/** Kafka headers carried by every job record, readable without decoding the body. */
public final class JobHeaders {
  public static final String JOB_ID = "x-job-id";
  public static final String JOB_TYPE = "x-job-type";
  public static final String JOB_VERSION = "x-job-version";
  public static final String ORDER_ID = "x-order-id";
  public static final String CONTENT_TYPE = "content-type";
  public static final String APPLICATION_JSON = "application/json";

  private JobHeaders() {}

  public static void stamp(Headers headers, JobEnvelope<?> job) {
    put(headers, JOB_ID, job.jobId().toString());
    put(headers, JOB_TYPE, job.jobType());
    put(headers, JOB_VERSION, Integer.toString(job.schemaVersion()));
    put(headers, ORDER_ID, job.orderId());
    put(headers, CONTENT_TYPE, APPLICATION_JSON);
  }

  public static void put(Headers headers, String name, String value) {
    headers.remove(name);
    headers.add(name, value.getBytes(StandardCharsets.UTF_8));
  }

  public static String read(Headers headers, String name) {
    Header header = headers.lastHeader(name);
    if (header == null || header.value() == null) {
      return null;
    }
    return new String(header.value(), StandardCharsets.UTF_8);
  }

  public static String require(Headers headers, String name) {
    String value = read(headers, name);
    if (value == null || value.isBlank()) {
      throw new MalformedJobException("Missing required header: " + name);
    }
    return value;
  }

  public static int requireVersion(Headers headers) {
    String raw = require(headers, JOB_VERSION);
    int version;
    try {
      version = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new MalformedJobException("Header " + JOB_VERSION + " is not a number: " + raw);
    }
    if (version < 1) {
      throw new MalformedJobException("Header " + JOB_VERSION + " must be >= 1");
    }
    return version;
  }
}
