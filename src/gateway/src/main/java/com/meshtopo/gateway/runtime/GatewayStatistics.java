package com.meshtopo.gateway.runtime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Running message and delivery counters, exported to Micrometer and logged periodically. */
@Component
public class GatewayStatistics {
  private static final Logger log = LoggerFactory.getLogger(GatewayStatistics.class);

  private final Clock clock;
  private final Counter received;
  private final Counter processed;
  private final Counter malformed;
  private final Counter errors;
  private final Counter rejected;
  private final Counter positionsSent;
  private final Counter positionsFailed;
  private volatile Instant startedAt;

  @Autowired
  public GatewayStatistics(MeterRegistry meterRegistry) {
    this(meterRegistry, Clock.systemUTC());
  }

  GatewayStatistics(MeterRegistry meterRegistry, Clock clock) {
    this.clock = clock;
    this.received = meterRegistry.counter("gateway.messages.received");
    this.processed = meterRegistry.counter("gateway.messages.processed");
    this.malformed = meterRegistry.counter("gateway.messages.malformed");
    this.errors = meterRegistry.counter("gateway.messages.errors");
    this.rejected = meterRegistry.counter("gateway.messages.rejected");
    this.positionsSent = meterRegistry.counter("gateway.messages.positions", "outcome", "sent");
    this.positionsFailed = meterRegistry.counter("gateway.messages.positions", "outcome", "failed");
  }

  /**
   * Point-in-time copy of the counters.
   *
   * @param uptime time since {@link #markStarted()}, zero before it
   */
  public record Snapshot(
    long messagesReceived,
    long messagesProcessed,
    long malformedMessages,
    long errors,
    long policyRejections,
    long positionUpdatesSent,
    long positionUpdatesFailed,
    Duration uptime
  ) {}

  public void markStarted() {
    startedAt = clock.instant();
  }

  public void messageReceived() {
    received.increment();
  }

  public void messageProcessed() {
    processed.increment();
  }

  public void malformedMessage() {
    malformed.increment();
  }

  public void error() {
    errors.increment();
  }

  public void policyRejection() {
    rejected.increment();
  }

  public void positionUpdate(boolean delivered) {
    if (delivered) {
      positionsSent.increment();
    } else {
      positionsFailed.increment();
    }
  }

  public Snapshot snapshot() {
    Instant started = startedAt;
    Duration uptime = started == null ? Duration.ZERO : Duration.between(started, clock.instant());
    return new Snapshot(
        (long) received.count(),
        (long) processed.count(),
        (long) malformed.count(),
        (long) errors.count(),
        (long) rejected.count(),
        (long) positionsSent.count(),
        (long) positionsFailed.count(),
        uptime);
  }

  @Scheduled(
      fixedDelayString = "${gateway.stats.log-interval-ms:60000}",
      initialDelayString = "${gateway.stats.log-interval-ms:60000}")
  public void logStatistics() {
    if (startedAt == null) {
      return;
    }
    Snapshot snapshot = snapshot();
    log.info(
        "Statistics - uptime={}s received={} processed={} malformed={} rejected={} positionsSent={} positionsFailed={} errors={}",
        snapshot.uptime().toSeconds(),
        snapshot.messagesReceived(),
        snapshot.messagesProcessed(),
        snapshot.malformedMessages(),
        snapshot.policyRejections(),
        snapshot.positionUpdatesSent(),
        snapshot.positionUpdatesFailed(),
        snapshot.errors());
  }
}
