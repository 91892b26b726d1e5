package com.meshtopo.gateway.mqtt;

import com.meshtopo.gateway.config.GatewayProperties;
import com.meshtopo.gateway.support.LogSanitizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a subscription alive and feeds its messages to an {@link InboundHandler}.
 *
 * <p>The loop runs on one dedicated thread, so messages are handled strictly in arrival order. A
 * lost or refused connection is retried with exponential backoff (reset after every successful
 * subscribe); a message that fails to process is logged and skipped. Only {@link #stop()} ends the
 * loop.
 */
public class MqttIngestLoop {
  private static final Logger log = LoggerFactory.getLogger(MqttIngestLoop.class);

  public enum State {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    STOPPED
  }

  private final SubscriptionTransport transport;
  private final InboundHandler handler;
  private final String topicFilter;
  private final Duration pollTimeout;
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final ExecutorService executor;
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
  private final AtomicReference<InboundStream> currentStream = new AtomicReference<>();
  private final AtomicInteger connected;
  private final Counter reconnectCounter;
  private final Counter handlerFailureCounter;

  public MqttIngestLoop(
      SubscriptionTransport transport,
      InboundHandler handler,
      GatewayProperties.Mqtt properties,
      MeterRegistry meterRegistry) {
    this.transport = transport;
    this.handler = handler;
    this.topicFilter = properties.getTopic();
    this.pollTimeout = Duration.ofMillis(Math.max(1L, properties.getPollTimeoutMs()));
    this.initialDelayMs = Math.max(1L, properties.getReconnect().getInitialDelayMs());
    this.maxDelayMs = Math.max(initialDelayMs, properties.getReconnect().getMaxDelayMs());
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "mqtt-ingest");
      thread.setDaemon(true);
      return thread;
    });
    this.connected = meterRegistry.gauge("gateway.mqtt.connected", new AtomicInteger(0));
    this.reconnectCounter = meterRegistry.counter("gateway.mqtt.reconnects");
    this.handlerFailureCounter = meterRegistry.counter("gateway.mqtt.handler.failures");
  }

  /** Runs {@link #run()} on the ingest thread. Later calls are ignored. */
  public void start() {
    if (stopSignal.getCount() == 0 || !started.compareAndSet(false, true)) {
      return;
    }
    executor.submit(this::run);
  }

  /** Ends the loop, closes the live subscription and waits briefly for the ingest thread. */
  public void stop() {
    stopSignal.countDown();
    InboundStream stream = currentStream.getAndSet(null);
    if (stream != null) {
      stream.close();
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ignored) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    state.set(State.STOPPED);
  }

  public State state() {
    return state.get();
  }

  /** The connect/subscribe/consume cycle. Returns only once {@link #stop()} has been called. */
  public void run() {
    long delayMs = initialDelayMs;
    while (!isStopping()) {
      state.set(State.CONNECTING);
      InboundStream stream;
      try {
        stream = transport.open(topicFilter);
      } catch (TransportException ex) {
        state.set(State.DISCONNECTED);
        log.warn(
            "MQTT connection to {} failed: {}; retrying in {} ms",
            transport.describe(),
            LogSanitizer.sanitize(rootMessage(ex)),
            delayMs);
        if (!pause(delayMs)) {
          break;
        }
        delayMs = Math.min(maxDelayMs, delayMs * 2);
        continue;
      } catch (RuntimeException ex) {
        state.set(State.DISCONNECTED);
        log.error("Unexpected error connecting to {}; retrying in {} ms", transport.describe(), delayMs, ex);
        if (!pause(delayMs)) {
          break;
        }
        delayMs = Math.min(maxDelayMs, delayMs * 2);
        continue;
      }

      currentStream.set(stream);
      if (isStopping()) {
        closeStream(stream);
        break;
      }
      state.set(State.SUBSCRIBED);
      connected.set(1);
      delayMs = initialDelayMs;
      log.info("Subscribed to {} on {}", LogSanitizer.sanitize(topicFilter), transport.describe());

      try {
        consume(stream);
      } catch (TransportException ex) {
        reconnectCounter.increment();
        log.warn(
            "MQTT connection to {} lost: {}; reconnecting in {} ms",
            transport.describe(),
            LogSanitizer.sanitize(rootMessage(ex)),
            delayMs);
      } catch (RuntimeException ex) {
        reconnectCounter.increment();
        log.error("Unexpected error on subscription to {}; reconnecting in {} ms", transport.describe(), delayMs, ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Ingest loop interrupted");
      } finally {
        connected.set(0);
        closeStream(stream);
      }

      if (isStopping()) {
        break;
      }
      state.set(State.DISCONNECTED);
      if (!pause(delayMs)) {
        break;
      }
      delayMs = Math.min(maxDelayMs, delayMs * 2);
    }
    state.set(State.STOPPED);
    log.info("Ingest loop stopped");
  }

  private void consume(InboundStream stream) throws TransportException, InterruptedException {
    while (!isStopping()) {
      InboundPayload payload = stream.next(pollTimeout);
      if (payload != null) {
        dispatch(payload);
      }
    }
  }

  private void dispatch(InboundPayload payload) {
    try {
      handler.handle(payload);
    } catch (RuntimeException ex) {
      handlerFailureCounter.increment();
      log.error("Failed to handle message on {}", LogSanitizer.sanitize(payload.topic()), ex);
    }
  }

  /** Waits up to {@code delayMs}; false when stop was requested in the meantime. */
  private boolean pause(long delayMs) {
    try {
      return !stopSignal.await(delayMs, TimeUnit.MILLISECONDS) && !Thread.currentThread().isInterrupted();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private boolean isStopping() {
    return stopSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
  }

  private void closeStream(InboundStream stream) {
    currentStream.compareAndSet(stream, null);
    stream.close();
  }

  private static String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current == ex ? ex.getMessage() : ex.getMessage() + " (" + current + ")";
  }
}
