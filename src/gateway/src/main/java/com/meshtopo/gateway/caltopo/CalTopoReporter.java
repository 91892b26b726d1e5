package com.meshtopo.gateway.caltopo;

import com.meshtopo.gateway.config.GatewayProperties;
import com.meshtopo.gateway.identity.DeviceRegistry;
import com.meshtopo.gateway.support.LogSanitizer;
import com.meshtopo.gateway.support.SecretRedactor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends position reports to the CalTopo position-report API.
 *
 * <p>A report goes to every configured destination (connect key and/or group) concurrently. Each
 * destination retries on its own with bounded exponential backoff; a failure on one never cancels
 * the other. Connect keys and group ids are secrets: they never reach the logs in clear text.
 */
public class CalTopoReporter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CalTopoReporter.class);
  static final String TEST_CALLSIGN = "MESHTOPO_SYSTEM_TEST";
  private static final int BODY_SNIPPET_LENGTH = 200;

  private enum Outcome {
    SUCCESS,
    RETRYABLE,
    FATAL
  }

  private final Destination connectKey;
  private final String defaultGroup;
  private final String baseUrl;
  private final Duration timeout;
  private final BaseUrlValidator baseUrlValidator;
  private final RetryPolicy retryPolicy;
  private final SecretRedactor redactor;
  private final DoubleSupplier jitterSource;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter rateLimitedCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter exceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  private volatile HttpClient httpClient;
  private ExecutorService ownedExecutor;
  private volatile boolean closed;

  /**
   * @param httpClient shared client to adopt, or {@code null} to let {@link #start()} build one that
   *     this reporter owns and shuts down on {@link #close()}
   * @throws IllegalStateException when neither a connect key nor a group is configured
   */
  public CalTopoReporter(
      GatewayProperties properties,
      DeviceRegistry deviceRegistry,
      MeterRegistry meterRegistry,
      HttpClient httpClient) {
    this(properties, deviceRegistry, meterRegistry, httpClient, () -> ThreadLocalRandom.current().nextDouble());
  }

  CalTopoReporter(
      GatewayProperties properties,
      DeviceRegistry deviceRegistry,
      MeterRegistry meterRegistry,
      HttpClient httpClient,
      DoubleSupplier jitterSource) {
    GatewayProperties.CalTopo caltopo = properties.getCaltopo();
    if (!caltopo.hasConnectKey() && !caltopo.hasGroup()) {
      throw new IllegalStateException(
          "CalTopo needs gateway.caltopo.connect-key or gateway.caltopo.group to be configured");
    }
    this.connectKey = caltopo.hasConnectKey()
        ? new Destination(DestinationKind.CONNECT_KEY, caltopo.getConnectKey().trim())
        : null;
    this.defaultGroup = caltopo.hasGroup() ? caltopo.getGroup().trim() : null;
    this.baseUrl = stripTrailingSlashes(caltopo.getBaseUrl());
    this.timeout = Duration.ofMillis(caltopo.getTimeoutMs());
    this.baseUrlValidator = new BaseUrlValidator(caltopo.getAllowedUrlPatterns());
    this.retryPolicy = RetryPolicy.from(caltopo.getRetry());
    this.jitterSource = jitterSource;
    this.httpClient = httpClient;

    Set<String> secrets = new LinkedHashSet<>(deviceRegistry.configuredGroups());
    if (connectKey != null) {
      secrets.add(connectKey.identifier());
    }
    if (defaultGroup != null) {
      secrets.add(defaultGroup);
    }
    this.redactor = new SecretRedactor(secrets);

    this.requestTimer = Timer.builder("gateway.caltopo.http.duration")
        .description("CalTopo position report HTTP request duration (seconds)")
        .register(meterRegistry);
    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.rateLimitedCounter = outcomeCounter(meterRegistry, "rate_limited");
    this.clientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.serverErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");
    meterRegistry.gauge("gateway.caltopo.http.last_status", lastStatusCode);
  }

  /** Makes an HTTP client available. Calling it again is a no-op. */
  public synchronized void start() {
    closed = false;
    if (httpClient != null) {
      return;
    }
    ownedExecutor = Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "caltopo-http");
      thread.setDaemon(true);
      return thread;
    });
    httpClient = HttpClient.newBuilder()
        .connectTimeout(timeout)
        .executor(ownedExecutor)
        .build();
    log.info("Created CalTopo HTTP client (timeout {} ms)", timeout.toMillis());
  }

  /**
   * Stops accepting work. Retries still waiting complete as failures. The HTTP executor is shut
   * down only when {@link #start()} created it.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
      ownedExecutor = null;
      httpClient = null;
    }
  }

  public boolean hasGroupDestination() {
    return defaultGroup != null;
  }

  public boolean hasConnectKeyDestination() {
    return connectKey != null;
  }

  /**
   * Reports a position and waits for every destination to finish.
   *
   * @return true if at least one destination accepted the report
   */
  public boolean sendPositionUpdate(String callsign, double latitude, double longitude, String groupOverride) {
    try {
      return sendPositionUpdateAsync(callsign, latitude, longitude, groupOverride).get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while sending position update for {}", LogSanitizer.sanitize(callsign));
      return false;
    } catch (ExecutionException ex) {
      log.error(
          "Position update for {} failed: {}",
          LogSanitizer.sanitize(callsign),
          redactor.redact(ex.getCause()));
      return false;
    }
  }

  /**
   * Reports a position to every configured destination concurrently.
   *
   * @param groupOverride group id replacing the default group for this report; ignored when no group
   *     destination is configured
   * @return a future completing with true if at least one destination accepted the report; it never
   *     completes exceptionally
   */
  public CompletableFuture<Boolean> sendPositionUpdateAsync(
      String callsign, double latitude, double longitude, String groupOverride) {
    if (callsign == null || callsign.isBlank()) {
      log.error("Refusing to send a position update without a callsign");
      return CompletableFuture.completedFuture(false);
    }
    if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
      log.error("Refusing to send non-finite coordinates for {}", LogSanitizer.sanitize(callsign));
      return CompletableFuture.completedFuture(false);
    }
    if (closed) {
      log.warn("CalTopo reporter is closed; dropping position update for {}", LogSanitizer.sanitize(callsign));
      return CompletableFuture.completedFuture(false);
    }
    ensureStarted();

    String lat = formatCoordinate(latitude);
    String lng = formatCoordinate(longitude);
    List<CompletableFuture<Boolean>> branches = new ArrayList<>();
    for (Destination destination : destinations(groupOverride)) {
      branches.add(deliver(destination, callsign, lat, lng));
    }
    return allOf(branches).thenApply(results -> {
      boolean delivered = results.stream().anyMatch(Boolean::booleanValue);
      if (!delivered) {
        log.error("Position update for {} was not accepted by any CalTopo destination", LogSanitizer.sanitize(callsign));
      }
      return delivered;
    });
  }

  /**
   * Probes every destination with a zero-coordinate test report. Any HTTP response counts as
   * reachable; the status code is not judged.
   *
   * @return true if at least one destination answered
   */
  public boolean testConnection() {
    if (closed) {
      return false;
    }
    ensureStarted();
    List<Destination> destinations = destinations(null);
    List<CompletableFuture<Boolean>> probes = new ArrayList<>();
    for (Destination destination : destinations) {
      probes.add(probe(destination));
    }
    List<Boolean> results;
    try {
      results = allOf(probes).get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while testing CalTopo connectivity");
      return false;
    } catch (ExecutionException ex) {
      log.error("CalTopo connectivity test failed: {}", redactor.redact(ex.getCause()));
      return false;
    }
    long reachable = results.stream().filter(Boolean::booleanValue).count();
    log.info("CalTopo connectivity test: {}/{} endpoints reachable", reachable, destinations.size());
    return reachable > 0;
  }

  static String formatCoordinate(double value) {
    return BigDecimal.valueOf(value)
        .setScale(7, RoundingMode.HALF_UP)
        .stripTrailingZeros()
        .toPlainString();
  }

  private List<Destination> destinations(String groupOverride) {
    List<Destination> destinations = new ArrayList<>(2);
    if (connectKey != null) {
      destinations.add(connectKey);
    }
    if (defaultGroup != null) {
      String group = groupOverride != null && !groupOverride.isBlank() ? groupOverride.trim() : defaultGroup;
      destinations.add(new Destination(DestinationKind.GROUP, group));
    }
    return destinations;
  }

  private URI reportUri(Destination destination, String callsign, String latitude, String longitude) {
    return URI.create(baseUrl + "/" + destination.identifier()
        + "?id=" + URLEncoder.encode(callsign, StandardCharsets.UTF_8)
        + "&lat=" + latitude
        + "&lng=" + longitude);
  }

  private boolean isDeliverable(Destination destination) {
    if (!destination.hasValidIdentifier()) {
      log.error(
          "Invalid CalTopo {} identifier {}; only letters, digits and underscore are allowed",
          destination.label(),
          redact(destination, destination.identifier()));
      return false;
    }
    if (!baseUrlValidator.isAllowed(baseUrl)) {
      log.error("CalTopo base URL {} is not an allowed endpoint; not sending", redactor.redact(baseUrl));
      return false;
    }
    return true;
  }

  private CompletableFuture<Boolean> deliver(Destination destination, String callsign, String lat, String lng) {
    if (!isDeliverable(destination)) {
      return CompletableFuture.completedFuture(false);
    }
    URI uri = reportUri(destination, callsign, lat, lng);
    return attempt(destination, uri, callsign, 0, 0L)
        .exceptionally(ex -> {
          exceptionCounter.increment();
          log.error(
              "Unexpected error sending position update for {} to {}: {}",
              LogSanitizer.sanitize(callsign),
              destination.label(),
              redact(destination, unwrap(ex)));
          return false;
        });
  }

  private CompletableFuture<Boolean> attempt(
      Destination destination, URI uri, String callsign, int attempt, long previousDelayMs) {
    if (closed) {
      return CompletableFuture.completedFuture(false);
    }
    HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
    log.debug(
        "Sending position update for {} to {} (attempt {}/{})",
        LogSanitizer.sanitize(callsign),
        destination.label(),
        attempt + 1,
        retryPolicy.maxAttempts());

    long startNs = System.nanoTime();
    return send(request)
        .handle((response, error) -> {
          requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
          return classify(destination, callsign, response, error);
        })
        .thenCompose(outcome -> {
          switch (outcome) {
            case SUCCESS:
              return CompletableFuture.completedFuture(true);
            case RETRYABLE:
              return retry(destination, uri, callsign, attempt, previousDelayMs);
            default:
              return CompletableFuture.completedFuture(false);
          }
        });
  }

  private CompletableFuture<Boolean> retry(
      Destination destination, URI uri, String callsign, int attempt, long previousDelayMs) {
    if (!retryPolicy.hasAttemptAfter(attempt)) {
      log.error(
          "Giving up on position update for {} to {} after {} attempts",
          LogSanitizer.sanitize(callsign),
          destination.label(),
          attempt + 1);
      return CompletableFuture.completedFuture(false);
    }
    if (closed) {
      return CompletableFuture.completedFuture(false);
    }
    long delayMs = retryPolicy.delayMillis(attempt, previousDelayMs, jitterSource.getAsDouble());
    log.info(
        "Retrying position update for {} to {} in {} ms",
        LogSanitizer.sanitize(callsign),
        destination.label(),
        delayMs);
    return CompletableFuture
        .runAsync(() -> { }, CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS))
        .thenCompose(ignored -> attempt(destination, uri, callsign, attempt + 1, delayMs));
  }

  private Outcome classify(
      Destination destination, String callsign, HttpResponse<String> response, Throwable error) {
    if (error != null) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      Throwable cause = unwrap(error);
      if (cause instanceof IOException) {
        log.warn(
            "Connection error sending position update for {} to {}: {}",
            LogSanitizer.sanitize(callsign),
            destination.label(),
            redact(destination, cause));
        return Outcome.RETRYABLE;
      }
      log.error(
          "Unexpected error sending position update for {} to {}: {}",
          LogSanitizer.sanitize(callsign),
          destination.label(),
          redact(destination, cause));
      return Outcome.FATAL;
    }

    int status = response.statusCode();
    lastStatusCode.set(status);
    if (status >= 200 && status < 300) {
      successCounter.increment();
      log.info(
          "Position update for {} accepted by {} (HTTP {})",
          LogSanitizer.sanitize(callsign),
          destination.label(),
          status);
      return Outcome.SUCCESS;
    }
    String body = redact(destination, snippet(response.body()));
    if (status == 429) {
      rateLimitedCounter.increment();
      log.warn("CalTopo rate limit hit (429) for {}: {}", destination.label(), body);
      return Outcome.RETRYABLE;
    }
    if (status >= 500) {
      serverErrorCounter.increment();
      log.warn("CalTopo server error for {}: status={} body={}", destination.label(), status, body);
      return Outcome.RETRYABLE;
    }
    clientErrorCounter.increment();
    log.error(
        "CalTopo rejected position update for {} to {}: status={} body={}",
        LogSanitizer.sanitize(callsign),
        destination.label(),
        status,
        body);
    return Outcome.FATAL;
  }

  private CompletableFuture<Boolean> probe(Destination destination) {
    if (!isDeliverable(destination)) {
      return CompletableFuture.completedFuture(false);
    }
    HttpRequest request = HttpRequest.newBuilder(reportUri(destination, TEST_CALLSIGN, "0", "0"))
        .timeout(timeout)
        .GET()
        .build();
    return send(request).handle((response, error) -> {
      if (error != null) {
        log.error("CalTopo {} endpoint unreachable: {}", destination.label(), redact(destination, unwrap(error)));
        return false;
      }
      log.info("CalTopo {} endpoint reachable (HTTP {})", destination.label(), response.statusCode());
      return true;
    });
  }

  private CompletableFuture<HttpResponse<String>> send(HttpRequest request) {
    HttpClient client = httpClient;
    if (client == null) {
      return CompletableFuture.failedFuture(new IllegalStateException("CalTopo reporter is closed"));
    }
    try {
      return client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private void ensureStarted() {
    if (httpClient == null) {
      start();
    }
  }

  private String redact(Destination destination, Object value) {
    return redactor.redact(value).replace(destination.identifier(), SecretRedactor.PLACEHOLDER);
  }

  private static CompletableFuture<List<Boolean>> allOf(List<CompletableFuture<Boolean>> branches) {
    return CompletableFuture.allOf(branches.toArray(new CompletableFuture<?>[0]))
        .thenApply(ignored -> {
          List<Boolean> results = new ArrayList<>(branches.size());
          for (CompletableFuture<Boolean> branch : branches) {
            results.add(branch.join());
          }
          return results;
        });
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String snippet(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= BODY_SNIPPET_LENGTH ? body : body.substring(0, BODY_SNIPPET_LENGTH) + "...";
  }

  private static String stripTrailingSlashes(String url) {
    String trimmed = url == null ? "" : url.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("gateway.caltopo.http.requests.total")
        .description("CalTopo position report HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
