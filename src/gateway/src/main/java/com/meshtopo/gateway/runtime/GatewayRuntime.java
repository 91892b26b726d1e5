package com.meshtopo.gateway.runtime;

import com.meshtopo.gateway.caltopo.CalTopoReporter;
import com.meshtopo.gateway.mqtt.MqttIngestLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the gateway once the context is up and tears it down in reverse order.
 *
 * <p>An unreachable CalTopo at startup is only a warning: reports are retried per message anyway.
 */
@Component
@ConditionalOnProperty(prefix = "gateway.runtime", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GatewayRuntime {
  private static final Logger log = LoggerFactory.getLogger(GatewayRuntime.class);

  private final CalTopoReporter reporter;
  private final MqttIngestLoop ingestLoop;
  private final GatewayStatistics statistics;

  public GatewayRuntime(CalTopoReporter reporter, MqttIngestLoop ingestLoop, GatewayStatistics statistics) {
    this.reporter = reporter;
    this.ingestLoop = ingestLoop;
    this.statistics = statistics;
  }

  @jakarta.annotation.PostConstruct
  public void start() {
    statistics.markStarted();
    reporter.start();
    if (!reporter.testConnection()) {
      log.warn("CalTopo connectivity test failed; continuing, position reports will retry on their own");
    }
    ingestLoop.start();
    log.info("Gateway started");
  }

  @jakarta.annotation.PreDestroy
  public void stop() {
    log.info("Stopping gateway");
    ingestLoop.stop();
    reporter.close();
    statistics.logStatistics();
    log.info("Gateway stopped");
  }
}
