package io.github.themoah.tpeak;

import io.github.themoah.tpeak.config.AnalysisConfig;
import io.github.themoah.tpeak.config.AppConfig;
import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.detection.DetectionConfig;
import io.github.themoah.tpeak.health.HealthCheckHandler;
import io.github.themoah.tpeak.health.RunHealthMonitor;
import io.github.themoah.tpeak.metrics.MetricsReporter;
import io.github.themoah.tpeak.metrics.MicrometerConfig;
import io.github.themoah.tpeak.metrics.MicrometerReporter;
import io.github.themoah.tpeak.metrics.PrometheusHandler;
import io.github.themoah.tpeak.run.AnalysisRunner;
import io.github.themoah.tpeak.schedule.AnalysisScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service mode: runs the analysis periodically and serves health and metrics endpoints.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final Settings settings;

  private AnalysisScheduler scheduler;
  private RunHealthMonitor healthMonitor;
  private HttpServer httpServer;

  public MainVerticle() {
    this(Settings.fromEnvironment());
  }

  public MainVerticle(Settings settings) {
    this.settings = settings;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting tpeak MainVerticle");

    AppConfig appConfig = AppConfig.from(settings);
    AnalysisConfig analysisConfig = AnalysisConfig.from(settings);
    DetectionConfig detectionConfig = DetectionConfig.from(settings);

    AnalysisRunner runner;
    try {
      runner = AnalysisRunner.create(analysisConfig, detectionConfig, settings);
    } catch (IllegalArgumentException e) {
      log.error("Invalid analysis configuration", e);
      startPromise.fail(e);
      return;
    }

    healthMonitor = new RunHealthMonitor();
    Router router = Router.router(vertx);
    new HealthCheckHandler(healthMonitor).registerRoutes(router);

    MeterRegistry registry = MicrometerConfig.createRegistry(appConfig.reporterType(), settings);
    if (appConfig.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
    }
    if (registry instanceof PrometheusMeterRegistry) {
      new PrometheusHandler((PrometheusMeterRegistry) registry).registerRoutes(router);
    }
    MetricsReporter reporter = new MicrometerReporter(registry);

    router.route().handler(ctx -> ctx.response()
      .setStatusCode(404)
      .putHeader("content-type", "application/json")
      .end("{\"error\": \"Not Found\"}"));

    scheduler = new AnalysisScheduler(
      vertx,
      runner.analyzer().name(),
      () -> runner.run(analysisConfig.window(Clock.systemUTC()), analysisConfig.threshold()),
      reporter,
      healthMonitor,
      appConfig.analysisIntervalMs()
    );

    startHttpServer(router, appConfig.httpPort())
      .compose(server -> {
        httpServer = server;
        return scheduler.start();
      })
      .onSuccess(v -> {
        log.info("tpeak started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start tpeak", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping tpeak MainVerticle");

    Future<Void> stopScheduler = scheduler != null ? scheduler.stop() : Future.succeededFuture();

    stopScheduler
      .compose(v -> httpServer != null ? httpServer.close() : Future.succeededFuture())
      .onSuccess(v -> {
        log.info("tpeak stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during tpeak shutdown", err);
        stopPromise.fail(err);
      });
  }

  RunHealthMonitor healthMonitor() {
    return healthMonitor;
  }

  int actualPort() {
    return httpServer == null ? -1 : httpServer.actualPort();
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }
}
