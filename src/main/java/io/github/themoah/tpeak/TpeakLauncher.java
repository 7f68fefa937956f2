package io.github.themoah.tpeak;

import io.github.themoah.tpeak.config.AnalysisConfig;
import io.github.themoah.tpeak.config.AppConfig;
import io.github.themoah.tpeak.config.CommandLineOptions;
import io.github.themoah.tpeak.config.LoggingConfig;
import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.config.VertxConfig;
import io.github.themoah.tpeak.detection.DetectionConfig;
import io.github.themoah.tpeak.exception.AnalysisException;
import io.github.themoah.tpeak.metrics.MicrometerConfig;
import io.github.themoah.tpeak.metrics.MicrometerReporter;
import io.github.themoah.tpeak.model.TimeWindow;
import io.github.themoah.tpeak.run.AnalysisResult;
import io.github.themoah.tpeak.run.AnalysisRunner;
import io.vertx.core.Vertx;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Runs a single analysis and exits, or deploys {@link MainVerticle} when an
 * analysis interval is configured.
 *
 * <p>Exit codes: 0 on success, 1 when the run failed, 2 when peaks were reported but the
 * baseline could not be saved.
 */
public class TpeakLauncher {

  private static final Logger log = LoggerFactory.getLogger(TpeakLauncher.class);

  public static void main(String[] args) {
    CommandLineOptions options;
    try {
      options = CommandLineOptions.parse(args);
    } catch (ParseException e) {
      System.err.println("Error in arguments: " + e.getMessage());
      System.err.println(CommandLineOptions.usage());
      System.exit(AnalysisResult.EXIT_FAILED);
      return;
    }
    if (options.help()) {
      System.out.println(CommandLineOptions.usage());
      return;
    }

    Settings settings;
    try {
      settings = loadSettings(options);
    } catch (IOException e) {
      log.error("Cannot read config file {}", options.configFile(), e);
      System.exit(AnalysisResult.EXIT_FAILED);
      return;
    }

    AppConfig appConfig = AppConfig.from(settings);
    if (appConfig.serviceMode()) {
      deploy(settings);
    } else {
      System.exit(runOnce(settings, appConfig, Clock.systemUTC()));
    }
  }

  static Settings loadSettings(CommandLineOptions options) throws IOException {
    Settings settings = Settings.fromEnvironment();
    if (options.configFile() != null) {
      settings = settings.withPropertiesFile(Path.of(options.configFile()));
    }
    settings = settings.withOverrides(options.overrides());
    settings.get("TPEAK_LOG_LEVEL").ifPresent(LoggingConfig::setLevel);
    return settings;
  }

  /**
   * Runs one analysis and returns the process exit code.
   */
  static int runOnce(Settings settings, AppConfig appConfig, Clock clock) {
    MicrometerReporter reporter = new MicrometerReporter(
      MicrometerConfig.createRegistry(appConfig.reporterType(), settings));
    String analyzer = settings.getString("TPEAK_ANALYZER", "unknown");
    try {
      AnalysisConfig analysisConfig = AnalysisConfig.from(settings);
      DetectionConfig detectionConfig = DetectionConfig.from(settings);
      AnalysisRunner runner = AnalysisRunner.create(analysisConfig, detectionConfig, settings);
      analyzer = runner.analyzer().name();

      TimeWindow window = analysisConfig.window(clock);
      AnalysisResult result = runner.run(window, analysisConfig.threshold());
      reporter.reportRun(analyzer, result);
      return result.exitCode();
    } catch (AnalysisException | IllegalArgumentException e) {
      log.error("Analysis failed: {}", e.getMessage(), e);
      reporter.reportFailure(analyzer, e);
      return AnalysisResult.EXIT_FAILED;
    } finally {
      reporter.close();
    }
  }

  private static void deploy(Settings settings) {
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions(settings));
    vertx.deployVerticle(new MainVerticle(settings), VertxConfig.createDeploymentOptions())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(AnalysisResult.EXIT_FAILED);
      });
  }
}
