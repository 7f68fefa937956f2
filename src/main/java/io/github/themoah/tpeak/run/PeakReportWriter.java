package io.github.themoah.tpeak.run;

import io.github.themoah.tpeak.model.DetectionReport;
import io.github.themoah.tpeak.model.Peak;
import io.github.themoah.tpeak.model.StatisticsEntry;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders detected peaks to the log and to a JSON report file.
 */
public class PeakReportWriter {

  private static final Logger log = LoggerFactory.getLogger(PeakReportWriter.class);

  /**
   * Logs each detected peak with its statistics rounded to two decimals.
   */
  public void log(DetectionReport report) {
    for (Peak peak : report.peaks()) {
      log.info("TelemetryPeak({}, {})", peak.index(), peak.dimension());
      StatisticsEntry local = peak.local();
      log.info("\tsub_count: {}", local.subCount());
      log.info("\tsamp_count: {}", local.sampCount());
      log.info("\tsamp_sub_count_max: {}", local.sampSubCountMax());
      log.info("\tsamp_sub_count_mean: {}", round(local.sampSubCountMean()));
      log.info("\tsamp_sub_count_std: {}", round(local.sampSubCountStd()));
      log.info("\tsamp_sub_ratio: {}", round(local.sampSubRatio()));
      log.info("\tthreshold: {} ({})", peak.threshold(), peak.thresholdSource());
    }
  }

  public void write(DetectionReport report, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, toJson(report).encodePrettily(), StandardCharsets.UTF_8);
    log.info("Saved {} peaks to {}", report.peaks().size(), file);
  }

  public JsonObject toJson(DetectionReport report) {
    JsonArray peaks = new JsonArray();
    for (Peak peak : report.peaks()) {
      JsonObject json = new JsonObject()
        .put("index", String.valueOf(peak.index()))
        .put("dimension", String.valueOf(peak.dimension()))
        .put("threshold", peak.threshold())
        .put("threshold_source", peak.thresholdSource().name())
        .put("local", entryJson(peak.local()));
      peak.globalEntry().ifPresent(global -> json.put("global", entryJson(global)));
      peaks.add(json);
    }
    return new JsonObject()
      .put("start", report.window().start().toString())
      .put("end", report.window().end().toString())
      .put("records_processed", report.recordsProcessed())
      .put("records_skipped", report.recordsSkipped())
      .put("records_outside_window", report.recordsOutsideWindow())
      .put("peaks", peaks);
  }

  private static JsonObject entryJson(StatisticsEntry entry) {
    return new JsonObject()
      .put("sub_count", entry.subCount())
      .put("samp_count", entry.sampCount())
      .put("samp_sub_count_max", entry.sampSubCountMax())
      .put("samp_sub_count_mean", round(entry.sampSubCountMean()))
      .put("samp_sub_count_std", round(entry.sampSubCountStd()))
      .put("samp_sub_ratio", round(entry.sampSubRatio()));
  }

  static double round(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
