package io.github.themoah.tpeak.health;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * Health check response body.
 *
 * @param status overall health status
 * @param lastSuccess time of the last successful run (readiness only)
 * @param error reason of the last failure (readiness only)
 */
public record HealthCheckResponse(
  HealthStatus status,
  Instant lastSuccess,
  String error
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  public static HealthCheckResponse readiness(RunHealthMonitor monitor) {
    return new HealthCheckResponse(monitor.getStatus(), monitor.lastSuccess(), monitor.lastError());
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (lastSuccess != null) {
      json.put("lastSuccess", lastSuccess.toString());
    }
    if (error != null) {
      json.put("error", error);
    }
    return json;
  }
}
