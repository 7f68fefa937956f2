package io.github.themoah.tpeak.health;

/**
 * State reported by {@code /healthz} and {@code /readyz}.
 *
 * <p>Each state carries the HTTP status the probe answers with: 200 for {@code UP}, 503 for
 * {@code DOWN}. The JSON body uses the constant name.
 */
public enum HealthStatus {
  UP(200),
  DOWN(503);

  private final int httpStatusCode;

  HealthStatus(int httpStatusCode) {
    this.httpStatusCode = httpStatusCode;
  }

  public String getValue() {
    return name();
  }

  public int httpStatusCode() {
    return httpStatusCode;
  }
}
