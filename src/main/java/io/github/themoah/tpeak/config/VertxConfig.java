package io.github.themoah.tpeak.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options for service mode. Analyses run on the worker pool, sized by
 * {@code TPEAK_WORKER_POOL_SIZE}.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);

  private static final int DEFAULT_WORKER_POOL_SIZE = 4;

  private VertxConfig() {
  }

  public static VertxOptions createVertxOptions(Settings settings) {
    int workers = settings.getInt("TPEAK_WORKER_POOL_SIZE", DEFAULT_WORKER_POOL_SIZE);
    if (workers < 1) {
      log.warn("Invalid value for TPEAK_WORKER_POOL_SIZE: {}, using default: {}", workers, DEFAULT_WORKER_POOL_SIZE);
      workers = DEFAULT_WORKER_POOL_SIZE;
    }
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setWorkerPoolSize(workers);
    // a single analysis may legitimately take minutes on a worker
    options.setMaxWorkerExecuteTime(Long.MAX_VALUE);
    log.info("Vert.x worker pool size: {}", workers);
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }
}
