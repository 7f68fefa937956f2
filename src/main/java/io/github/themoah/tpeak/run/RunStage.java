package io.github.themoah.tpeak.run;

/**
 * Stages of one analysis run. A run starts cold or warm and then passes through the
 * remaining stages in order; it is atomic, so a failure before {@link #PERSIST} leaves the
 * stored baseline as it was.
 */
public enum RunStage {
  /** No stored baseline, detection runs against a zero baseline. */
  COLD_START,
  /** Stored baseline loaded. */
  WARM_START,
  LOCAL_BUILD,
  DETECT,
  MERGE,
  PERSIST
}
