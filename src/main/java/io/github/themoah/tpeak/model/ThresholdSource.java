package io.github.themoah.tpeak.model;

/**
 * Where the threshold applied to a key came from, in order of precedence.
 */
public enum ThresholdSource {
  EXPLICIT,
  ADVISED,
  ANALYZER_DEFAULT,
  CONFIGURED_DEFAULT
}
