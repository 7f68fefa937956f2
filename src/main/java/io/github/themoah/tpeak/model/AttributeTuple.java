package io.github.themoah.tpeak.model;

import java.util.List;

/**
 * Lexicographic ordering shared by the tuple-valued keys.
 */
final class AttributeTuple {

  private AttributeTuple() {}

  static int compare(List<String> left, List<String> right) {
    int common = Math.min(left.size(), right.size());
    for (int i = 0; i < common; i++) {
      int cmp = left.get(i).compareTo(right.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  static List<String> copyOf(List<String> values, String what) {
    if (values == null) {
      throw new IllegalArgumentException(what + " values must not be null");
    }
    for (String value : values) {
      if (value == null) {
        throw new IllegalArgumentException(what + " must not contain null values: " + values);
      }
    }
    return List.copyOf(values);
  }
}
