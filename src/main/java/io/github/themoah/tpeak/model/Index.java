package io.github.themoah.tpeak.model;

import java.util.List;

/**
 * Ordered tuple of attribute values identifying the tracked entity (e.g. a severity,
 * a submission origin).
 *
 * @param values the attribute values, in the order the analyzer declares them
 */
public record Index(List<String> values) implements Comparable<Index> {

  public Index {
    values = AttributeTuple.copyOf(values, "Index");
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Index needs at least one attribute value");
    }
  }

  public static Index of(String... values) {
    return new Index(List.of(values));
  }

  @Override
  public int compareTo(Index other) {
    return AttributeTuple.compare(values, other.values);
  }

  @Override
  public String toString() {
    return String.join("/", values);
  }
}
