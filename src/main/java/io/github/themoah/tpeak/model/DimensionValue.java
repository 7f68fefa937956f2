package io.github.themoah.tpeak.model;

import java.util.List;

/**
 * Zero, one or two attribute values splitting an index's series into independent series.
 *
 * @param values the dimension values (at most {@value #MAX_DIMENSIONS})
 */
public record DimensionValue(List<String> values) implements Comparable<DimensionValue> {

  public static final int MAX_DIMENSIONS = 2;

  public static final DimensionValue NONE = new DimensionValue(List.of());

  public DimensionValue {
    values = AttributeTuple.copyOf(values, "DimensionValue");
    if (values.size() > MAX_DIMENSIONS) {
      throw new IllegalArgumentException(
        "At most " + MAX_DIMENSIONS + " dimensions are supported, got " + values.size());
    }
  }

  public static DimensionValue of(String... values) {
    return new DimensionValue(List.of(values));
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public int compareTo(DimensionValue other) {
    return AttributeTuple.compare(values, other.values);
  }

  @Override
  public String toString() {
    return values.isEmpty() ? "-" : String.join("/", values);
  }
}
