package io.github.themoah.tpeak.analyzer;

import io.github.themoah.tpeak.config.Settings;
import io.github.themoah.tpeak.exception.UnclassifiableRecordException;
import io.github.themoah.tpeak.model.DimensionValue;
import io.github.themoah.tpeak.model.Index;
import io.github.themoah.tpeak.model.StatisticsKey;
import io.github.themoah.tpeak.model.TelemetryRecord;
import io.github.themoah.tpeak.source.RecordFilter;
import io.github.themoah.tpeak.stats.SampleGrouping;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Analyzer policy driven by attribute names: index attributes, up to two dimension
 * attributes and one sub-item attribute, each read verbatim from the record.
 */
public final class AttributeAnalyzerPolicy implements AnalyzerPolicy {

  private final String name;
  private final List<String> indexAttributes;
  private final List<String> dimensionAttributes;
  private final String subItemAttribute;
  private final SampleGrouping grouping;
  private final RecordFilter filter;
  private final Map<Index, Long> defaultThresholds;

  private AttributeAnalyzerPolicy(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.indexAttributes = List.copyOf(builder.indexAttributes);
    this.dimensionAttributes = List.copyOf(builder.dimensionAttributes);
    this.subItemAttribute = Objects.requireNonNull(builder.subItemAttribute, "subItemAttribute");
    this.grouping = Objects.requireNonNull(builder.grouping, "grouping");
    this.filter = builder.filter;
    this.defaultThresholds = Map.copyOf(builder.defaultThresholds);

    if (indexAttributes.isEmpty()) {
      throw new IllegalArgumentException("Analyzer '" + name + "' needs at least one index attribute");
    }
    if (dimensionAttributes.size() > DimensionValue.MAX_DIMENSIONS) {
      throw new IllegalArgumentException("Analyzer '" + name + "' declares "
        + dimensionAttributes.size() + " dimensions, at most " + DimensionValue.MAX_DIMENSIONS
        + " are supported");
    }
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Builds a policy from {@code TPEAK_CUSTOM_*} settings.
   *
   * <ul>
   *   <li>TPEAK_CUSTOM_INDEX - comma-separated index attributes (required)</li>
   *   <li>TPEAK_CUSTOM_DIMENSIONS - comma-separated dimension attributes, at most two</li>
   *   <li>TPEAK_CUSTOM_SUB_ITEM - sub-item attribute (default: file.sha1)</li>
   *   <li>TPEAK_CUSTOM_GROUPING - sample grouping (default: day)</li>
   * </ul>
   */
  public static AttributeAnalyzerPolicy fromSettings(String name, Settings settings) {
    List<String> index = settings.getList("TPEAK_CUSTOM_INDEX", List.of());
    if (index.isEmpty()) {
      throw new IllegalArgumentException("TPEAK_CUSTOM_INDEX must name at least one attribute");
    }
    return builder(name)
      .index(index)
      .dimensions(settings.getList("TPEAK_CUSTOM_DIMENSIONS", List.of()))
      .subItem(settings.getString("TPEAK_CUSTOM_SUB_ITEM", "file.sha1"))
      .grouping(SampleGrouping.parse(settings.getString("TPEAK_CUSTOM_GROUPING", "day")))
      .build();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public StatisticsKey classify(TelemetryRecord record) throws UnclassifiableRecordException {
    List<String> indexValues = readAll(record, indexAttributes);
    List<String> dimensionValues = readAll(record, dimensionAttributes);
    return StatisticsKey.of(new Index(indexValues), new DimensionValue(dimensionValues));
  }

  @Override
  public String subItem(TelemetryRecord record) throws UnclassifiableRecordException {
    return read(record, subItemAttribute);
  }

  @Override
  public SampleGrouping defaultGrouping() {
    return grouping;
  }

  @Override
  public Optional<RecordFilter> recordFilter() {
    return Optional.ofNullable(filter);
  }

  @Override
  public OptionalLong defaultThreshold(Index index) {
    Long threshold = defaultThresholds.get(index);
    return threshold == null ? OptionalLong.empty() : OptionalLong.of(threshold);
  }

  public List<String> indexAttributes() {
    return indexAttributes;
  }

  public List<String> dimensionAttributes() {
    return dimensionAttributes;
  }

  public String subItemAttribute() {
    return subItemAttribute;
  }

  private static List<String> readAll(TelemetryRecord record, List<String> attributes)
      throws UnclassifiableRecordException {
    List<String> values = new ArrayList<>(attributes.size());
    for (String attribute : attributes) {
      values.add(read(record, attribute));
    }
    return values;
  }

  private static String read(TelemetryRecord record, String attribute)
      throws UnclassifiableRecordException {
    String value = record.attribute(attribute);
    if (value == null) {
      throw UnclassifiableRecordException.missingAttribute(attribute);
    }
    return value;
  }

  @Override
  public String toString() {
    return "AttributeAnalyzerPolicy[name=" + name + ", index=" + indexAttributes
      + ", dimensions=" + dimensionAttributes + ", subItem=" + subItemAttribute
      + ", grouping=" + grouping.name() + "]";
  }

  public static final class Builder {
    private final String name;
    private List<String> indexAttributes = List.of();
    private List<String> dimensionAttributes = List.of();
    private String subItemAttribute;
    private SampleGrouping grouping = SampleGrouping.byDay();
    private RecordFilter filter;
    private final Map<Index, Long> defaultThresholds = new HashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder index(List<String> attributes) {
      this.indexAttributes = attributes;
      return this;
    }

    public Builder index(String... attributes) {
      return index(List.of(attributes));
    }

    public Builder dimensions(List<String> attributes) {
      this.dimensionAttributes = attributes;
      return this;
    }

    public Builder dimensions(String... attributes) {
      return dimensions(List.of(attributes));
    }

    public Builder subItem(String attribute) {
      this.subItemAttribute = attribute;
      return this;
    }

    public Builder grouping(SampleGrouping grouping) {
      this.grouping = grouping;
      return this;
    }

    public Builder allowValues(String attribute, Set<String> values) {
      this.filter = RecordFilter.allowing(attribute, values);
      return this;
    }

    public Builder defaultThreshold(Index index, long threshold) {
      this.defaultThresholds.put(index, threshold);
      return this;
    }

    public AttributeAnalyzerPolicy build() {
      return new AttributeAnalyzerPolicy(this);
    }
  }
}
