package ca.gc.cra.nodeset.domain.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Multi-valued configuration record mapping property names to ordered raw values.
 * <p><strong>Why:</strong> Gives the scanner, expander, and duplicator one shared shape to read and rewrite.</p>
 * <p><strong>Role:</strong> Domain value handed in by the configuration loader and returned after expansion.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve property insertion order and per-property value order (duplicates kept).</li>
 *   <li>Offer semi-deep copies so clones never share value lists.</li>
 *   <li>Support in-place value rewrites and blank-value pruning.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutable and not thread-safe; each instance is owned by one pipeline call.</p>
 * <p><strong>Performance:</strong> Copies are O(total values); strings are shared, never copied.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders contents for debug logging.</p>
 *
 * @implNote Equality is content based; records carry no identity beyond their properties.
 * @since 0.1.0
 */
public final class ConfigRecord {
  private final Map<String, List<String>> properties;

  private ConfigRecord(Map<String, List<String>> properties) {
    this.properties = properties;
  }

  /**
   * Creates a record from a property map, copying every value list.
   *
   * @param source property name to ordered values; must not be {@code null} nor contain {@code null}s
   * @return new record owning its own lists
   * @throws NullPointerException if a name, list, or value is {@code null}
   */
  public static ConfigRecord of(Map<String, ? extends List<String>> source) {
    Objects.requireNonNull(source, "source");
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ? extends List<String>> entry : source.entrySet()) {
      String name = Objects.requireNonNull(entry.getKey(), "property name");
      copy.put(name, copyValues(name, entry.getValue()));
    }
    return new ConfigRecord(copy);
  }

  /**
   * Returns a builder that appends properties in call order.
   *
   * @return empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a semi-deep copy: a new map and new value lists referencing the same strings.
   *
   * @return independent copy of this record
   */
  public ConfigRecord copy() {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : properties.entrySet()) {
      copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
    }
    return new ConfigRecord(copy);
  }

  /**
   * Returns property names in insertion order.
   *
   * @return unmodifiable view of the property names
   */
  public Set<String> propertyNames() {
    return Collections.unmodifiableSet(properties.keySet());
  }

  public boolean contains(String name) {
    return properties.containsKey(name);
  }

  public int size() {
    return properties.size();
  }

  /**
   * Returns the ordered values of a property.
   *
   * @param name property name
   * @return unmodifiable view of the values
   * @throws IllegalArgumentException if the property is absent
   */
  public List<String> values(String name) {
    return Collections.unmodifiableList(require(name));
  }

  /**
   * Returns one value of a property.
   *
   * @param name property name
   * @param index zero-based value position
   * @return raw value text
   * @throws IllegalArgumentException if the property is absent
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public String value(String name, int index) {
    return require(name).get(index);
  }

  /**
   * Replaces one value of a property in place.
   *
   * @param name property name
   * @param index zero-based value position
   * @param value replacement text; must not be {@code null}
   * @throws IllegalArgumentException if the property is absent
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public void setValue(String name, int index, String value) {
    require(name).set(index, Objects.requireNonNull(value, name));
  }

  /**
   * Removes values that are empty or whitespace only, keeping the relative order of the rest.
   * Properties whose lists become empty stay present.
   *
   * @return number of values removed
   */
  public int removeBlankValues() {
    int removed = 0;
    for (List<String> values : properties.values()) {
      int before = values.size();
      values.removeIf(String::isBlank);
      removed += before - values.size();
    }
    return removed;
  }

  /**
   * Returns an unmodifiable snapshot of the record contents.
   *
   * @return property name to unmodifiable value list, in insertion order
   */
  public Map<String, List<String>> asMap() {
    Map<String, List<String>> view = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : properties.entrySet()) {
      view.put(entry.getKey(), List.copyOf(entry.getValue()));
    }
    return Collections.unmodifiableMap(view);
  }

  private List<String> require(String name) {
    List<String> values = properties.get(name);
    if (values == null) {
      throw new IllegalArgumentException("Unknown property: " + name);
    }
    return values;
  }

  private static List<String> copyValues(String name, List<String> values) {
    Objects.requireNonNull(values, name);
    List<String> copy = new ArrayList<>(values.size());
    for (String value : values) {
      copy.add(Objects.requireNonNull(value, name));
    }
    return copy;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ConfigRecord that)) {
      return false;
    }
    return properties.equals(that.properties);
  }

  @Override
  public int hashCode() {
    return properties.hashCode();
  }

  @Override
  public String toString() {
    return "ConfigRecord" + properties;
  }

  /**
   * Incremental builder preserving property and value order.
   */
  public static final class Builder {
    private final Map<String, List<String>> properties = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Appends values to a property, creating it on first use.
     *
     * @param name property name
     * @param values raw values, appended in order
     * @return this builder
     */
    public Builder add(String name, String... values) {
      Objects.requireNonNull(name, "property name");
      List<String> target = properties.computeIfAbsent(name, key -> new ArrayList<>());
      for (String value : values) {
        target.add(Objects.requireNonNull(value, name));
      }
      return this;
    }

    public ConfigRecord build() {
      return ConfigRecord.of(properties);
    }
  }
}
