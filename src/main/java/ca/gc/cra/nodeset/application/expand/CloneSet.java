package ca.gc.cra.nodeset.application.expand;

import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Growing list of records cloned from one source by DUPLICATE macros.
 *
 * <p>The template is a separately owned copy of the source. It only seeds clones created later, and it receives
 * the last value of every DUPLICATE group so late clones line up with earlier ones. The list never shrinks.</p>
 *
 * <p>Not thread-safe; owned by a single {@link ObjectDuplicator#duplicate(ConfigRecord)} call.</p>
 *
 * @since 0.1.0
 */
final class CloneSet {
  private final ConfigRecord template;
  private final List<ConfigRecord> clones = new ArrayList<>();

  CloneSet(ConfigRecord source) {
    this.template = Objects.requireNonNull(source, "source").copy();
  }

  /**
   * Clears one value in the template and every clone so it can be rebuilt left to right.
   */
  void reset(String property, int index) {
    template.setValue(property, index, "");
    for (ConfigRecord clone : clones) {
      clone.setValue(property, index, "");
    }
  }

  /**
   * Appends the same literal text to one value of the template and every clone.
   */
  void appendAll(String property, int index, String text) {
    if (text.isEmpty()) {
      return;
    }
    append(template, property, index, text);
    for (ConfigRecord clone : clones) {
      append(clone, property, index, text);
    }
  }

  /**
   * Applies one DUPLICATE group to a value.
   *
   * <p>Clone {@code j} below {@code values.size()} receives {@code prefix + values[j]}, creating clones from the
   * template when the list is too short. Clones beyond the group receive {@code prefix + values[last]}, as does the
   * template.</p>
   *
   * @param property property being rebuilt
   * @param index value position within the property
   * @param prefix literal text between the previous macro and this one
   * @param values literal values of the group; must not be empty
   * @return number of clones created by this call
   */
  int broadcastOrExtend(String property, int index, String prefix, List<String> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("DUPLICATE group must hold at least one value");
    }
    int created = 0;
    while (clones.size() < values.size()) {
      clones.add(template.copy());
      created++;
    }
    String last = prefix + values.get(values.size() - 1);
    for (int j = 0; j < clones.size(); j++) {
      String text = j < values.size() ? prefix + values.get(j) : last;
      append(clones.get(j), property, index, text);
    }
    append(template, property, index, last);
    return created;
  }

  boolean isEmpty() {
    return clones.isEmpty();
  }

  int size() {
    return clones.size();
  }

  List<ConfigRecord> clones() {
    return clones;
  }

  ConfigRecord template() {
    return template;
  }

  private static void append(ConfigRecord record, String property, int index, String text) {
    record.setValue(property, index, record.value(property, index) + text);
  }
}
