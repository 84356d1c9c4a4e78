package ca.gc.cra.nodeset.infrastructure.io;

import ca.gc.cra.nodeset.config.OutputFormat;
import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Serializes expanded records as YAML or newline-delimited JSON.
 *
 * <p>YAML output mirrors the input shape read by {@link RecordDocumentReader}: a block sequence of
 * mappings where single-valued properties are scalars. NDJSON output writes one object per record and
 * every property as an array of strings.</p>
 *
 * @since 0.1.0
 */
public final class RecordDocumentWriter {
  private final OutputFormat format;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a writer for the given format.
   *
   * @param format output serialization
   */
  public RecordDocumentWriter(OutputFormat format) {
    this.format = Objects.requireNonNull(format, "format");
  }

  public OutputFormat format() {
    return format;
  }

  /**
   * Writes {@code records} to {@code out}. The writer is flushed but not closed.
   *
   * @param records records to serialize, in order
   * @param out destination
   * @throws IOException when writing fails
   */
  public void write(List<ConfigRecord> records, Writer out) throws IOException {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(out, "out");
    switch (format) {
      case YAML -> writeYaml(records, out);
      case NDJSON -> writeNdjson(records, out);
      default -> throw new IllegalStateException("Unsupported format: " + format);
    }
    out.flush();
  }

  private void writeYaml(List<ConfigRecord> records, Writer out) throws IOException {
    if (records.isEmpty()) {
      out.write("[]\n");
      return;
    }
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setIndicatorIndent(0);
    Yaml yaml = new Yaml(options);

    List<Map<String, Object>> document = new ArrayList<>(records.size());
    for (ConfigRecord record : records) {
      Map<String, Object> entry = new LinkedHashMap<>();
      for (Map.Entry<String, List<String>> property : record.asMap().entrySet()) {
        List<String> values = property.getValue();
        entry.put(property.getKey(), values.size() == 1 ? values.get(0) : new ArrayList<>(values));
      }
      document.add(entry);
    }
    yaml.dump(document, out);
  }

  private void writeNdjson(List<ConfigRecord> records, Writer out) throws IOException {
    for (ConfigRecord record : records) {
      try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
        gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        gen.writeStartObject();
        for (Map.Entry<String, List<String>> property : record.asMap().entrySet()) {
          gen.writeArrayFieldStart(property.getKey());
          for (String value : property.getValue()) {
            gen.writeString(value);
          }
          gen.writeEndArray();
        }
        gen.writeEndObject();
      }
      out.write('\n');
    }
  }
}
