package ca.gc.cra.nodeset.infrastructure.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordDocumentReaderTest {
  private final RecordDocumentReader reader = new RecordDocumentReader();

  @Test
  void readsScalarsAndListsInOrder(@TempDir Path tempDir) throws IOException {
    Path file = tempDir.resolve("hosts.yaml");
    Files.writeString(file, """
        - host_name: $DUPLICATE(web,db)$
          port: 8080
          members:
            - a
            - b
            - a
          notes:
        - host_name: solo
        """, StandardCharsets.UTF_8);

    List<ConfigRecord> records = reader.read(file);

    assertEquals(2, records.size());
    ConfigRecord first = records.get(0);
    assertEquals(List.of("host_name", "port", "members", "notes"), List.copyOf(first.propertyNames()));
    assertEquals(List.of("$DUPLICATE(web,db)$"), first.values("host_name"));
    assertEquals(List.of("8080"), first.values("port"));
    assertEquals(List.of("a", "b", "a"), first.values("members"));
    assertEquals(List.of(""), first.values("notes"));
    assertEquals("solo", records.get(1).value("host_name", 0));
  }

  @Test
  void typedLookingScalarsStayRawText() {
    ConfigRecord record = reader.read("""
        - host_name: "$DUPLICATE(a,b)$"
          check_interval: 010
          active: yes
          ratio: 1.50
          retries: 0x1F
        """).get(0);

    assertEquals(List.of("010"), record.values("check_interval"));
    assertEquals(List.of("yes"), record.values("active"));
    assertEquals(List.of("1.50"), record.values("ratio"));
    assertEquals(List.of("0x1F"), record.values("retries"));
  }

  @Test
  void emptyDocumentHasNoRecords() {
    assertTrue(reader.read("").isEmpty());
  }

  @Test
  void emptyListKeepsProperty() {
    ConfigRecord record = reader.read("- members: []\n").get(0);

    assertTrue(record.contains("members"));
    assertTrue(record.values("members").isEmpty());
  }

  @Test
  void topLevelMappingIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> reader.read("name: a\n"));
  }

  @Test
  void nestedMappingValueIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> reader.read("- name:\n    inner: a\n"));
  }

  @Test
  void malformedYamlIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> reader.read("- [unclosed\n"));
  }
}
