package ca.gc.cra.nodeset.application.expand;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.nodeset.domain.record.ConfigRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class CloneSetTest {

  @Test
  void growsToLargestGroupAndBroadcastsLastValue() {
    ConfigRecord source = ConfigRecord.builder().add("name", "ignored").add("ip", "ignored").build();
    CloneSet set = new CloneSet(source);
    set.reset("name", 0);

    assertEquals(3, set.broadcastOrExtend("name", 0, "", List.of("a", "b", "c")));
    set.reset("ip", 0);
    assertEquals(0, set.broadcastOrExtend("ip", 0, "10.0.0.", List.of("1", "2")));

    List<ConfigRecord> clones = set.clones();
    assertEquals(3, clones.size());
    assertEquals("10.0.0.1", clones.get(0).value("ip", 0));
    assertEquals("10.0.0.2", clones.get(1).value("ip", 0));
    assertEquals("10.0.0.2", clones.get(2).value("ip", 0));
    assertEquals("c", set.template().value("name", 0));
    assertEquals("10.0.0.2", set.template().value("ip", 0));
  }

  @Test
  void newClonesInheritTemplateText() {
    ConfigRecord source = ConfigRecord.builder().add("a", "x").add("b", "y").build();
    CloneSet set = new CloneSet(source);
    set.reset("a", 0);
    set.broadcastOrExtend("a", 0, "", List.of("1", "2"));
    set.reset("b", 0);

    set.broadcastOrExtend("b", 0, "p", List.of("x", "y", "z"));

    assertEquals("2", set.clones().get(2).value("a", 0));
    assertEquals("pz", set.clones().get(2).value("b", 0));
  }

  @Test
  void appendAllReachesTemplateAndClones() {
    CloneSet set = new CloneSet(ConfigRecord.builder().add("name", "v").build());
    set.reset("name", 0);
    set.broadcastOrExtend("name", 0, "", List.of("a", "b"));

    set.appendAll("name", 0, "-x");

    assertEquals("a-x", set.clones().get(0).value("name", 0));
    assertEquals("b-x", set.clones().get(1).value("name", 0));
    assertEquals("b-x", set.template().value("name", 0));
  }

  @Test
  void sourceIsNotMutated() {
    ConfigRecord source = ConfigRecord.builder().add("name", "v").build();
    CloneSet set = new CloneSet(source);
    set.reset("name", 0);

    assertTrue(set.isEmpty());
    assertEquals("v", source.value("name", 0));
  }

  @Test
  void emptyGroupIsRejected() {
    CloneSet set = new CloneSet(ConfigRecord.builder().add("name", "v").build());

    assertThrows(IllegalArgumentException.class, () -> set.broadcastOrExtend("name", 0, "", List.of()));
  }
}
