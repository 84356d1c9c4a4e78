package ca.gc.cra.nodeset.infrastructure.range;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.nodeset.application.port.NodeRangeException;
import java.util.List;
import org.junit.jupiter.api.Test;

class BracketNodeRangeExpanderTest {
  private final BracketNodeRangeExpander expander = new BracketNodeRangeExpander();

  @Test
  void tokenWithoutBracketsIsSingleName() throws NodeRangeException {
    assertEquals(List.of("db01"), expander.expand("db01"));
  }

  @Test
  void simpleRange() throws NodeRangeException {
    assertEquals(List.of("h0", "h1", "h2"), expander.expand("h[0-2]"));
  }

  @Test
  void itemsKeepDeclarationOrder() throws NodeRangeException {
    assertEquals(List.of("n5", "n1", "n2"), expander.expand("n[5,1-2]"));
  }

  @Test
  void duplicatesInsideGroupAreDropped() throws NodeRangeException {
    assertEquals(List.of("n1", "n2", "n3"), expander.expand("n[1-2,2-3]"));
  }

  @Test
  void leadingZeroPadsToLowerBoundWidth() throws NodeRangeException {
    assertEquals(List.of("r08", "r09", "r10"), expander.expand("r[08-10]"));
  }

  @Test
  void steppedRange() throws NodeRangeException {
    assertEquals(List.of("n0", "n2", "n4"), expander.expand("n[0-5/2]"));
  }

  @Test
  void multipleGroupsFormCartesianProduct() throws NodeRangeException {
    assertEquals(
        List.of("r1n1.x", "r1n2.x", "r2n1.x", "r2n2.x"),
        expander.expand("r[1-2]n[1-2].x"));
  }

  @Test
  void malformedSyntaxIsRejected() {
    for (String bad : List.of("h[0-2", "h]0", "h[[1]]", "h[]", "h[1,]", "h[a-b]", "h[3-1]", "h[1-4/0]", "h[4/2]")) {
      assertThrows(NodeRangeException.class, () -> expander.expand(bad), bad);
    }
  }

  @Test
  void rangeLargerThanCeilingIsRejected() {
    BracketNodeRangeExpander small = new BracketNodeRangeExpander(4);

    assertThrows(NodeRangeException.class, () -> small.expand("h[1-5]"));
    assertThrows(NodeRangeException.class, () -> small.expand("h[1-3]n[1-2]"));
  }

  @Test
  void nonPositiveCeilingIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BracketNodeRangeExpander(0));
  }

  @Test
  void nonAsciiDigitsAreRejected() {
    // ARABIC-INDIC DIGIT THREE and FULLWIDTH DIGIT ONE
    for (String bad : List.of("h[\u0663]", "h[1-\u0663]", "h[\uFF11]")) {
      assertThrows(NodeRangeException.class, () -> expander.expand(bad), bad);
    }
  }
}
