package ca.gc.cra.nodeset.domain.macro;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class RangeAwareSplitterTest {

  @Test
  void commasInsideBracketsAreKept() {
    assertEquals(List.of("h[1,3-5]", "db"), RangeAwareSplitter.split("h[1,3-5],db"));
  }

  @Test
  void commasInsideParenthesesAreKept() {
    assertEquals(List.of("$EXPAND(a,b)$", "c"), RangeAwareSplitter.split("$EXPAND(a,b)$,c"));
  }

  @Test
  void customSeparator() {
    assertEquals(List.of("a", "b[1;2]"), RangeAwareSplitter.split("a;b[1;2]", ';'));
  }

  @Test
  void splitTrimmedKeepsEmptyChunks() {
    assertEquals(List.of("a", "", "b"), RangeAwareSplitter.splitTrimmed(" a , ,b "));
  }

  @Test
  void emptyInputYieldsSingleEmptyChunk() {
    assertEquals(List.of(""), RangeAwareSplitter.split(""));
  }

  @Test
  void strayClosersDoNotSuppressLaterSplits() {
    assertEquals(List.of("a]", "b"), RangeAwareSplitter.split("a],b"));
    assertEquals(List.of("a)", "b"), RangeAwareSplitter.split("a),b"));
    assertEquals(List.of("a])", "b[1,2]", "c"), RangeAwareSplitter.split("a]),b[1,2],c"));
  }
}
