package com.gentoro.llmc.parser;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.llmc.ast.SourceSpan;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResidualTextTest {

  @Test
  @DisplayName("removals are tracked in original coordinates")
  void removalsMapBack() {
    ResidualText residual = ResidualText.of("abcdef").without(List.of(new SourceSpan(1, 3)));
    assertEquals("adef", residual.text());
    assertEquals(new SourceSpan(3, 5), residual.toOriginal(new SourceSpan(1, 3)));
    assertTrue(residual.isTouched(new SourceSpan(2, 4)));
    assertFalse(residual.isTouched(new SourceSpan(3, 6)));
  }

  @Test
  @DisplayName("overlapping and repeated removals merge")
  void removalsMerge() {
    ResidualText residual =
        ResidualText.of("0123456789")
            .without(List.of(new SourceSpan(2, 5)))
            .without(List.of(new SourceSpan(4, 7), new SourceSpan(2, 5)));
    assertEquals("01789", residual.text());
    assertEquals(new SourceSpan(7, 8), residual.toOriginal(new SourceSpan(2, 3)));
    assertTrue(residual.isTouched(new SourceSpan(6, 7)));
    assertFalse(residual.isTouched(new SourceSpan(7, 10)));
  }

  @Test
  @DisplayName("residual-coordinate removals are translated before they apply")
  void residualRemovals() {
    ResidualText residual =
        ResidualText.of("ab[X]cd[Y]ef").without(List.of(new SourceSpan(2, 5)));
    assertEquals("abcd[Y]ef", residual.text());
    ResidualText again = residual.withoutResidual(List.of(new SourceSpan(4, 7)));
    assertEquals("abcdef", again.text());
    assertTrue(again.isTouched(new SourceSpan(7, 10)));
  }
}
