package com.gentoro.llmc.validation;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HallucinationDetectorTest {

  private static final String LISTING = "I listed the folder:\n├── src\n└── pom.xml\n";

  private final HallucinationDetector detector = new HallucinationDetector();

  @Test
  @DisplayName("fake result markers are flagged even when tools were called")
  void fakeResultMarkers() {
    HallucinationReport report = detector.check("[Tool Results]\nall tests passed", true);
    assertTrue(report.hallucinating());
    assertTrue(report.has(HallucinationIndicator.FAKE_TOOL_RESULT));
    assertEquals(1, report.issues().size());
    assertEquals(HallucinationDetector.RETRY_ACTION, report.suggestedAction());
  }

  @Test
  @DisplayName("a lone claim is noted but not treated as hallucination")
  void loneClaim() {
    HallucinationReport report = detector.check("I've read the file and it looks fine.", false);
    assertFalse(report.hallucinating());
    assertTrue(report.has(HallucinationIndicator.UNSUBSTANTIATED_CLAIM));
    assertNull(report.suggestedAction());
  }

  @Test
  @DisplayName("a directory tree without a tool call is a hallucination")
  void directoryListing() {
    HallucinationReport report = detector.check(LISTING, false);
    assertTrue(report.hallucinating());
    assertTrue(report.has(HallucinationIndicator.FAKE_DIRECTORY_LISTING));
    assertTrue(report.has(HallucinationIndicator.UNSUBSTANTIATED_CLAIM));
    assertEquals(2, report.issues().size());
  }

  @Test
  @DisplayName("content checks are skipped when the response called tools")
  void toolCallsExplainContent() {
    assertSame(HallucinationReport.CLEAN, detector.check(LISTING, true));
  }

  @Test
  @DisplayName("file content shown without reading the file is flagged")
  void fakeFileContent() {
    HallucinationReport report =
        detector.check("Here is the content of config.yml:\n```yaml\nport: 8080\n```", false);
    assertTrue(report.hallucinating());
    assertTrue(report.has(HallucinationIndicator.FAKE_FILE_CONTENT));
  }

  @Test
  @DisplayName("a complete class is suspicious, a short snippet is not")
  void suspiciousCode() {
    String body =
        "public class OrderService {\n"
            + "  // Handles order placement and lookups for the storefront backend.\n"
            + "  private final Repository repository;\n"
            + "}\n";
    HallucinationReport report = detector.check("```java\n" + body + "```", false);
    assertTrue(report.has(HallucinationIndicator.SUSPICIOUS_CODE));
    assertTrue(report.issues().get(0).contains("java"));

    assertSame(HallucinationReport.CLEAN, detector.check("```python\nprint('hi')\n```", false));
    assertFalse(HallucinationDetector.looksLikeCompleteCode("class A {}"));
  }

  @Test
  @DisplayName("ordinary prose is clean")
  void clean() {
    assertSame(HallucinationReport.CLEAN, detector.check("Use a map for lookups.", false));
    assertSame(HallucinationReport.CLEAN, detector.check(null, false));
  }

  @Test
  @DisplayName("cleaning strips markers, bracketed output and tree lines")
  void cleaning() {
    assertEquals("Before\n\nAfter", detector.clean("Before\n[Tool Results]\n\n\n\nAfter"));
    assertEquals("Done.", detector.clean("[File: a.txt]\nline1\nline2\n\nDone."));
    assertEquals("Files:\nEnd", detector.clean("Files:\n├── a\n└── b\nEnd"));
    assertNull(detector.clean(null));
    assertEquals("  ", detector.clean("  "));
  }
}
