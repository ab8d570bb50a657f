package com.mk.fx.qa.synthetic.execution.checker;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.synthetic.execution.browser.NavigationResponse;
import com.mk.fx.qa.synthetic.execution.model.PageMetrics;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PageMetricsExtractorTest {

  private final PageMetricsExtractor extractor = new PageMetricsExtractor();

  private static NavigationResponse response(Double responseStart) {
    return new NavigationResponse(200, "https://example.com/", responseStart);
  }

  private static Map<String, Object> timing(
      Object legacyDcl, Object legacyLoad, Object navigationDcl, Object navigationLoad) {
    Map<String, Object> values = new HashMap<>();
    values.put("domContentLoaded", legacyDcl);
    values.put("pageLoad", legacyLoad);
    values.put("navigationDomContentLoaded", navigationDcl);
    values.put("navigationLoadComplete", navigationLoad);
    return values;
  }

  @Test
  void extract_prefersNavigationTimingEntry() {
    PageMetrics metrics = extractor.extract(response(42.5), timing(300, 900, 310.4, 905.7));

    assertEquals(42.5, metrics.ttfbMs());
    assertEquals(310.4, metrics.domContentLoadedMs());
    assertEquals(905.7, metrics.pageLoadMs());
  }

  @Test
  void extract_fallsBackToLegacyTimingWhenEntryIsZeroOrMissing() {
    PageMetrics metrics = extractor.extract(response(12.0), timing(250, 800, 0, null));

    assertEquals(250.0, metrics.domContentLoadedMs());
    assertEquals(800.0, metrics.pageLoadMs());
  }

  @Test
  void extract_zeroLegacyValueIsKept() {
    PageMetrics metrics = extractor.extract(response(1.0), timing(0, 0, null, null));

    assertEquals(0.0, metrics.domContentLoadedMs());
    assertEquals(0.0, metrics.pageLoadMs());
  }

  @Test
  void extract_negativeLegacyValueIsAbsent() {
    // loadEventEnd is 0 until the load handler finishes, which makes the difference negative
    PageMetrics metrics =
        extractor.extract(response(5.0), timing(120, -1_700_000_000_000L, null, null));

    assertEquals(120.0, metrics.domContentLoadedMs());
    assertNull(metrics.pageLoadMs());
  }

  @Test
  void extract_unavailableResponseStartMeansNoTtfb() {
    assertNull(extractor.extract(response(-1.0), timing(1, 2, null, null)).ttfbMs());
    assertNull(extractor.extract(response(null), timing(1, 2, null, null)).ttfbMs());
    assertNull(extractor.extract(null, timing(1, 2, null, null)).ttfbMs());
  }

  @Test
  void extract_nonMapScriptResultKeepsOnlyTtfb() {
    PageMetrics metrics = extractor.extract(response(33.0), "not a map");

    assertEquals(33.0, metrics.ttfbMs());
    assertNull(metrics.domContentLoadedMs());
    assertNull(metrics.pageLoadMs());
  }

  @Test
  void extract_nonNumericValuesAreAbsent() {
    PageMetrics metrics = extractor.extract(response(null), timing("x", null, "y", null));

    assertTrue(metrics.isEmpty());
  }
}
