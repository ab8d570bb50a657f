package com.mk.fx.qa.synthetic.execution.checker;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.synthetic.execution.browser.BrowserSession;
import com.mk.fx.qa.synthetic.execution.browser.NavigationResponse;
import com.mk.fx.qa.synthetic.execution.model.PageMetrics;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives TTFB, DOM-ready and load times for a loaded page.
 *
 * <p>DOM-ready and load come from the Navigation Timing Level 2 entry when the browser reports a
 * positive value there, and from the legacy {@code performance.timing} object otherwise.
 */
@Slf4j
@Component
public class PageMetricsExtractor {

  static final String TIMING_SCRIPT =
      "() => {"
          + " const timing = performance.timing;"
          + " const navigation = performance.getEntriesByType('navigation')[0];"
          + " return {"
          + "   domContentLoaded: timing.domContentLoadedEventEnd - timing.navigationStart,"
          + "   pageLoad: timing.loadEventEnd - timing.navigationStart,"
          + "   navigationDomContentLoaded: navigation ? navigation.domContentLoadedEventEnd : null,"
          + "   navigationLoadComplete: navigation ? navigation.loadEventEnd : null"
          + " };"
          + "}";

  public PageMetrics extract(BrowserSession session, NavigationResponse response) {
    Object timing = session.evaluate(TIMING_SCRIPT);
    return extract(response, timing);
  }

  @VisibleForTesting
  PageMetrics extract(NavigationResponse response, Object timing) {
    Double ttfb = ttfb(response);
    if (!(timing instanceof Map<?, ?> values)) {
      log.debug("Page returned no timing data: {}", timing);
      return new PageMetrics(ttfb, null, null);
    }
    Double domContentLoaded =
        prefer(number(values.get("navigationDomContentLoaded")), number(values.get("domContentLoaded")));
    Double pageLoad =
        prefer(number(values.get("navigationLoadComplete")), number(values.get("pageLoad")));
    return new PageMetrics(ttfb, domContentLoaded, pageLoad);
  }

  private static Double ttfb(NavigationResponse response) {
    if (response == null || response.responseStartMs() == null) {
      return null;
    }
    // Playwright reports -1 when the timing is unavailable
    double value = response.responseStartMs();
    return value < 0 ? null : value;
  }

  private static Double prefer(Double navigationEntry, Double legacy) {
    if (navigationEntry != null && navigationEntry > 0) {
      return navigationEntry;
    }
    if (legacy != null && legacy >= 0) {
      return legacy;
    }
    return null;
  }

  private static Double number(Object value) {
    return value instanceof Number n ? n.doubleValue() : null;
  }
}
