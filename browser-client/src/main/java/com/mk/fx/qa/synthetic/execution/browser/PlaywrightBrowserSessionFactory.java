package com.mk.fx.qa.synthetic.execution.browser;

import lombok.extern.slf4j.Slf4j;

/**
 * Launches a brand new Playwright driver and Chromium instance for every session. Slower than
 * pooling, but one check's cookies, cache and connections can never leak into another's timings.
 */
@Slf4j
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    @Override
    public BrowserSession open(SessionOptions options) {
        var startTime = System.nanoTime();
        var session = PlaywrightBrowserSession.launch(options);
        log.debug("Browser launched in {} ms", (System.nanoTime() - startTime) / 1_000_000);
        return session;
    }
}
