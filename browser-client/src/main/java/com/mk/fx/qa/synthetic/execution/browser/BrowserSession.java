package com.mk.fx.qa.synthetic.execution.browser;

import java.time.Duration;

/**
 * A single, isolated headless-browser session. One session serves exactly one check and is never
 * shared; {@link #close()} releases every resource the session acquired.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Navigates the session's page to {@code url} and waits for the {@code load} event.
     *
     * @param url absolute URL to open
     * @param timeout upper bound for the whole navigation
     * @return timing information about the main document response
     * @throws NavigationTimeoutException if the bound is exceeded
     * @throws BrowserException for any other navigation or session failure
     */
    NavigationResponse navigate(String url, Duration timeout);

    /**
     * Evaluates a JavaScript expression in the page and returns the result converted by the driver
     * (maps, lists, numbers, strings or null).
     */
    Object evaluate(String script);

    /**
     * Closes the browser context so that any network recording is flushed to disk. Idempotent.
     */
    void finishRecording();

    @Override
    void close();
}
