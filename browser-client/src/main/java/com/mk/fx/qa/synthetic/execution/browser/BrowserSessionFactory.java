package com.mk.fx.qa.synthetic.execution.browser;

/** Creates fresh browser sessions. Implementations must never hand out the same session twice. */
@FunctionalInterface
public interface BrowserSessionFactory {

    /**
     * Launches a new session.
     *
     * @throws BrowserException if the browser cannot be launched
     */
    BrowserSession open(SessionOptions options);
}
