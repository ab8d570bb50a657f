package com.mk.fx.qa.synthetic.execution.browser;

import java.time.Duration;

/** Raised when a navigation does not reach the load event within its bound. */
public class NavigationTimeoutException extends BrowserException {

    private final Duration timeout;

    public NavigationTimeoutException(Duration timeout, String message, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
