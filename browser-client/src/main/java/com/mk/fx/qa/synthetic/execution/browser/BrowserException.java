package com.mk.fx.qa.synthetic.execution.browser;

/** Raised when the browser cannot be launched, crashes or fails to navigate. */
public class BrowserException extends RuntimeException {

    public BrowserException(String message) {
        super(message);
    }

    public BrowserException(String message, Throwable cause) {
        super(message, cause);
    }
}
