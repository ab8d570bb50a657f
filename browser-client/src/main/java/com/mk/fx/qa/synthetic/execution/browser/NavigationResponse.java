package com.mk.fx.qa.synthetic.execution.browser;

/**
 * Main-document response of a navigation.
 *
 * @param statusCode HTTP status, or -1 when the navigation produced no response (e.g. about:blank)
 * @param url final URL after redirects
 * @param responseStartMs milliseconds from request start to first response byte; null when the
 *     browser does not expose it
 */
public record NavigationResponse(int statusCode, String url, Double responseStartMs) {

    public static NavigationResponse empty(String url) {
        return new NavigationResponse(-1, url, null);
    }
}
