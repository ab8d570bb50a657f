package com.mk.fx.qa.synthetic.execution.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.HarContentPolicy;
import com.microsoft.playwright.options.WaitUntilState;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Playwright-backed session: one driver process, one Chromium instance, one context and one page.
 *
 * <p>Nothing is shared with other sessions, so concurrent sessions on different threads are safe.
 * The instance itself is not thread-safe.
 */
@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    private boolean contextClosed;
    private boolean closed;

    private PlaywrightBrowserSession(
            Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    /**
     * Launches a fresh Playwright driver, Chromium and context. Anything acquired before a failure
     * is released again before the exception propagates.
     */
    static PlaywrightBrowserSession launch(SessionOptions options) {
        Objects.requireNonNull(options, "options");
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (PlaywrightException e) {
            throw new BrowserException("Failed to start Playwright driver: " + e.getMessage(), e);
        }

        Browser browser = null;
        try {
            browser =
                    playwright
                            .chromium()
                            .launch(
                                    new BrowserType.LaunchOptions()
                                            .setHeadless(options.headless())
                                            .setArgs(options.launchArgs())
                                            .setTimeout(options.operationTimeout().toMillis()));

            var contextOptions = new Browser.NewContextOptions();
            if (options.recordsHar()) {
                contextOptions
                        .setRecordHarPath(options.harPath())
                        .setRecordHarContent(HarContentPolicy.OMIT);
            }
            BrowserContext context = browser.newContext(contextOptions);
            Page page = context.newPage();
            page.setDefaultTimeout(options.operationTimeout().toMillis());

            log.debug(
                    "Browser session launched (headless={}, har={})",
                    options.headless(),
                    options.harPath());
            return new PlaywrightBrowserSession(playwright, browser, context, page);
        } catch (PlaywrightException e) {
            var failure = new BrowserException("Failed to launch browser: " + e.getMessage(), e);
            releaseInto(failure, browser);
            releaseInto(failure, playwright);
            throw failure;
        }
    }

    @Override
    public NavigationResponse navigate(String url, Duration timeout) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(timeout, "timeout");
        Response response;
        try {
            response =
                    page.navigate(
                            url,
                            new Page.NavigateOptions()
                                    .setTimeout(timeout.toMillis())
                                    .setWaitUntil(WaitUntilState.LOAD));
        } catch (TimeoutError e) {
            throw new NavigationTimeoutException(timeout, e.getMessage(), e);
        } catch (PlaywrightException e) {
            throw new BrowserException(e.getMessage(), e);
        }

        if (response == null) {
            return NavigationResponse.empty(url);
        }
        return new NavigationResponse(response.status(), response.url(), responseStart(response));
    }

    private Double responseStart(Response response) {
        try {
            var timing = response.request().timing();
            return timing != null ? timing.responseStart : null;
        } catch (PlaywrightException e) {
            log.debug("Response timing unavailable for {}: {}", response.url(), e.getMessage());
            return null;
        }
    }

    @Override
    public Object evaluate(String script) {
        try {
            return page.evaluate(script);
        } catch (PlaywrightException e) {
            throw new BrowserException("Page script evaluation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void finishRecording() {
        if (contextClosed) {
            return;
        }
        contextClosed = true;
        try {
            context.close();
        } catch (PlaywrightException e) {
            throw new BrowserException("Failed to close browser context: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        BrowserException failure = null;
        if (!contextClosed) {
            contextClosed = true;
            failure = closeInto(failure, context);
        }
        failure = closeInto(failure, browser);
        failure = closeInto(failure, playwright);
        if (failure != null) {
            throw failure;
        }
        log.debug("Browser session released");
    }

    private static BrowserException closeInto(BrowserException failure, AutoCloseable resource) {
        try {
            resource.close();
            return failure;
        } catch (Exception e) {
            if (failure == null) {
                return new BrowserException("Failed to release browser session: " + e.getMessage(), e);
            }
            failure.addSuppressed(e);
            return failure;
        }
    }

    private static void releaseInto(BrowserException failure, AutoCloseable resource) {
        if (resource != null) {
            closeInto(failure, resource);
        }
    }
}
