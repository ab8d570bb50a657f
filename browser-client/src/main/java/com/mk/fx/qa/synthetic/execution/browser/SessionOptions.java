package com.mk.fx.qa.synthetic.execution.browser;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Launch options for a single browser session.
 *
 * @param headless whether the browser runs without a window
 * @param launchArgs extra command line switches passed to Chromium
 * @param harPath file the network trace is recorded into, or null to disable recording
 * @param operationTimeout bound applied to browser launch and page script evaluation
 */
public record SessionOptions(
        boolean headless, List<String> launchArgs, Path harPath, Duration operationTimeout) {

    public SessionOptions {
        launchArgs = launchArgs != null ? List.copyOf(launchArgs) : List.of();
        Objects.requireNonNull(operationTimeout, "operationTimeout");
        if (operationTimeout.isNegative() || operationTimeout.isZero()) {
            throw new IllegalArgumentException("operationTimeout must be positive");
        }
    }

    public boolean recordsHar() {
        return harPath != null;
    }
}
