package com.venuepulse.sentiment.dispatch;

import java.time.Duration;
import java.util.Map;

/**
 * Per-model call budget. A model without an entry gets {@code defaultTimeout}.
 */
public record DispatchSettings(Duration defaultTimeout, Map<String, Duration> perModelTimeouts) {

    public DispatchSettings {
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        perModelTimeouts = Map.copyOf(perModelTimeouts);
    }

    public Duration timeoutFor(String modelName) {
        return perModelTimeouts.getOrDefault(modelName, defaultTimeout);
    }
}
