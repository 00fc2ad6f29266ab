package com.polymarket.edge.risk;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a risk gate. A failed check carries a human-readable reason; gates
 * never adjust the trade themselves.
 */
@Getter
public class RiskCheckResult {

    private static final RiskCheckResult PASSED = new RiskCheckResult(true, null, Collections.emptyMap());

    private final boolean passed;
    private final String reason;
    private final Map<String, Object> metrics;

    private RiskCheckResult(boolean passed, String reason, Map<String, Object> metrics) {
        this.passed = passed;
        this.reason = reason;
        this.metrics = metrics;
    }

    public static RiskCheckResult passed() {
        return PASSED;
    }

    public static RiskCheckResult passed(Map<String, Object> metrics) {
        return new RiskCheckResult(true, null, Collections.unmodifiableMap(new LinkedHashMap<>(metrics)));
    }

    public static RiskCheckResult failed(String reason, Map<String, Object> metrics) {
        return new RiskCheckResult(false, reason, Collections.unmodifiableMap(new LinkedHashMap<>(metrics)));
    }

    public boolean isFailed() {
        return !passed;
    }

    @Override
    public String toString() {
        return passed ? "RiskCheckResult{passed}" : "RiskCheckResult{failed: " + reason + "}";
    }
}
