package com.polymarket.edge.strategy;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live tunables of one strategy. Values are read on every use, so a merge through
 * {@link Strategy#updateConfig} takes effect on the next run.
 */
public class StrategyParams {

    public static final String AVAILABLE_CAPITAL = "availableCapital";
    public static final String MAX_POSITION_FRACTION = "maxPositionFraction";
    public static final String MIN_POSITION_SIZE = "minPositionSize";
    public static final String DEFAULT_POSITION_FRACTION = "defaultPositionFraction";

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public StrategyParams() {
    }

    public StrategyParams(Map<String, ?> initial) {
        merge(initial);
    }

    public StrategyParams put(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    public void merge(Map<String, ?> updates) {
        if (updates != null) {
            updates.forEach(this::put);
        }
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        return v == null ? defaultValue : Double.parseDouble(v.toString());
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number) {
            return ((Number) v).intValue();
        }
        return v == null ? defaultValue : Integer.parseInt(v.toString());
    }

    public BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        Object v = values.get(key);
        if (v instanceof BigDecimal) {
            return (BigDecimal) v;
        }
        if (v instanceof Number) {
            return BigDecimal.valueOf(((Number) v).doubleValue());
        }
        return v == null ? defaultValue : new BigDecimal(v.toString());
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        return v == null ? defaultValue : Boolean.parseBoolean(v.toString());
    }

    /** Sorted, unmodifiable copy. */
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.keySet().stream().sorted().forEach(k -> copy.put(k, values.get(k)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
