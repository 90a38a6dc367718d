/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamgraph.aggregate;

import java.util.regex.Pattern;

/**
 * Numeric coercion for aggregates. Integral inputs stay {@code long}; anything else widens to {@code double}.
 */
final class Numbers {

    private static final Long ZERO = 0L;

    // Up to 18 digits always fits a long; longer literals parse as double
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,18}");

    private Numbers() {}

    /**
     * Coerces a payload value; unparseable or missing values count as 0.
     */
    static Number coerce(Object value) {
        if (value instanceof Number n) return isIntegral(n) ? (Number) n.longValue() : (Number) n.doubleValue();
        if (value instanceof CharSequence cs) {
            final String s = cs.toString().trim();
            if (s.isEmpty()) return ZERO;
            try {
                return INTEGER.matcher(s).matches() ? (Number) Long.parseLong(s) : (Number) Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return ZERO;
            }
        }
        if (value instanceof Boolean b) return b ? 1L : 0L;
        return ZERO;
    }

    /**
     * Sums two values. A {@code long} sum that would overflow widens to {@code double}.
     */
    static Number add(Number a, Number b) {
        if (a instanceof Long && b instanceof Long) {
            try {
                return Math.addExact(a.longValue(), b.longValue());
            } catch (ArithmeticException overflow) {
                return a.doubleValue() + b.doubleValue();
            }
        }
        return a.doubleValue() + b.doubleValue();
    }

    static Number min(Number a, Number b) {
        return compare(a, b) <= 0 ? a : b;
    }

    static Number max(Number a, Number b) {
        return compare(a, b) >= 0 ? a : b;
    }

    private static int compare(Number a, Number b) {
        if (a instanceof Long && b instanceof Long) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }
}
