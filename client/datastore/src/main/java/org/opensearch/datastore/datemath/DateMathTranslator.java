/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore.datemath;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Translates date math written with the datastore's symbolic vocabulary, e.g. {@code now-1d} or
 * {@code 2024-01-01T00:00:00Z-1M}, into the engine's native date math.
 * <p>
 * Translation is a fixed sequence of substring replacements applied left to right. The order matters since
 * some symbols are substrings of others. A symbol is left alone where it already starts its native form,
 * which makes translating twice the same as translating once.
 */
public final class DateMathTranslator {

    public static final String NOW = "now";
    public static final String YEAR = "y";
    public static final String MONTH = "M";
    public static final String WEEK = "w";
    public static final String DAY = "d";
    public static final String HOUR = "h";
    public static final String MINUTE = "m";
    public static final String SECOND = "s";
    public static final String MILLISECOND = "ms";
    public static final String MICROSECOND = "micros";
    public static final String NANOSECOND = "nanos";
    public static final String SEPARATOR = "||";
    public static final String DATE_END = "Z";

    /**
     * Symbol to native token, in application order. Sub-second units have no native form and are left as is.
     */
    static final List<Map.Entry<String, String>> REPLACEMENTS = Collections.unmodifiableList(
        Arrays.asList(
            entry(NOW, "now"),
            entry(YEAR, "y"),
            entry(MONTH, "M"),
            entry(WEEK, "w"),
            entry(DAY, "d"),
            entry(HOUR, "h"),
            entry(MINUTE, "m"),
            entry(SECOND, "s"),
            entry(DATE_END, "Z||")
        )
    );

    private static final DateMathTranslator INSTANCE = new DateMathTranslator();

    private DateMathTranslator() {}

    public static DateMathTranslator getInstance() {
        return INSTANCE;
    }

    public String translate(String expression) {
        String value = expression;
        for (Map.Entry<String, String> replacement : REPLACEMENTS) {
            value = replace(value, replacement.getKey(), replacement.getValue());
        }
        return value;
    }

    /**
     * Replaces every occurrence of {@code symbol} that does not already start {@code nativeToken}.
     */
    static String replace(String value, String symbol, String nativeToken) {
        if (symbol.equals(nativeToken)) {
            return value;
        }
        boolean extendsSymbol = nativeToken.startsWith(symbol);
        StringBuilder out = new StringBuilder(value.length());
        int from = 0;
        int at;
        while ((at = value.indexOf(symbol, from)) != -1) {
            out.append(value, from, at);
            if (extendsSymbol && value.startsWith(nativeToken, at)) {
                out.append(nativeToken);
                from = at + nativeToken.length();
            } else {
                out.append(nativeToken);
                from = at + symbol.length();
            }
        }
        out.append(value, from, value.length());
        return out.toString();
    }

    private static Map.Entry<String, String> entry(String symbol, String nativeToken) {
        return new AbstractMap.SimpleImmutableEntry<>(symbol, nativeToken);
    }
}
