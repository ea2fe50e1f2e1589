/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Accumulates form-encoded query parameters. Absent values add nothing, so an empty
 * builder yields an empty string rather than a dangling separator.
 */
final class QueryBuilder {

    private final StringJoiner pairs = new StringJoiner("&");

    QueryBuilder append(String key, @Nullable String value) {
        if (value != null && !value.isEmpty()) {
            pairs.add(encode(key) + "=" + encode(value));
        }
        return this;
    }

    QueryBuilder append(String key, @Nullable Number value) {
        return append(key, value == null ? null : value.toString());
    }

    QueryBuilder appendIf(boolean condition, String key, String value) {
        return condition ? append(key, value) : this;
    }

    String build() {
        return pairs.toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
