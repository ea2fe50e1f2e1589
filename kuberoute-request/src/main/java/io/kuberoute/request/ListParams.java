/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Options for list and delete-collection requests. Null or empty options are omitted.
 *
 * @param labelSelector restricts the list by label, e.g. {@code app=foo,tier!=db}.
 * @param fieldSelector restricts the list by field, e.g. {@code metadata.name=bar}.
 * @param resourceVersion the resource version the list must be at least as fresh as.
 * @param timeoutSeconds server-side timeout for the call.
 * @param limit maximum number of items per page.
 * @param continueToken token from a previous page.
 */
public record ListParams(@Nullable String labelSelector,
                         @Nullable String fieldSelector,
                         @Nullable String resourceVersion,
                         @Nullable Integer timeoutSeconds,
                         @Nullable Long limit,
                         @Nullable String continueToken) {

    private static final ListParams DEFAULT = new ListParams(null, null, null, null, null, null);

    public static ListParams defaults() {
        return DEFAULT;
    }

    public ListParams withLabelSelector(@Nullable String labelSelector) {
        return new ListParams(labelSelector, fieldSelector, resourceVersion, timeoutSeconds, limit, continueToken);
    }

    public ListParams withFieldSelector(@Nullable String fieldSelector) {
        return new ListParams(labelSelector, fieldSelector, resourceVersion, timeoutSeconds, limit, continueToken);
    }

    public ListParams withResourceVersion(@Nullable String resourceVersion) {
        return new ListParams(labelSelector, fieldSelector, resourceVersion, timeoutSeconds, limit, continueToken);
    }

    public ListParams withTimeoutSeconds(@Nullable Integer timeoutSeconds) {
        return new ListParams(labelSelector, fieldSelector, resourceVersion, timeoutSeconds, limit, continueToken);
    }

    public ListParams withLimit(@Nullable Long limit) {
        return new ListParams(labelSelector, fieldSelector, resourceVersion, timeoutSeconds, limit, continueToken);
    }

    public ListParams withContinueToken(@Nullable String continueToken) {
        return new ListParams(labelSelector, fieldSelector, resourceVersion, timeoutSeconds, limit, continueToken);
    }

    void appendTo(QueryBuilder query) {
        query.append("labelSelector", labelSelector)
                .append("fieldSelector", fieldSelector)
                .append("resourceVersion", resourceVersion)
                .append("timeoutSeconds", timeoutSeconds)
                .append("limit", limit)
                .append("continue", continueToken);
    }
}
