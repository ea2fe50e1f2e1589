/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Options for watch requests. The resource version to resume from is passed alongside.
 *
 * @param labelSelector restricts events by label.
 * @param fieldSelector restricts events by field.
 * @param timeoutSeconds server-side timeout after which the watch is closed.
 * @param allowWatchBookmarks if true, the server may send bookmark events.
 */
public record WatchParams(@Nullable String labelSelector,
                          @Nullable String fieldSelector,
                          @Nullable Integer timeoutSeconds,
                          boolean allowWatchBookmarks) {

    private static final WatchParams DEFAULT = new WatchParams(null, null, null, false);

    public static WatchParams defaults() {
        return DEFAULT;
    }

    public WatchParams withLabelSelector(@Nullable String labelSelector) {
        return new WatchParams(labelSelector, fieldSelector, timeoutSeconds, allowWatchBookmarks);
    }

    public WatchParams withFieldSelector(@Nullable String fieldSelector) {
        return new WatchParams(labelSelector, fieldSelector, timeoutSeconds, allowWatchBookmarks);
    }

    public WatchParams withTimeoutSeconds(@Nullable Integer timeoutSeconds) {
        return new WatchParams(labelSelector, fieldSelector, timeoutSeconds, allowWatchBookmarks);
    }

    public WatchParams withAllowWatchBookmarks(boolean allowWatchBookmarks) {
        return new WatchParams(labelSelector, fieldSelector, timeoutSeconds, allowWatchBookmarks);
    }

    void appendTo(QueryBuilder query, @Nullable String resourceVersion) {
        query.append("watch", "true")
                .append("labelSelector", labelSelector)
                .append("fieldSelector", fieldSelector)
                .append("resourceVersion", resourceVersion)
                .append("timeoutSeconds", timeoutSeconds)
                .appendIf(allowWatchBookmarks, "allowWatchBookmarks", "true");
    }
}
