/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Options for delete requests, sent as query parameters.
 *
 * @param dryRun if true, the request is validated but nothing is deleted.
 * @param gracePeriodSeconds seconds before the object is deleted, or null for the default.
 * @param propagationPolicy garbage collection policy for dependents, or null for the default.
 */
public record DeleteParams(boolean dryRun,
                           @Nullable Long gracePeriodSeconds,
                           @Nullable PropagationPolicy propagationPolicy) {

    private static final DeleteParams DEFAULT = new DeleteParams(false, null, null);

    public static DeleteParams defaults() {
        return DEFAULT;
    }

    public DeleteParams withDryRun(boolean dryRun) {
        return new DeleteParams(dryRun, gracePeriodSeconds, propagationPolicy);
    }

    public DeleteParams withGracePeriodSeconds(@Nullable Long gracePeriodSeconds) {
        return new DeleteParams(dryRun, gracePeriodSeconds, propagationPolicy);
    }

    public DeleteParams withPropagationPolicy(@Nullable PropagationPolicy propagationPolicy) {
        return new DeleteParams(dryRun, gracePeriodSeconds, propagationPolicy);
    }

    void appendTo(QueryBuilder query) {
        query.appendIf(dryRun, "dryRun", "All")
                .append("gracePeriodSeconds", gracePeriodSeconds)
                .append("propagationPolicy", propagationPolicy == null ? null : propagationPolicy.queryValue());
    }
}
