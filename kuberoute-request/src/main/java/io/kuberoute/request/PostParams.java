/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Options for create and replace requests.
 *
 * @param dryRun if true, the request is validated but not persisted.
 * @param fieldManager name of the actor making the change, or null.
 * @param fieldValidation server-side field validation, or null for the server default.
 */
public record PostParams(boolean dryRun,
                         @Nullable String fieldManager,
                         @Nullable FieldValidation fieldValidation) {

    private static final PostParams DEFAULT = new PostParams(false, null, null);

    public static PostParams defaults() {
        return DEFAULT;
    }

    public PostParams withDryRun(boolean dryRun) {
        return new PostParams(dryRun, fieldManager, fieldValidation);
    }

    public PostParams withFieldManager(@Nullable String fieldManager) {
        return new PostParams(dryRun, fieldManager, fieldValidation);
    }

    public PostParams withFieldValidation(@Nullable FieldValidation fieldValidation) {
        return new PostParams(dryRun, fieldManager, fieldValidation);
    }

    void appendTo(QueryBuilder query) {
        query.appendIf(dryRun, "dryRun", "All")
                .append("fieldManager", fieldManager)
                .append("fieldValidation", fieldValidation == null ? null : fieldValidation.queryValue());
    }
}
