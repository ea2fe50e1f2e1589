/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Options for patch requests, including the patch strategy chosen by the caller.
 *
 * @param strategy patch strategy, which determines the content type.
 * @param dryRun if true, the request is validated but not persisted.
 * @param force if true, conflicts are resolved in favour of this field manager. Server-side apply only.
 * @param fieldManager name of the actor making the change. Required for server-side apply.
 * @param fieldValidation server-side field validation, or null for the server default.
 */
public record PatchParams(PatchStrategy strategy,
                          boolean dryRun,
                          boolean force,
                          @Nullable String fieldManager,
                          @Nullable FieldValidation fieldValidation) {

    /**
     * @throws IllegalArgumentException if force is requested without server-side apply, or
     * server-side apply lacks a field manager
     */
    public PatchParams {
        Objects.requireNonNull(strategy, "strategy");
        if (force && strategy != PatchStrategy.APPLY) {
            throw new IllegalArgumentException("force is only supported for server-side apply patches");
        }
        if (strategy == PatchStrategy.APPLY && (fieldManager == null || fieldManager.isEmpty())) {
            throw new IllegalArgumentException("server-side apply patches require a field manager");
        }
    }

    public static PatchParams merge() {
        return new PatchParams(PatchStrategy.MERGE, false, false, null, null);
    }

    public static PatchParams json() {
        return new PatchParams(PatchStrategy.JSON, false, false, null, null);
    }

    public static PatchParams strategicMerge() {
        return new PatchParams(PatchStrategy.STRATEGIC_MERGE, false, false, null, null);
    }

    public static PatchParams apply(String fieldManager) {
        return new PatchParams(PatchStrategy.APPLY, false, false, fieldManager, null);
    }

    public PatchParams withDryRun(boolean dryRun) {
        return new PatchParams(strategy, dryRun, force, fieldManager, fieldValidation);
    }

    public PatchParams withForce(boolean force) {
        return new PatchParams(strategy, dryRun, force, fieldManager, fieldValidation);
    }

    public PatchParams withFieldManager(@Nullable String fieldManager) {
        return new PatchParams(strategy, dryRun, force, fieldManager, fieldValidation);
    }

    public PatchParams withFieldValidation(@Nullable FieldValidation fieldValidation) {
        return new PatchParams(strategy, dryRun, force, fieldManager, fieldValidation);
    }

    void appendTo(QueryBuilder query) {
        query.appendIf(dryRun, "dryRun", "All")
                .appendIf(force, "force", "true")
                .append("fieldManager", fieldManager)
                .append("fieldValidation", fieldValidation == null ? null : fieldValidation.queryValue());
    }
}
