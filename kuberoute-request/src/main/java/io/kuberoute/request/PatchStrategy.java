/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

/**
 * The patch strategy, conveyed to the server by the content type of the patch body.
 * The patch body itself is never interpreted.
 */
public enum PatchStrategy {
    /** RFC 7386 JSON merge patch. */
    MERGE("application/merge-patch+json"),
    /** RFC 6902 JSON patch. */
    JSON("application/json-patch+json"),
    STRATEGIC_MERGE("application/strategic-merge-patch+json"),
    /** Server-side apply. Requires a field manager. */
    APPLY("application/apply-patch+yaml");

    private final String contentType;

    PatchStrategy(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
