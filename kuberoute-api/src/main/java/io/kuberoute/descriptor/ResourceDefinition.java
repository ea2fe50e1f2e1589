/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The identity of a resource type, as supplied by a user. Nothing beyond the presence of
 * {@code kind} is checked here; {@link ResourceDescriptor#from(ResourceDefinition)} validates
 * the definition as a whole.
 *
 * @param kind singular PascalCase kind, e.g. {@code Foo}.
 * @param group API group, the empty string being the core group. Required to build a descriptor.
 * @param version API version, e.g. {@code v1}. Required to build a descriptor.
 * @param namespace namespace the resource lives in, or null for cluster scoped access.
 */
public record ResourceDefinition(@JsonProperty(value = "kind", required = true) String kind,
                                 @JsonProperty("group") @Nullable String group,
                                 @JsonProperty("version") @Nullable String version,
                                 @JsonProperty("namespace") @Nullable String namespace) {

    @JsonCreator
    public ResourceDefinition {
        if (kind == null) {
            throw new IllegalArgumentException("'kind' is required in a resource definition.");
        }
    }

    public ResourceDefinition withGroup(@Nullable String group) {
        return new ResourceDefinition(kind, group, version, namespace);
    }

    public ResourceDefinition withVersion(@Nullable String version) {
        return new ResourceDefinition(kind, group, version, namespace);
    }

    public ResourceDefinition withNamespace(@Nullable String namespace) {
        return new ResourceDefinition(kind, group, version, namespace);
    }
}
