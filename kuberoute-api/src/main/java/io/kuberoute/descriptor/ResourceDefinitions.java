/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A document listing resource definitions.
 *
 * @param resources the definitions, in document order.
 */
public record ResourceDefinitions(@JsonProperty(value = "resources", required = true) List<ResourceDefinition> resources) {

    @JsonCreator
    public ResourceDefinitions {
        if (resources == null) {
            throw new IllegalArgumentException("'resources' is required.");
        }
        resources = List.copyOf(resources);
    }
}
