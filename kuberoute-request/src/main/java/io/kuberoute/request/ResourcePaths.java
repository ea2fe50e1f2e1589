/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import io.kuberoute.descriptor.ResourceDescriptor;

/**
 * Routing rules of a Kubernetes-style REST API.
 * <pre>
 * /api/{version}/{plural}                                 core group, cluster scope
 * /apis/{group}/{version}/{plural}                        named group, cluster scope
 * /apis/{group}/{version}/namespaces/{namespace}/{plural} named group, namespace scope
 * </pre>
 */
public final class ResourcePaths {

    private ResourcePaths() {
    }

    /**
     * @param descriptor resource descriptor
     * @return the path of the resource collection
     */
    public static String collectionPath(ResourceDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        var path = new StringBuilder(descriptor.isCoreGroup() ? "/api" : "/apis");
        if (!descriptor.isCoreGroup()) {
            path.append('/').append(encodeSegment(descriptor.group()));
        }
        path.append('/').append(encodeSegment(descriptor.version()));
        descriptor.namespace().ifPresent(ns -> path.append("/namespaces/").append(encodeSegment(ns)));
        return path.append('/').append(encodeSegment(descriptor.plural())).toString();
    }

    /**
     * @param descriptor resource descriptor
     * @param name resource name
     * @return the path of a single named resource
     */
    public static String itemPath(ResourceDescriptor descriptor, String name) {
        return collectionPath(descriptor) + "/" + encodeSegment(name);
    }

    /**
     * @param descriptor resource descriptor
     * @param name resource name
     * @param subresource subresource, e.g. {@code status}
     * @return the path of a subresource of a single named resource
     */
    public static String subresourcePath(ResourceDescriptor descriptor, String name, String subresource) {
        return itemPath(descriptor, name) + "/" + encodeSegment(subresource);
    }

    static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
