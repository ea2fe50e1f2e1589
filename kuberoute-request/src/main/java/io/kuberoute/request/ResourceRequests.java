/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kuberoute.descriptor.ResourceDescriptor;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Synthesizes the requests for one resource type. Each method is a pure function of the
 * descriptor and its arguments, and returns a fresh {@link RequestSpec}.</p>
 *
 * <p>The type parameter names the type responses are expected to deserialize to. It carries no
 * runtime behaviour here; it lets a {@link ResourceClient} be typed accordingly.</p>
 *
 * <pre>{@code
 * ResourceRequests<Foo> foos = ResourceRequests.of(descriptor, Foo.class);
 * RequestSpec request = foos.patch("baz", PatchParams.merge(), patch);
 * }</pre>
 *
 * @param <K> the resource type
 */
@ThreadSafe
public final class ResourceRequests<K> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceRequests.class);

    static final String JSON = "application/json";
    private static final String STATUS = "status";
    private static final String SCALE = "scale";

    private final ResourceDescriptor descriptor;
    private final Class<K> resourceType;
    private final String collectionPath;

    private ResourceRequests(ResourceDescriptor descriptor, Class<K> resourceType) {
        this.descriptor = descriptor;
        this.resourceType = resourceType;
        this.collectionPath = ResourcePaths.collectionPath(descriptor);
    }

    public static <K> ResourceRequests<K> of(ResourceDescriptor descriptor, Class<K> resourceType) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(resourceType, "resourceType");
        return new ResourceRequests<>(descriptor, resourceType);
    }

    public ResourceDescriptor descriptor() {
        return descriptor;
    }

    public Class<K> resourceType() {
        return resourceType;
    }

    /**
     * Binds these requests to a transport, giving an accessor that executes them.
     *
     * @param transport the transport
     * @param <R> the transport's response type
     * @return client
     */
    public <R> ResourceClient<K, R> bindTo(RequestTransport<R> transport) {
        return new ResourceClient<>(this, transport);
    }

    public RequestSpec list(ListParams params) {
        Objects.requireNonNull(params, "params");
        var query = new QueryBuilder();
        params.appendTo(query);
        return log(RequestSpec.withoutBody("GET", collectionPath, query.build()));
    }

    /**
     * Watches the whole collection.
     *
     * @param params watch options
     * @param resourceVersion version to resume from, or null to start from the most recent
     * @return request
     */
    public RequestSpec watch(WatchParams params, @Nullable String resourceVersion) {
        Objects.requireNonNull(params, "params");
        var query = new QueryBuilder();
        params.appendTo(query, resourceVersion);
        return log(RequestSpec.withoutBody("GET", collectionPath, query.build()));
    }

    /**
     * Watches a single named resource.
     *
     * @param name resource name
     * @param params watch options
     * @param resourceVersion version to resume from, or null to start from the most recent
     * @return request
     */
    public RequestSpec watch(String name, WatchParams params, @Nullable String resourceVersion) {
        String path = itemPath(name, "watch");
        Objects.requireNonNull(params, "params");
        var query = new QueryBuilder();
        params.appendTo(query, resourceVersion);
        return log(RequestSpec.withoutBody("GET", path, query.build()));
    }

    public RequestSpec get(String name) {
        return log(RequestSpec.withoutBody("GET", itemPath(name, "get"), ""));
    }

    public RequestSpec create(PostParams params, byte[] body) {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(body, "body");
        var query = new QueryBuilder();
        params.appendTo(query);
        return log(RequestSpec.withBody("POST", collectionPath, query.build(), body, JSON));
    }

    /**
     * Replaces (updates) a named resource with the given body.
     *
     * @param name resource name
     * @param params options
     * @param body the complete resource
     * @return request
     */
    public RequestSpec replace(String name, PostParams params, byte[] body) {
        return putRequest(itemPath(name, "replace"), params, body);
    }

    /**
     * Patches a named resource. The patch is passed through unmodified; its content type
     * follows the strategy in {@code params}.
     *
     * @param name resource name
     * @param params options and strategy
     * @param patch the patch document
     * @return request
     */
    public RequestSpec patch(String name, PatchParams params, byte[] patch) {
        return patchRequest(itemPath(name, "patch"), params, patch);
    }

    public RequestSpec delete(String name, DeleteParams params) {
        String path = itemPath(name, "delete");
        Objects.requireNonNull(params, "params");
        var query = new QueryBuilder();
        params.appendTo(query);
        return log(RequestSpec.withoutBody("DELETE", path, query.build()));
    }

    /**
     * Deletes every resource in the collection matching the list options.
     *
     * @param deleteParams delete options
     * @param listParams selects the resources to delete
     * @return request
     */
    public RequestSpec deleteCollection(DeleteParams deleteParams, ListParams listParams) {
        Objects.requireNonNull(deleteParams, "deleteParams");
        Objects.requireNonNull(listParams, "listParams");
        var query = new QueryBuilder();
        deleteParams.appendTo(query);
        listParams.appendTo(query);
        return log(RequestSpec.withoutBody("DELETE", collectionPath, query.build()));
    }

    public RequestSpec getStatus(String name) {
        return log(RequestSpec.withoutBody("GET", subresourcePath(name, STATUS, "get the status of"), ""));
    }

    public RequestSpec replaceStatus(String name, PostParams params, byte[] body) {
        return putRequest(subresourcePath(name, STATUS, "replace the status of"), params, body);
    }

    public RequestSpec patchStatus(String name, PatchParams params, byte[] patch) {
        return patchRequest(subresourcePath(name, STATUS, "patch the status of"), params, patch);
    }

    public RequestSpec getScale(String name) {
        return log(RequestSpec.withoutBody("GET", subresourcePath(name, SCALE, "get the scale of"), ""));
    }

    public RequestSpec replaceScale(String name, PostParams params, byte[] body) {
        return putRequest(subresourcePath(name, SCALE, "replace the scale of"), params, body);
    }

    public RequestSpec patchScale(String name, PatchParams params, byte[] patch) {
        return patchRequest(subresourcePath(name, SCALE, "patch the scale of"), params, patch);
    }

    private RequestSpec putRequest(String path, PostParams params, byte[] body) {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(body, "body");
        var query = new QueryBuilder();
        params.appendTo(query);
        return log(RequestSpec.withBody("PUT", path, query.build(), body, JSON));
    }

    private RequestSpec patchRequest(String path, PatchParams params, byte[] patch) {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(patch, "patch");
        var query = new QueryBuilder();
        params.appendTo(query);
        return log(RequestSpec.withBody("PATCH", path, query.build(), patch, params.strategy().contentType()));
    }

    private String itemPath(@Nullable String name, String verb) {
        return ResourcePaths.itemPath(descriptor, requireName(name, verb));
    }

    private String subresourcePath(@Nullable String name, String subresource, String verb) {
        return ResourcePaths.subresourcePath(descriptor, requireName(name, verb), subresource);
    }

    private String requireName(@Nullable String name, String verb) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("A name is required to " + verb + " a " + descriptor.kind());
        }
        return name;
    }

    private static RequestSpec log(RequestSpec request) {
        LOGGER.trace("Synthesized {}", request);
        return request;
    }

    @Override
    public String toString() {
        return "ResourceRequests{" +
                "descriptor=" + descriptor +
                ", resourceType=" + resourceType.getName() +
                '}';
    }
}
