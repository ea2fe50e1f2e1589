/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.util.Objects;

import io.kuberoute.descriptor.ResourceDescriptor;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A typed accessor binding the requests of one resource type to a transport handle.
 * Each call synthesizes its request and passes it to the transport unchanged.
 *
 * @param <K> the resource type
 * @param <R> the transport's response type
 */
public final class ResourceClient<K, R> {

    private final ResourceRequests<K> requests;
    private final RequestTransport<R> transport;

    ResourceClient(ResourceRequests<K> requests, RequestTransport<R> transport) {
        this.requests = Objects.requireNonNull(requests, "requests");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public ResourceRequests<K> requests() {
        return requests;
    }

    public RequestTransport<R> transport() {
        return transport;
    }

    public ResourceDescriptor descriptor() {
        return requests.descriptor();
    }

    /**
     * @param namespace namespace
     * @return a client for the same resource type in the given namespace, using the same transport
     */
    public ResourceClient<K, R> within(String namespace) {
        return ResourceRequests.of(requests.descriptor().within(namespace), requests.resourceType()).bindTo(transport);
    }

    public R list(ListParams params) {
        return transport.execute(requests.list(params));
    }

    public R watch(WatchParams params, @Nullable String resourceVersion) {
        return transport.execute(requests.watch(params, resourceVersion));
    }

    public R watch(String name, WatchParams params, @Nullable String resourceVersion) {
        return transport.execute(requests.watch(name, params, resourceVersion));
    }

    public R get(String name) {
        return transport.execute(requests.get(name));
    }

    public R create(PostParams params, byte[] body) {
        return transport.execute(requests.create(params, body));
    }

    public R replace(String name, PostParams params, byte[] body) {
        return transport.execute(requests.replace(name, params, body));
    }

    public R patch(String name, PatchParams params, byte[] patch) {
        return transport.execute(requests.patch(name, params, patch));
    }

    public R delete(String name, DeleteParams params) {
        return transport.execute(requests.delete(name, params));
    }

    public R deleteCollection(DeleteParams deleteParams, ListParams listParams) {
        return transport.execute(requests.deleteCollection(deleteParams, listParams));
    }

    public R getStatus(String name) {
        return transport.execute(requests.getStatus(name));
    }

    public R replaceStatus(String name, PostParams params, byte[] body) {
        return transport.execute(requests.replaceStatus(name, params, body));
    }

    public R patchStatus(String name, PatchParams params, byte[] patch) {
        return transport.execute(requests.patchStatus(name, params, patch));
    }

    public R getScale(String name) {
        return transport.execute(requests.getScale(name));
    }

    public R replaceScale(String name, PostParams params, byte[] body) {
        return transport.execute(requests.replaceScale(name, params, body));
    }

    public R patchScale(String name, PatchParams params, byte[] patch) {
        return transport.execute(requests.patchScale(name, params, patch));
    }
}
