/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully routed request, ready to be handed to a transport. The body is copied on the way in and
 * on the way out, so a spec never shares its bytes with a caller.
 *
 * @param method HTTP method.
 * @param path absolute, percent-encoded path.
 * @param query form-encoded query string without the leading {@code ?}; empty if there are no options.
 * @param body request body, present for create, replace and patch requests.
 * @param contentType media type of the body, present whenever the body is.
 */
public record RequestSpec(String method,
                          String path,
                          String query,
                          Optional<byte[]> body,
                          Optional<String> contentType) {

    public RequestSpec {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(contentType, "contentType");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must be absolute: " + path);
        }
        if (query.startsWith("?") || query.startsWith("&") || query.endsWith("&")) {
            throw new IllegalArgumentException("malformed query: " + query);
        }
        if (body.isPresent() != contentType.isPresent()) {
            throw new IllegalArgumentException("a body requires a content type and vice versa");
        }
        body = body.map(byte[]::clone);
    }

    static RequestSpec withoutBody(String method, String path, String query) {
        return new RequestSpec(method, path, query, Optional.empty(), Optional.empty());
    }

    static RequestSpec withBody(String method, String path, String query, byte[] body, String contentType) {
        return new RequestSpec(method, path, query, Optional.of(body), Optional.of(contentType));
    }

    /**
     * @return a copy of the request body, if there is one.
     */
    @Override
    public Optional<byte[]> body() {
        return body.map(byte[]::clone);
    }

    /**
     * @return the path, followed by {@code ?} and the query if there is one.
     */
    public String uri() {
        return query.isEmpty() ? path : path + "?" + query;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequestSpec that)) {
            return false;
        }
        return method.equals(that.method)
                && path.equals(that.path)
                && query.equals(that.query)
                && contentType.equals(that.contentType)
                && body.isPresent() == that.body.isPresent()
                && (body.isEmpty() || Arrays.equals(body.get(), that.body.get()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, query, contentType, body.map(Arrays::hashCode).orElse(0));
    }

    @Override
    public String toString() {
        return "RequestSpec[" +
                method + " " + uri() +
                body.map(b -> ", body=" + b.length + " bytes").orElse("") +
                contentType.map(ct -> ", contentType=" + ct).orElse("") +
                "]";
    }
}
