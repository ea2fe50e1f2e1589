/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.util.Objects;

/**
 * Adapts {@link RequestSpec}s to the JDK HTTP client.
 */
public final class JdkHttpRequests {

    private JdkHttpRequests() {
    }

    /**
     * Builds a JDK request for the given server. The server URI may carry a path prefix,
     * e.g. when the API server sits behind a proxy.
     *
     * @param server API server base URI, e.g. {@code https://127.0.0.1:6443}
     * @param request synthesized request
     * @return JDK request
     * @throws IllegalArgumentException if the server URI is not absolute
     */
    public static HttpRequest toHttpRequest(URI server, RequestSpec request) {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(request, "request");
        if (!server.isAbsolute()) {
            throw new IllegalArgumentException("server URI must be absolute: " + server);
        }
        var base = server.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        var builder = HttpRequest.newBuilder(URI.create(base + request.uri()))
                .header("Accept", ResourceRequests.JSON)
                .method(request.method(), request.body()
                        .map(BodyPublishers::ofByteArray)
                        .orElseGet(BodyPublishers::noBody));
        request.contentType().ifPresent(contentType -> builder.header("Content-Type", contentType));
        return builder.build();
    }
}
