/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.request;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.kuberoute.descriptor.ResourceDescriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkHttpRequestsTest {

    private static final ResourceRequests<Object> FOOS = ResourceRequests.of(
            ResourceDescriptor.newBuilder("Foo").group("clux.dev").version("v1").within("myns").build(), Object.class);

    @ParameterizedTest
    @ValueSource(strings = { "https://127.0.0.1:6443", "https://127.0.0.1:6443/" })
    void resolvesAgainstServer(String server) {
        var request = JdkHttpRequests.toHttpRequest(URI.create(server), FOOS.list(ListParams.defaults().withLimit(5L)));

        assertThat(request.uri()).isEqualTo(URI.create("https://127.0.0.1:6443/apis/clux.dev/v1/namespaces/myns/foos?limit=5"));
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.headers().firstValue("Accept")).contains("application/json");
        assertThat(request.headers().firstValue("Content-Type")).isEmpty();
    }

    @Test
    void keepsServerPathPrefix() {
        var request = JdkHttpRequests.toHttpRequest(URI.create("https://rancher.example.com/k8s/clusters/c-1"), FOOS.get("baz"));

        assertThat(request.uri().getPath()).isEqualTo("/k8s/clusters/c-1/apis/clux.dev/v1/namespaces/myns/foos/baz");
    }

    @Test
    void patchCarriesBodyAndContentType() {
        var patch = "[{\"op\":\"remove\",\"path\":\"/spec/x\"}]".getBytes(StandardCharsets.UTF_8);

        var request = JdkHttpRequests.toHttpRequest(URI.create("https://127.0.0.1:6443"), FOOS.patch("baz", PatchParams.json(), patch));

        assertThat(request.method()).isEqualTo("PATCH");
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json-patch+json");
        assertThat(request.bodyPublisher()).hasValueSatisfying(publisher -> assertThat(publisher.contentLength()).isEqualTo(patch.length));
    }

    @Test
    void relativeServerRejected() {
        var get = FOOS.get("baz");
        var server = URI.create("/relative");

        assertThatThrownBy(() -> JdkHttpRequests.toHttpRequest(server, get))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
