/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

class ResourceDefinitionParserTest {

    private final ResourceDefinitionParser parser = new ResourceDefinitionParser();

    @Test
    void parsesDefinitions() {
        // Given
        var yaml = """
                resources:
                  - kind: Foo
                    group: clux.dev
                    version: v1
                    namespace: myns
                  - kind: ConfigMap
                    group: ""
                    version: v1
                """;

        // When
        var definitions = parser.parseDefinitions(yaml);

        // Then
        assertThat(definitions.resources())
                .containsExactly(
                        new ResourceDefinition("Foo", "clux.dev", "v1", "myns"),
                        new ResourceDefinition("ConfigMap", "", "v1", null));
    }

    @Test
    void parsesDefinitionsFromStream() {
        var yaml = """
                resources:
                  - kind: Foo
                    group: clux.dev
                    version: v1
                """;

        var definitions = parser.parseDefinitions(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(definitions.resources()).containsExactly(new ResourceDefinition("Foo", "clux.dev", "v1", null));
    }

    @Test
    void buildsDescriptors() {
        var yaml = """
                resources:
                  - kind: Foo
                    group: clux.dev
                    version: v1
                    namespace: myns
                  - kind: Policy
                    group: example.com
                    version: v1alpha1
                """;

        var descriptors = parser.descriptors(yaml);

        assertThat(descriptors)
                .extracting(ResourceDescriptor::apiVersion, ResourceDescriptor::plural, d -> d.namespace().orElse(null))
                .containsExactly(
                        tuple("clux.dev/v1", "foos", "myns"),
                        tuple("example.com/v1alpha1", "policies", null));
    }

    @Test
    void missingVersionFailsWhenBuildingDescriptors() {
        var yaml = """
                resources:
                  - kind: Foo
                    group: clux.dev
                """;
        var definitions = parser.parseDefinitions(yaml);

        assertThatThrownBy(() -> parser.descriptors(definitions))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Resource 'Foo' must have a version");
    }

    @Test
    void missingKindRejected() {
        var yaml = """
                resources:
                  - group: clux.dev
                    version: v1
                """;

        assertThatThrownBy(() -> parser.parseDefinitions(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse resource definitions");
    }

    @Test
    void unknownPropertyRejected() {
        var yaml = """
                resources:
                  - kind: Foo
                    group: clux.dev
                    version: v1
                    plural: fooz
                """;

        assertThatThrownBy(() -> parser.parseDefinitions(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse resource definitions");
    }

    @Test
    void yamlCanBeReadBack() {
        var definitions = new ResourceDefinitions(List.of(
                new ResourceDefinition("Foo", "clux.dev", "v1", "myns"),
                new ResourceDefinition("ConfigMap", "", "v1", null)));

        var yaml = parser.toYaml(definitions);

        assertThat(yaml).doesNotContain("namespace: null");
        assertThat(parser.parseDefinitions(yaml)).isEqualTo(definitions);
    }
}
