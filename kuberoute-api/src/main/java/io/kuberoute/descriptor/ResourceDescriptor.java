/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>The smallest amount of information needed to address a resource type on a Kubernetes-style
 * REST API: its kind, API group and version, and optionally the namespace it is scoped to.</p>
 *
 * <p>Descriptors are immutable. The {@link #apiVersion()} and {@link #plural()} are derived once,
 * when the descriptor is built.</p>
 *
 * <pre>{@code
 * ResourceDescriptor foos = ResourceDescriptor.newBuilder("Foo")
 *         .group("clux.dev")
 *         .version("v1")
 *         .within("myns")
 *         .build();
 * }</pre>
 */
@ThreadSafe
public final class ResourceDescriptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceDescriptor.class);

    private final String kind;
    private final String group;
    private final String version;
    private final String apiVersion;
    private final String plural;
    @Nullable
    private final String namespace;

    private ResourceDescriptor(String kind, String group, String version, String plural, @Nullable String namespace) {
        this.kind = kind;
        this.group = group;
        this.version = version;
        this.apiVersion = apiVersionOf(group, version);
        this.plural = plural;
        this.namespace = namespace;
    }

    /**
     * Starts building a descriptor, pluralizing the kind in English.
     *
     * @param kind singular PascalCase kind
     * @return builder
     * @throws IllegalArgumentException if the kind is empty, not PascalCase or plural
     */
    public static Builder newBuilder(String kind) {
        return newBuilder(kind, Pluralizer.english());
    }

    /**
     * Starts building a descriptor.
     *
     * @param kind singular PascalCase kind
     * @param pluralizer derives the collection name from the kind
     * @return builder
     * @throws IllegalArgumentException if the kind is empty, not PascalCase or plural
     */
    public static Builder newBuilder(String kind, Pluralizer pluralizer) {
        Objects.requireNonNull(pluralizer, "pluralizer");
        KindNames.requireValidKind(kind, pluralizer);
        return new Builder(new ResourceDefinition(kind, null, null, null), pluralizer);
    }

    public static ResourceDescriptor from(ResourceDefinition definition) {
        return from(definition, Pluralizer.english());
    }

    /**
     * Validates a definition and builds the descriptor it describes.
     *
     * @param definition the definition
     * @param pluralizer derives the collection name from the kind
     * @return descriptor
     * @throws IllegalArgumentException if the kind, version or namespace is malformed
     * @throws IllegalStateException if no group or no version was supplied
     */
    public static ResourceDescriptor from(ResourceDefinition definition, Pluralizer pluralizer) {
        return from(definition, pluralizer, null);
    }

    private static ResourceDescriptor from(ResourceDefinition definition, Pluralizer pluralizer, @Nullable String declaredPlural) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(pluralizer, "pluralizer");
        String kind = KindNames.requireValidKind(definition.kind(), pluralizer);
        String group = definition.group();
        if (group == null) {
            throw new IllegalStateException("Resource '" + kind + "' must have a group (use \"\" for the core group)");
        }
        String version = definition.version();
        if (version == null) {
            throw new IllegalStateException("Resource '" + kind + "' must have a version");
        }
        if (version.isEmpty()) {
            throw new IllegalArgumentException("Resource '" + kind + "' has an empty version");
        }
        requireNonEmptyNamespace(kind, definition.namespace());
        String plural = declaredPlural == null ? pluralizer.toPlural(kind.toLowerCase(Locale.ROOT)) : declaredPlural;
        var descriptor = new ResourceDescriptor(kind, group, version, plural, definition.namespace());
        LOGGER.debug("Built resource descriptor {}", descriptor);
        return descriptor;
    }

    /**
     * Derives a cluster scoped descriptor from a fabric8 model type, using its
     * {@code @Kind}, {@code @Group}, {@code @Version} and {@code @Plural} annotations. A type without
     * {@code @Group} belongs to the core group, and one without {@code @Plural} gets fabric8's
     * pluralization of its kind.
     *
     * @param type model type
     * @return descriptor
     * @throws IllegalArgumentException if the type does not declare a version, or its kind is malformed
     */
    public static ResourceDescriptor forResourceType(Class<? extends HasMetadata> type) {
        Objects.requireNonNull(type, "type");
        String version = HasMetadata.getVersion(type);
        if (version == null) {
            throw new IllegalArgumentException(type.getName() + " does not declare an API version");
        }
        String group = HasMetadata.getGroup(type);
        var definition = new ResourceDefinition(HasMetadata.getKind(type), group == null ? "" : group, version, null);
        return from(definition, Pluralizer.english(), HasMetadata.getPlural(type));
    }

    /**
     * @param group API group, empty for the core group
     * @param version API version
     * @return {@code group/version}, or just the version for the core group
     */
    public static String apiVersionOf(String group, String version) {
        return group.isEmpty() ? version : group + "/" + version;
    }

    public String kind() {
        return kind;
    }

    public String group() {
        return group;
    }

    public String version() {
        return version;
    }

    public String apiVersion() {
        return apiVersion;
    }

    /**
     * @return the collection name used in request paths, e.g. {@code foos}.
     */
    public String plural() {
        return plural;
    }

    public Optional<String> namespace() {
        return Optional.ofNullable(namespace);
    }

    public boolean isNamespaced() {
        return namespace != null;
    }

    public boolean isCoreGroup() {
        return group.isEmpty();
    }

    /**
     * Returns a descriptor for the same resource type scoped to the given namespace.
     *
     * @param namespace the namespace
     * @return namespaced descriptor
     * @throws IllegalArgumentException if the namespace is empty
     */
    public ResourceDescriptor within(String namespace) {
        Objects.requireNonNull(namespace, "namespace");
        requireNonEmptyNamespace(kind, namespace);
        if (namespace.equals(this.namespace)) {
            return this;
        }
        var descriptor = new ResourceDescriptor(kind, group, version, plural, namespace);
        LOGGER.debug("Scoped resource descriptor {}", descriptor);
        return descriptor;
    }

    /**
     * @return a descriptor for the same resource type addressed at cluster scope.
     */
    public ResourceDescriptor clusterScoped() {
        if (namespace == null) {
            return this;
        }
        return new ResourceDescriptor(kind, group, version, plural, null);
    }

    /**
     * @return the definition this descriptor could be rebuilt from.
     */
    public ResourceDefinition toDefinition() {
        return new ResourceDefinition(kind, group, version, namespace);
    }

    private static void requireNonEmptyNamespace(String kind, @Nullable String namespace) {
        if (namespace != null && namespace.isEmpty()) {
            throw new IllegalArgumentException("Resource '" + kind + "' has an empty namespace, omit it for cluster scoped access");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceDescriptor that)) {
            return false;
        }
        return kind.equals(that.kind)
                && group.equals(that.group)
                && version.equals(that.version)
                && plural.equals(that.plural)
                && Objects.equals(namespace, that.namespace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, group, version, plural, namespace);
    }

    @Override
    public String toString() {
        return "ResourceDescriptor{" +
                "kind='" + kind + '\'' +
                ", apiVersion='" + apiVersion + '\'' +
                ", plural='" + plural + '\'' +
                ", namespace=" + (namespace == null ? "<cluster>" : "'" + namespace + "'") +
                '}';
    }

    /**
     * Fluent builder for {@link ResourceDescriptor}. Each setter returns a new builder, so a builder
     * can be shared and branched, and changing one never affects descriptors already built.
     */
    @ThreadSafe
    public static final class Builder {
        private final ResourceDefinition definition;
        private final Pluralizer pluralizer;

        private Builder(ResourceDefinition definition, Pluralizer pluralizer) {
            this.definition = definition;
            this.pluralizer = pluralizer;
        }

        /**
         * @param group API group, {@code ""} for the core group
         * @return builder with the group set
         */
        public Builder group(String group) {
            return new Builder(definition.withGroup(Objects.requireNonNull(group, "group")), pluralizer);
        }

        public Builder version(String version) {
            return new Builder(definition.withVersion(Objects.requireNonNull(version, "version")), pluralizer);
        }

        /**
         * @param namespace namespace the resource is scoped to
         * @return builder with the namespace set
         */
        public Builder within(String namespace) {
            return new Builder(definition.withNamespace(Objects.requireNonNull(namespace, "namespace")), pluralizer);
        }

        /**
         * @return the descriptor
         * @throws IllegalStateException if no group or no version was set
         * @throws IllegalArgumentException if the version or namespace is empty
         */
        public ResourceDescriptor build() {
            return from(definition, pluralizer);
        }
    }
}
