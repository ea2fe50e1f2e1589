/*
 * Copyright Kuberoute Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kuberoute.descriptor;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Reads resource definitions from YAML and turns them into descriptors.
 * <pre>
 * resources:
 *   - kind: Foo
 *     group: clux.dev
 *     version: v1
 *     namespace: myns
 * </pre>
 */
public class ResourceDefinitionParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceDefinitionParser.class);

    private static final ObjectMapper MAPPER = createObjectMapper();

    private final Pluralizer pluralizer;

    public ResourceDefinitionParser() {
        this(Pluralizer.english());
    }

    public ResourceDefinitionParser(Pluralizer pluralizer) {
        this.pluralizer = Objects.requireNonNull(pluralizer);
    }

    public ResourceDefinitions parseDefinitions(String definitions) {
        try {
            return MAPPER.readValue(definitions, ResourceDefinitions.class);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse resource definitions", e);
        }
    }

    public ResourceDefinitions parseDefinitions(InputStream definitions) {
        try {
            return MAPPER.readValue(definitions, ResourceDefinitions.class);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse resource definitions", e);
        }
    }

    /**
     * Validates every definition and builds its descriptor.
     *
     * @param definitions definitions
     * @return descriptors, in definition order
     * @throws IllegalArgumentException if a definition has a malformed kind, version or namespace
     * @throws IllegalStateException if a definition lacks a group or version
     */
    public List<ResourceDescriptor> descriptors(ResourceDefinitions definitions) {
        var descriptors = definitions.resources().stream()
                .map(definition -> ResourceDescriptor.from(definition, pluralizer))
                .toList();
        LOGGER.debug("Loaded {} resource descriptor(s)", descriptors.size());
        return descriptors;
    }

    public List<ResourceDescriptor> descriptors(String definitions) {
        return descriptors(parseDefinitions(definitions));
    }

    public String toYaml(ResourceDefinitions definitions) {
        try {
            return MAPPER.writeValueAsString(definitions);
        }
        catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode resource definitions as YAML", e);
        }
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new ParameterNamesModule())
                .registerModule(new Jdk8Module())
                .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
                .setVisibility(PropertyAccessor.CREATOR, Visibility.ANY)
                .setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
