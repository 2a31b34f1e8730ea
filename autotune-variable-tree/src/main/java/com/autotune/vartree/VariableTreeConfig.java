package com.autotune.vartree;

import com.autotune.vartree.tree.VariableNode;
import com.autotune.vartree.tree.VariableTree;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * JSON form of the variable tree: a list of root {@link VariableNode}s plus a separate
 * {@code name -> values} domain map. JSON excludes null values when serializing.
 */
public final class VariableTreeConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final TypeReference<List<VariableNode>> NODES_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, List<String>>> VALUES_TYPE = new TypeReference<>() {};

    private VariableTreeConfig() {
    }

    /**
     * Parses the node list.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static List<VariableNode> nodesFromJson(String json) {
        try {
            return MAPPER.readValue(json, NODES_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses the value-domain map.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static Map<String, List<String>> valuesFromJson(String json) {
        try {
            return MAPPER.readValue(json, VALUES_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Parses both parts and builds the validated tree. */
    public static VariableTree fromJson(String nodesJson, String valuesJson) {
        return VariableTree.of(nodesFromJson(nodesJson), valuesFromJson(valuesJson));
    }

    public static String toJson(List<VariableNode> nodes) {
        try {
            return MAPPER.writeValueAsString(nodes);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
