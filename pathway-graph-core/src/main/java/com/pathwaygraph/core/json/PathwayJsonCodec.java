package com.pathwaygraph.core.json;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pathwaygraph.core.model.ClinicalPathway;

/**
 * Exports and imports structured pathways as snake_case JSON.
 *
 * <p>Import checks required fields before binding, so that a missing field is reported by its
 * path (e.g. {@code disposition_criteria[1].disposition_type}) rather than as a binding error.
 * Optional fields take the record defaults.
 */
public class PathwayJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(PathwayJsonCodec.class);

    private static final List<String> REQUIRED_FIELDS =
        List.of("condition_name", "chief_complaint", "clinical_setting");

    /** Required fields of the items of each nested array. */
    private static final Map<String, List<String>> REQUIRED_ITEM_FIELDS = Map.of(
        "pit_orders", List.of("category", "items"),
        "evidence_based_additions", List.of("category", "name"),
        "disposition_criteria", List.of("disposition_type", "criteria"));

    private static final List<String> NESTED_ARRAYS =
        List.of("pit_orders", "evidence_based_additions", "disposition_criteria");

    private final ObjectMapper mapper;

    public PathwayJsonCodec() {
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    }

    /**
     * Serializes a pathway.
     *
     * @param pathway pathway to export
     * @return pretty-printed JSON object
     */
    public String export(ClinicalPathway pathway) {
        Objects.requireNonNull(pathway, "pathway must not be null");
        try {
            return mapper.writeValueAsString(pathway);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pathway " + pathway.conditionName(), e);
        }
    }

    /**
     * Parses a pathway.
     *
     * @param json JSON object
     * @return imported pathway
     * @throws MissingFieldException if a required field is missing or null
     * @throws PathwayImportException if the JSON is malformed or a value is invalid
     */
    public ClinicalPathway importPathway(String json) {
        Objects.requireNonNull(json, "json must not be null");

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PathwayImportException("Malformed pathway JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PathwayImportException("Pathway JSON must be an object");
        }

        checkRequiredFields(root);

        try {
            ClinicalPathway pathway = mapper.treeToValue(root, ClinicalPathway.class);
            log.debug("Imported pathway '{}'", pathway.conditionName());
            return pathway;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PathwayImportException("Invalid pathway JSON: " + e.getMessage(), e);
        }
    }

    private static void checkRequiredFields(JsonNode root) {
        for (String field : REQUIRED_FIELDS) {
            requirePresent(root, field, field);
        }
        for (String array : NESTED_ARRAYS) {
            JsonNode items = root.get(array);
            if (items == null || !items.isArray()) {
                continue;
            }
            for (int i = 0; i < items.size(); i++) {
                JsonNode item = items.get(i);
                for (String field : REQUIRED_ITEM_FIELDS.get(array)) {
                    requirePresent(item, field, array + "[" + i + "]." + field);
                }
            }
        }
    }

    private static void requirePresent(JsonNode parent, String field, String path) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            throw new MissingFieldException(path);
        }
    }
}
