package com.pathwaygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A clinical order group (labs, imaging, medications, ...).
 *
 * @param category order category, e.g. "Labs"
 * @param items ordered items
 * @param conditional optional condition for when to order
 * @param notes optional notes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Order(
    @JsonProperty("category") String category,
    @JsonProperty("items") List<String> items,
    @JsonProperty("conditional") String conditional,
    @JsonProperty("notes") String notes
) {
    public Order {
        Objects.requireNonNull(category, "category must not be null");
        items = items == null ? List.of() : List.copyOf(items);
    }

    public Order(String category, List<String> items) {
        this(category, items, null, null);
    }

    /**
     * Formats the order as a node label fragment, e.g. {@code "Meds (If stable): ASA, NTG"}.
     *
     * @return label text
     */
    public String toLabel() {
        String joined = String.join(", ", items);
        if (conditional != null && !conditional.isEmpty()) {
            return category + " (" + conditional + "): " + joined;
        }
        return category + ": " + joined;
    }
}
