package com.pathwaygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Evidence-based intervention, risk stratification tool, or advanced diagnostic.
 *
 * @param category category, e.g. "Risk Stratification"
 * @param name short name, e.g. "HEART Score"
 * @param description description used as node notes
 * @param criteria optional criteria for when to apply it
 * @param pmid optional supporting PubMed identifier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidenceBasedAddition(
    @JsonProperty("category") String category,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("criteria") String criteria,
    @JsonProperty("pmid") String pmid
) {
    public EvidenceBasedAddition {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) {
            description = "";
        }
    }

    public String toLabel() {
        if (criteria != null && !criteria.isEmpty()) {
            return name + " (" + criteria + ")";
        }
        return name;
    }
}
