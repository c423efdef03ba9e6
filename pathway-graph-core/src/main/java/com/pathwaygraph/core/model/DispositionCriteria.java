package com.pathwaygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Criteria leading to one disposition option.
 *
 * @param dispositionType disposition option
 * @param criteria criteria for choosing it
 * @param additionalNotes optional notes
 * @param followUp optional follow-up instructions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispositionCriteria(
    @JsonProperty("disposition_type") DispositionType dispositionType,
    @JsonProperty("criteria") List<String> criteria,
    @JsonProperty("additional_notes") String additionalNotes,
    @JsonProperty("follow_up") String followUp
) {
    public DispositionCriteria {
        Objects.requireNonNull(dispositionType, "dispositionType must not be null");
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }

    public DispositionCriteria(DispositionType dispositionType, List<String> criteria) {
        this(dispositionType, criteria, null, null);
    }

    /**
     * Formats the End node label from the disposition and its first two criteria.
     *
     * @return label text, e.g. {@code "Discharge: HEART <= 3; Pain resolved"}
     */
    public String toLabel() {
        String joined = String.join("; ", criteria.subList(0, Math.min(2, criteria.size())));
        return dispositionType.value() + ": " + joined;
    }
}
