package com.pathwaygraph.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structured clinical pathway record.
 *
 * <p>This is the richer form of a pathway that {@code PathwayNodeConverter} flattens into a
 * {@link NodeList}. Serialized with snake_case field names by {@code PathwayJsonCodec}.
 *
 * @param conditionName condition name, e.g. "Chest Pain (ACS)"
 * @param chiefComplaint chief complaint
 * @param clinicalSetting clinical setting, e.g. "ED"
 * @param initialCriticalityCriteria red flags for the initial criticality check
 * @param criticalCareActions actions on the critical care branch
 * @param pitOrders provider-in-triage orders
 * @param secondaryCriticalityCriteria criteria for re-evaluation after workup, or null when absent
 * @param evidenceBasedAdditions evidence-based interventions
 * @param dispositionCriteria disposition options
 * @param specialPopulations special population considerations
 * @param references literature references
 * @param lastUpdated optional last update date
 * @param version pathway version
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClinicalPathway(
    @JsonProperty("condition_name") String conditionName,
    @JsonProperty("chief_complaint") String chiefComplaint,
    @JsonProperty("clinical_setting") String clinicalSetting,
    @JsonProperty("initial_criticality_criteria") List<String> initialCriticalityCriteria,
    @JsonProperty("critical_care_actions") List<String> criticalCareActions,
    @JsonProperty("pit_orders") List<Order> pitOrders,
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("secondary_criticality_criteria") List<String> secondaryCriticalityCriteria,
    @JsonProperty("evidence_based_additions") List<EvidenceBasedAddition> evidenceBasedAdditions,
    @JsonProperty("disposition_criteria") List<DispositionCriteria> dispositionCriteria,
    @JsonProperty("special_populations") List<String> specialPopulations,
    @JsonProperty("references") List<String> references,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("last_updated") String lastUpdated,
    @JsonProperty("version") String version
) {
    /** Critical care action used when none are specified. */
    public static final String DEFAULT_CRITICAL_CARE_ACTION = "Immediate Resuscitation";

    /** Version assigned when none is specified. */
    public static final String DEFAULT_VERSION = "1.0";

    /**
     * Compact constructor with validation and defaults.
     */
    public ClinicalPathway {
        Objects.requireNonNull(conditionName, "conditionName must not be null");
        Objects.requireNonNull(chiefComplaint, "chiefComplaint must not be null");
        Objects.requireNonNull(clinicalSetting, "clinicalSetting must not be null");
        initialCriticalityCriteria = copyOrEmpty(initialCriticalityCriteria);
        criticalCareActions = criticalCareActions == null || criticalCareActions.isEmpty()
            ? List.of(DEFAULT_CRITICAL_CARE_ACTION)
            : List.copyOf(criticalCareActions);
        pitOrders = copyOrEmpty(pitOrders);
        if (secondaryCriticalityCriteria != null) {
            secondaryCriticalityCriteria = List.copyOf(secondaryCriticalityCriteria);
        }
        evidenceBasedAdditions = copyOrEmpty(evidenceBasedAdditions);
        dispositionCriteria = copyOrEmpty(dispositionCriteria);
        specialPopulations = copyOrEmpty(specialPopulations);
        references = copyOrEmpty(references);
        if (version == null) {
            version = DEFAULT_VERSION;
        }
    }

    private static <T> List<T> copyOrEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Returns whether a secondary criticality check is part of the pathway.
     *
     * @return true if secondary criteria are present and non-empty
     */
    public boolean hasSecondaryCriticality() {
        return secondaryCriticalityCriteria != null && !secondaryCriticalityCriteria.isEmpty();
    }

    /**
     * Starts building a pathway with its required fields.
     *
     * @param conditionName condition name
     * @param chiefComplaint chief complaint
     * @param clinicalSetting clinical setting
     * @return builder
     */
    public static Builder builder(String conditionName, String chiefComplaint, String clinicalSetting) {
        return new Builder(conditionName, chiefComplaint, clinicalSetting);
    }

    /**
     * Fluent builder for {@link ClinicalPathway}.
     */
    public static final class Builder {
        private final String conditionName;
        private final String chiefComplaint;
        private final String clinicalSetting;
        private final List<String> initialCriticalityCriteria = new ArrayList<>();
        private final List<String> criticalCareActions = new ArrayList<>();
        private final List<Order> pitOrders = new ArrayList<>();
        private List<String> secondaryCriticalityCriteria;
        private final List<EvidenceBasedAddition> evidenceBasedAdditions = new ArrayList<>();
        private final List<DispositionCriteria> dispositionCriteria = new ArrayList<>();
        private final List<String> specialPopulations = new ArrayList<>();
        private final List<String> references = new ArrayList<>();
        private String lastUpdated;
        private String version;

        private Builder(String conditionName, String chiefComplaint, String clinicalSetting) {
            this.conditionName = conditionName;
            this.chiefComplaint = chiefComplaint;
            this.clinicalSetting = clinicalSetting;
        }

        public Builder initialCriticality(String... criteria) {
            initialCriticalityCriteria.addAll(List.of(criteria));
            return this;
        }

        public Builder criticalCareActions(String... actions) {
            criticalCareActions.addAll(List.of(actions));
            return this;
        }

        public Builder pitOrder(Order order) {
            pitOrders.add(order);
            return this;
        }

        public Builder secondaryCriticality(String... criteria) {
            secondaryCriticalityCriteria = List.of(criteria);
            return this;
        }

        public Builder evidenceBasedAddition(EvidenceBasedAddition addition) {
            evidenceBasedAdditions.add(addition);
            return this;
        }

        public Builder disposition(DispositionCriteria criteria) {
            dispositionCriteria.add(criteria);
            return this;
        }

        public Builder specialPopulations(String... populations) {
            specialPopulations.addAll(List.of(populations));
            return this;
        }

        public Builder references(String... refs) {
            references.addAll(List.of(refs));
            return this;
        }

        public Builder lastUpdated(String date) {
            this.lastUpdated = date;
            return this;
        }

        public Builder version(String pathwayVersion) {
            this.version = pathwayVersion;
            return this;
        }

        public ClinicalPathway build() {
            return new ClinicalPathway(conditionName, chiefComplaint, clinicalSetting,
                initialCriticalityCriteria, criticalCareActions, pitOrders, secondaryCriticalityCriteria,
                evidenceBasedAdditions, dispositionCriteria, specialPopulations, references,
                lastUpdated, version);
        }
    }
}
