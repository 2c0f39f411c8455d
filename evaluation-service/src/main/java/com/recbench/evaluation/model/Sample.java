package com.recbench.evaluation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class Sample {
    private final String clinicalScenario;
    private final String standardAnswer;
    private final Map<String, Object> patientInfo;
    private final Map<String, Object> clinicalContext;

    public Sample(String clinicalScenario, String standardAnswer) {
        this(clinicalScenario, standardAnswer, null, null);
    }

    @JsonCreator
    public Sample(
            @JsonProperty("clinical_scenario") String clinicalScenario,
            @JsonProperty("standard_answer") String standardAnswer,
            @JsonProperty("patient_info") Map<String, Object> patientInfo,
            @JsonProperty("clinical_context") Map<String, Object> clinicalContext
    ) {
        this.clinicalScenario = clinicalScenario == null ? "" : clinicalScenario;
        this.standardAnswer = standardAnswer == null ? "" : standardAnswer;
        this.patientInfo = copyOf(patientInfo);
        this.clinicalContext = copyOf(clinicalContext);
    }

    public String getClinicalScenario() {
        return clinicalScenario;
    }

    public String getStandardAnswer() {
        return standardAnswer;
    }

    public Map<String, Object> getPatientInfo() {
        return patientInfo;
    }

    public Map<String, Object> getClinicalContext() {
        return clinicalContext;
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sample other)) {
            return false;
        }
        return clinicalScenario.equals(other.clinicalScenario)
                && standardAnswer.equals(other.standardAnswer)
                && patientInfo.equals(other.patientInfo)
                && clinicalContext.equals(other.clinicalContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clinicalScenario, standardAnswer, patientInfo, clinicalContext);
    }
}
