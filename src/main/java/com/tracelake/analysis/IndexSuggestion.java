package com.tracelake.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An index proposed for one namespace, with the collection scan cost it would address
 */
public class IndexSuggestion {

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("index")
    private String index;

    @JsonProperty("fields")
    private List<String> fields;

    @JsonProperty("type")
    private String type;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("occurrences")
    private long occurrences;

    @JsonProperty("avg_duration_ms")
    private long avgDurationMs;

    @JsonProperty("impact_score")
    private long impactScore;

    /** docs examined per returned document; null when nothing was examined */
    @JsonProperty("inefficiency_ratio")
    private Double inefficiencyRatio;

    @JsonProperty("selectivity_pct")
    private Double selectivityPct;

    @JsonProperty("command")
    private String command;

    @JsonProperty("justification")
    private String justification;

    @JsonIgnore
    private IndexSpec spec;

    public IndexSuggestion() {
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getIndex() {
        return index;
    }

    public List<String> getFields() {
        return fields;
    }

    public IndexSpec getSpec() {
        return spec;
    }

    public void setSpec(IndexSpec spec) {
        this.spec = spec;
        this.index = spec.toString();
        this.fields = spec.getFields();
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public long getOccurrences() {
        return occurrences;
    }

    public void setOccurrences(long occurrences) {
        this.occurrences = occurrences;
    }

    public long getAvgDurationMs() {
        return avgDurationMs;
    }

    public void setAvgDurationMs(long avgDurationMs) {
        this.avgDurationMs = avgDurationMs;
    }

    public long getImpactScore() {
        return impactScore;
    }

    public void setImpactScore(long impactScore) {
        this.impactScore = impactScore;
    }

    public Double getInefficiencyRatio() {
        return inefficiencyRatio;
    }

    public void setInefficiencyRatio(Double inefficiencyRatio) {
        this.inefficiencyRatio = inefficiencyRatio;
    }

    public Double getSelectivityPct() {
        return selectivityPct;
    }

    public void setSelectivityPct(Double selectivityPct) {
        this.selectivityPct = selectivityPct;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    public String getJustification() {
        return justification;
    }

    public void setJustification(String justification) {
        this.justification = justification;
    }

    @Override
    public String toString() {
        return "IndexSuggestion{" + namespace + " " + index + ", impact=" + impactScore + "}";
    }
}
