package org.carball.querymon.model.analysis;

public enum IssueType {
    N_PLUS_ONE("n_plus_one"),
    SLOW_QUERY("slow_query"),
    POOR_CACHE_HIT_RATE("poor_cache_hit_rate"),
    HIGH_ERROR_RATE("high_error_rate");

    private final String idPrefix;

    IssueType(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String getIdPrefix() {
        return idPrefix;
    }
}
