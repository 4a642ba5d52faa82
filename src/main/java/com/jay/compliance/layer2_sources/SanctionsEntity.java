package com.jay.compliance.layer2_sources;

import java.util.List;

public record SanctionsEntity(String id, double score, String caption, String schema, Properties properties) {

    public record Properties(List<String> name, List<String> topics, List<String> country, List<String> datasets) {
        public Properties {
            name = name == null ? List.of() : List.copyOf(name);
            topics = topics == null ? List.of() : List.copyOf(topics);
            country = country == null ? List.of() : List.copyOf(country);
            datasets = datasets == null ? List.of() : List.copyOf(datasets);
        }
    }

    /** First listed name, falling back to the caption. */
    public String primaryName() {
        if (properties != null && !properties.name().isEmpty()) return properties.name().get(0);
        return caption;
    }
}
