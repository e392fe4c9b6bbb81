package com.insightframe.api.journal;

import java.util.List;

/**
 * 物质目录条目
 */
public record Substance(String name, List<String> commonNames, List<String> categories, List<String> interactions) {

    public Substance {
        commonNames = commonNames == null ? List.of() : List.copyOf(commonNames);
        categories = categories == null ? List.of() : List.copyOf(categories);
        interactions = interactions == null ? List.of() : List.copyOf(interactions);
    }

    public Substance(String name) {
        this(name, List.of(), List.of(), List.of());
    }
}
