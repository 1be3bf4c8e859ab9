package com.scoutiq.ai.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structured shopping constraints derived from the query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Constraints {

    /** Budget ceiling in USD, null when the query names none */
    private Double maxPrice;

    private String category;

    @Builder.Default
    private Set<String> keywords = new LinkedHashSet<>();
}
