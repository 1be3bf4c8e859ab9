package com.scoutiq.rag.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A product returned by catalog similarity search, with the metadata stored alongside its vector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogHit {
    /** Catalog product ID (datapoint ID in the index) */
    private String id;

    private String title;

    /** Listed price, null when the catalog row had none */
    private Double price;

    private String url;

    /** Cosine similarity score (0-1, higher is more similar) */
    private Double score;

    private String brand;

    private String category;
}
