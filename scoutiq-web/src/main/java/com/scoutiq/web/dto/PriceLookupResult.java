package com.scoutiq.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authoritative product data for one marketplace item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceLookupResult {
    private String title;
    private Double price;
}
