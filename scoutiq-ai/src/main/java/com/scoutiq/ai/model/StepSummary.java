package com.scoutiq.ai.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One executed pipeline stage and what it decided.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StepSummary {
    private String node;
    private String summary;
}
