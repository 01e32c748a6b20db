package com.forgeloop.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Market analysis produced during the ideation phase.
 *
 * @param competitors        comparable products
 * @param differentiators    how the idea stands apart
 * @param featureSuggestions candidate features the user picks from before planning
 */
public record IdeationResult(
    List<Competitor> competitors,
    List<String> differentiators,
    List<String> featureSuggestions
) implements Serializable {

    public IdeationResult {
        competitors = competitors == null ? List.of() : List.copyOf(competitors);
        differentiators = differentiators == null ? List.of() : List.copyOf(differentiators);
        featureSuggestions = featureSuggestions == null ? List.of() : List.copyOf(featureSuggestions);
    }
}
