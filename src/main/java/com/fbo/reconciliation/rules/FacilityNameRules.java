package com.fbo.reconciliation.rules;

import java.util.List;

/**
 * Built-in rules for FBO names. Generic words that operators add or drop freely
 * ("Signature Aviation" vs "Signature FBO") are removed so both spellings share a key.
 */
public final class FacilityNameRules {

    private FacilityNameRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with the default facility rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getGenericTokenRules());
    }

    /**
     * Literal removal of generic tokens. These match anywhere in the name, not only on word
     * boundaries.
     */
    public static List<NormalizationRule> getGenericTokenRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("generic-aviation")
                        .literal("aviation")
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("generic-fbo")
                        .literal("fbo")
                        .replacement("")
                        .priority(20)
                        .build()
        );
    }
}
