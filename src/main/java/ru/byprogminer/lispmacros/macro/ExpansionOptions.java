package ru.byprogminer.lispmacros.macro;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExpansionOptions {

    public static final String MAX_EXPANSION_DEPTH_PROPERTY = "lispmacros.maxExpansionDepth";

    public static final int DEFAULT_MAX_EXPANSION_DEPTH = 256;

    /**
     * Macro applications allowed to nest inside each other before expansion is aborted.
     */
    @Builder.Default
    int maxExpansionDepth = DEFAULT_MAX_EXPANSION_DEPTH;

    public static ExpansionOptions defaults() {
        return builder().build();
    }

    public static ExpansionOptions fromSystemProperties() {
        return builder()
                .maxExpansionDepth(Integer.getInteger(MAX_EXPANSION_DEPTH_PROPERTY, DEFAULT_MAX_EXPANSION_DEPTH))
                .build();
    }
}
