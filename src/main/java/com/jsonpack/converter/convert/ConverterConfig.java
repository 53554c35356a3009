package com.jsonpack.converter.convert;

import lombok.Builder;
import lombok.Data;

/**
 * Settings shared by both conversion directions.
 */
@Data
@Builder
public class ConverterConfig {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 128;

    /**
     * Deepest array/object nesting accepted when reading JSON or MessagePack.
     */
    @Builder.Default
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

    public static ConverterConfig defaults() {
        return ConverterConfig.builder().build();
    }
}
