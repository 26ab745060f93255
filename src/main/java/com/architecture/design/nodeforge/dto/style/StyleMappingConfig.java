package com.architecture.design.nodeforge.dto.style;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Switches controlling how theme references are turned into variable bindings.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StyleMappingConfig {
    @Builder.Default
    private boolean useVariables = true;
    @Builder.Default
    private boolean fallbackToDirectValues = true;
    @Builder.Default
    private String collectionPrefix = "Default";
    @Builder.Default
    private boolean preferMultiMode = false;

    public static StyleMappingConfig defaults() {
        return StyleMappingConfig.builder().build();
    }
}
