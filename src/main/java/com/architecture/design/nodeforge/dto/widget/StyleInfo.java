package com.architecture.design.nodeforge.dto.widget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Styling information extracted from a widget.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StyleInfo {
    @Builder.Default
    private List<ColorInfo> colors = new ArrayList<>();
    private TypographyInfo typography;
    private SpacingInfo spacing;
    private BorderInfo borders;
    @Builder.Default
    private List<ShadowInfo> shadows = new ArrayList<>();

    public List<ColorInfo> getColors() {
        return colors != null ? colors : List.of();
    }

    public List<ShadowInfo> getShadows() {
        return shadows != null ? shadows : List.of();
    }

    public static StyleInfo empty() {
        return StyleInfo.builder().build();
    }

    /**
     * Overlay {@code overrides} on top of this styling. Non-empty lists and non-null
     * sections of the override win; the receiver is left untouched.
     */
    public StyleInfo overlay(StyleInfo overrides) {
        if (overrides == null) {
            return toBuilder().build();
        }
        return StyleInfo.builder()
                .colors(overrides.getColors() != null && !overrides.getColors().isEmpty()
                        ? new ArrayList<>(overrides.getColors()) : copy(colors))
                .typography(overrides.getTypography() != null ? overrides.getTypography() : typography)
                .spacing(overrides.getSpacing() != null ? overrides.getSpacing() : spacing)
                .borders(overrides.getBorders() != null ? overrides.getBorders() : borders)
                .shadows(overrides.getShadows() != null && !overrides.getShadows().isEmpty()
                        ? new ArrayList<>(overrides.getShadows()) : copy(shadows))
                .build();
    }

    private static <T> List<T> copy(List<T> list) {
        return list != null ? new ArrayList<>(list) : new ArrayList<>();
    }
}
