package com.architecture.design.nodeforge.dto;

import com.architecture.design.nodeforge.dto.style.StyleMappingConfig;
import com.architecture.design.nodeforge.dto.theme.ThemeModel;
import com.architecture.design.nodeforge.dto.widget.ReusableWidgetDefinition;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of one conversion run: the analysed widget tree, its recurring widgets and the themes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRequest {
    @NotNull(message = "root widget is required")
    private WidgetNode root;
    @Builder.Default
    private List<ReusableWidgetDefinition> reusableWidgets = new ArrayList<>();
    // First theme feeds the single-mode collections; two or more also produce multi-mode ones
    @Builder.Default
    private List<ThemeModel> themes = new ArrayList<>();
    private StyleMappingConfig styleConfig;
}
