package com.architecture.design.nodeforge.service.lowering;

import com.architecture.design.nodeforge.dto.widget.AlignmentInfo;
import com.architecture.design.nodeforge.dto.widget.CrossAxisAlignment;
import com.architecture.design.nodeforge.dto.widget.EdgeInsets;
import com.architecture.design.nodeforge.dto.widget.LayoutDirection;
import com.architecture.design.nodeforge.dto.widget.LayoutInfo;
import com.architecture.design.nodeforge.dto.widget.LayoutType;
import com.architecture.design.nodeforge.dto.widget.MainAxisAlignment;
import com.architecture.design.nodeforge.model.node.AutoLayoutSpec;
import com.architecture.design.nodeforge.model.node.AxisSizingMode;
import com.architecture.design.nodeforge.model.node.CounterAxisAlign;
import com.architecture.design.nodeforge.model.node.LayoutMode;
import com.architecture.design.nodeforge.model.node.LayoutSizing;
import com.architecture.design.nodeforge.model.node.LayoutWrap;
import com.architecture.design.nodeforge.model.node.NodeProperties;
import com.architecture.design.nodeforge.model.node.PrimaryAxisAlign;
import org.springframework.stereotype.Component;

/**
 * Translates widget layout information into auto layout parameters.
 */
@Component
public class AutoLayoutMapper {

    public AutoLayoutSpec toAutoLayout(LayoutInfo layout) {
        LayoutMode mode = layoutModeOf(layout);
        EdgeInsets padding = layout.getPadding();
        double spacing = layout.getSpacing() != null ? layout.getSpacing() : 0;

        AutoLayoutSpec spec = AutoLayoutSpec.builder()
                .layoutMode(mode)
                .primaryAxisSizingMode(primaryAxisSizing(layout, mode))
                .counterAxisSizingMode(counterAxisSizing(layout, mode))
                .primaryAxisAlignItems(mapMainAxis(mainAxisOf(layout)))
                .counterAxisAlignItems(mapCrossAxis(crossAxisOf(layout)))
                .paddingTop(padding != null ? padding.getTop() : 0)
                .paddingRight(padding != null ? padding.getRight() : 0)
                .paddingBottom(padding != null ? padding.getBottom() : 0)
                .paddingLeft(padding != null ? padding.getLeft() : 0)
                .itemSpacing(spacing)
                .build();

        if (layout.getType() == LayoutType.WRAP) {
            spec.setLayoutWrap(LayoutWrap.WRAP);
            if (spacing > 0) {
                spec.setCounterAxisSpacing(spacing);
            }
        }
        return spec;
    }

    /**
     * Copy fixed sizes and min/max bounds of the layout onto the frame.
     */
    public void applySizeBounds(NodeProperties properties, LayoutInfo layout) {
        if (layout.getWidth() != null) {
            properties.setWidth(layout.getWidth());
            properties.setLayoutSizingHorizontal(LayoutSizing.FIXED);
        }
        if (layout.getHeight() != null) {
            properties.setHeight(layout.getHeight());
            properties.setLayoutSizingVertical(LayoutSizing.FIXED);
        }
        if (layout.getMinWidth() != null) properties.setMinWidth(layout.getMinWidth());
        if (layout.getMaxWidth() != null) properties.setMaxWidth(layout.getMaxWidth());
        if (layout.getMinHeight() != null) properties.setMinHeight(layout.getMinHeight());
        if (layout.getMaxHeight() != null) properties.setMaxHeight(layout.getMaxHeight());
    }

    public LayoutMode layoutModeOf(LayoutInfo layout) {
        if (layout == null || layout.getType() == null) {
            return LayoutMode.NONE;
        }
        return switch (layout.getType()) {
            case ROW, WRAP -> LayoutMode.HORIZONTAL;
            case COLUMN -> LayoutMode.VERTICAL;
            case STACK -> LayoutMode.NONE;
            case FLEX -> layout.getDirection() == LayoutDirection.HORIZONTAL ? LayoutMode.HORIZONTAL
                    : layout.getDirection() == LayoutDirection.VERTICAL ? LayoutMode.VERTICAL
                    : LayoutMode.NONE;
        };
    }

    public boolean stretchesChildren(LayoutInfo layout) {
        return layout != null && crossAxisOf(layout) == CrossAxisAlignment.STRETCH;
    }

    PrimaryAxisAlign mapMainAxis(MainAxisAlignment alignment) {
        if (alignment == null) return PrimaryAxisAlign.MIN;
        return switch (alignment) {
            case START -> PrimaryAxisAlign.MIN;
            case CENTER -> PrimaryAxisAlign.CENTER;
            case END -> PrimaryAxisAlign.MAX;
            // No native equivalent for around/evenly
            case SPACE_BETWEEN, SPACE_AROUND, SPACE_EVENLY -> PrimaryAxisAlign.SPACE_BETWEEN;
        };
    }

    CounterAxisAlign mapCrossAxis(CrossAxisAlignment alignment) {
        if (alignment == null) return CounterAxisAlign.MIN;
        return switch (alignment) {
            case START, STRETCH -> CounterAxisAlign.MIN;
            case CENTER -> CounterAxisAlign.CENTER;
            case END -> CounterAxisAlign.MAX;
        };
    }

    private AxisSizingMode primaryAxisSizing(LayoutInfo layout, LayoutMode mode) {
        if (mode == LayoutMode.HORIZONTAL && layout.getWidth() != null) return AxisSizingMode.FIXED;
        if (mode == LayoutMode.VERTICAL && layout.getHeight() != null) return AxisSizingMode.FIXED;
        return AxisSizingMode.AUTO;
    }

    private AxisSizingMode counterAxisSizing(LayoutInfo layout, LayoutMode mode) {
        if (crossAxisOf(layout) == CrossAxisAlignment.STRETCH) return AxisSizingMode.FIXED;
        if (mode == LayoutMode.HORIZONTAL && layout.getHeight() != null) return AxisSizingMode.FIXED;
        if (mode == LayoutMode.VERTICAL && layout.getWidth() != null) return AxisSizingMode.FIXED;
        return AxisSizingMode.AUTO;
    }

    private MainAxisAlignment mainAxisOf(LayoutInfo layout) {
        AlignmentInfo alignment = layout.getAlignment();
        return alignment != null ? alignment.getMainAxis() : null;
    }

    private CrossAxisAlignment crossAxisOf(LayoutInfo layout) {
        AlignmentInfo alignment = layout.getAlignment();
        return alignment != null ? alignment.getCrossAxis() : null;
    }
}
