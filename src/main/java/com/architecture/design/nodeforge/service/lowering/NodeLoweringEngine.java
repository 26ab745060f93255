package com.architecture.design.nodeforge.service.lowering;

import com.architecture.design.nodeforge.dto.widget.BorderInfo;
import com.architecture.design.nodeforge.dto.widget.BorderRadius;
import com.architecture.design.nodeforge.dto.widget.ColorInfo;
import com.architecture.design.nodeforge.dto.widget.LayoutInfo;
import com.architecture.design.nodeforge.dto.widget.StyleInfo;
import com.architecture.design.nodeforge.dto.widget.TypographyInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.dto.widget.WidgetType;
import com.architecture.design.nodeforge.exception.InvalidColorException;
import com.architecture.design.nodeforge.model.node.FontName;
import com.architecture.design.nodeforge.model.node.LayoutMode;
import com.architecture.design.nodeforge.model.node.LayoutSizing;
import com.architecture.design.nodeforge.model.node.NodeProperties;
import com.architecture.design.nodeforge.model.node.Paint;
import com.architecture.design.nodeforge.model.node.RgbColor;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import com.architecture.design.nodeforge.model.node.TargetNodeType;
import com.architecture.design.nodeforge.model.node.TextAlign;
import com.architecture.design.nodeforge.service.style.ColorParser;
import com.architecture.design.nodeforge.service.style.FontWeights;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowers a widget tree into a target node tree.
 *
 * Every widget becomes exactly one node and children keep their order, so the output tree has the
 * shape of the input. Ids come from the run's {@link LoweringContext}; two fresh contexts yield equal trees.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NodeLoweringEngine {

    public static final double DEFAULT_FONT_SIZE = 14;
    public static final String DEFAULT_FONT_FAMILY = "Inter";
    public static final String DEFAULT_TEXT = "Text";

    private static final String BACKGROUND_COLOR = "backgroundColor";
    private static final String COLOR = "color";
    private static final String CLIP_NONE = "none";

    private static final Map<WidgetType, TargetNodeType> TYPE_TABLE = new EnumMap<>(WidgetType.class);

    static {
        TYPE_TABLE.put(WidgetType.CONTAINER, TargetNodeType.FRAME);
        TYPE_TABLE.put(WidgetType.ROW, TargetNodeType.FRAME);
        TYPE_TABLE.put(WidgetType.COLUMN, TargetNodeType.FRAME);
        TYPE_TABLE.put(WidgetType.STACK, TargetNodeType.FRAME);
        TYPE_TABLE.put(WidgetType.SCAFFOLD, TargetNodeType.FRAME);
        TYPE_TABLE.put(WidgetType.TEXT, TargetNodeType.TEXT);
        TYPE_TABLE.put(WidgetType.IMAGE, TargetNodeType.RECTANGLE);
        TYPE_TABLE.put(WidgetType.BUTTON, TargetNodeType.COMPONENT);
        TYPE_TABLE.put(WidgetType.CARD, TargetNodeType.COMPONENT);
        TYPE_TABLE.put(WidgetType.APP_BAR, TargetNodeType.COMPONENT);
    }

    private final AutoLayoutMapper autoLayoutMapper;
    private final StackPositioner stackPositioner;

    /**
     * Lower with a fresh context.
     */
    public TargetNodeSpec lower(WidgetNode widget) {
        return lower(widget, new LoweringContext());
    }

    public TargetNodeSpec lower(WidgetNode widget, LoweringContext ctx) {
        TargetNodeType targetType = targetTypeOf(widget.getType());
        log.debug("[lowering] {} -> {}", widget.getType(), targetType);

        return switch (targetType) {
            case TEXT -> lowerText(widget, ctx);
            case RECTANGLE -> lowerRectangle(widget, ctx);
            case COMPONENT -> lowerComponent(widget, ctx);
            default -> lowerFrame(widget, ctx, TargetNodeType.FRAME);
        };
    }

    public static TargetNodeType targetTypeOf(WidgetType widgetType) {
        if (widgetType == null) {
            return TargetNodeType.FRAME;
        }
        return TYPE_TABLE.getOrDefault(widgetType, TargetNodeType.FRAME);
    }

    // ========================= FRAMES =========================

    private TargetNodeSpec lowerFrame(WidgetNode widget, LoweringContext ctx, TargetNodeType type) {
        TargetNodeSpec node = TargetNodeSpec.builder()
                .id(ctx.nextNodeId())
                .type(type)
                .name(nodeName(widget))
                .properties(frameProperties(widget, ctx))
                .build();

        LayoutInfo layout = widget.getLayout();
        if (widget.isStack()) {
            lowerStackChildren(node, widget, ctx);
        } else {
            lowerFlowChildren(node, widget, ctx);
        }

        if (layout != null) {
            node.setAutoLayout(autoLayoutMapper.toAutoLayout(layout));
            autoLayoutMapper.applySizeBounds(node.getProperties(), layout);
        }
        return node;
    }

    private void lowerStackChildren(TargetNodeSpec node, WidgetNode stack, LoweringContext ctx) {
        List<WidgetNode> children = childrenOf(stack);
        for (int i = 0; i < children.size(); i++) {
            WidgetNode child = children.get(i);
            TargetNodeSpec childNode = lower(child, ctx);
            stackPositioner.placeInStack(childNode, child, i);
            node.getChildren().add(childNode);
        }
    }

    private void lowerFlowChildren(TargetNodeSpec node, WidgetNode parent, LoweringContext ctx) {
        LayoutInfo layout = parent.getLayout();
        LayoutMode direction = autoLayoutMapper.layoutModeOf(layout);
        boolean stretch = autoLayoutMapper.stretchesChildren(layout);

        for (WidgetNode child : childrenOf(parent)) {
            TargetNodeSpec childNode = lower(child, ctx);
            applyFlex(childNode, child, direction);
            if (stretch) {
                fillCounterAxis(childNode, direction);
            }
            if (stackPositioner.isPositioned(child)) {
                stackPositioner.placeOutsideStack(childNode, child);
                ctx.warn("Positioned widget " + childNode.getName() + " inside " + node.getName()
                        + " is not in a Stack; placed absolutely");
            }
            node.getChildren().add(childNode);
        }
    }

    /**
     * Proportional grow along the parent's main axis for {@code flex} or expanded children.
     */
    private void applyFlex(TargetNodeSpec node, WidgetNode widget, LayoutMode direction) {
        WidgetProperties props = widget.getProperties();
        if (props == null || direction == LayoutMode.NONE) {
            return;
        }
        Double flex = props.getNumber(WidgetProperties.FLEX);
        boolean expanded = props.isSet(WidgetProperties.IS_EXPANDED);
        if ((flex == null || flex <= 0) && !expanded) {
            return;
        }
        double grow = flex != null && flex > 0 ? flex : 1;
        node.getProperties().setLayoutGrow(grow);
        if (direction == LayoutMode.HORIZONTAL) {
            node.getProperties().setLayoutSizingHorizontal(LayoutSizing.FILL);
        } else {
            node.getProperties().setLayoutSizingVertical(LayoutSizing.FILL);
        }
    }

    private void fillCounterAxis(TargetNodeSpec node, LayoutMode direction) {
        if (direction == LayoutMode.HORIZONTAL) {
            node.getProperties().setLayoutSizingVertical(LayoutSizing.FILL);
        } else if (direction == LayoutMode.VERTICAL) {
            node.getProperties().setLayoutSizingHorizontal(LayoutSizing.FILL);
        }
    }

    private NodeProperties frameProperties(WidgetNode widget, LoweringContext ctx) {
        NodeProperties props = basicProperties(widget);
        props.setFills(fills(widget, ctx));
        props.setStrokes(strokes(widget, ctx));
        double radius = cornerRadius(widget);
        if (radius > 0) {
            props.setCornerRadius(radius);
        }
        String clip = widget.getProperties() != null ? widget.getProperties().getText(WidgetProperties.CLIP_BEHAVIOR) : null;
        props.setClipsContent(!CLIP_NONE.equals(clip));
        return props;
    }

    // ========================= TEXT / RECTANGLE / COMPONENT =========================

    private TargetNodeSpec lowerText(WidgetNode widget, LoweringContext ctx) {
        TypographyInfo typography = styling(widget).getTypography();

        NodeProperties props = basicProperties(widget);
        props.setCharacters(Optional.ofNullable(widget.literalText()).orElse(DEFAULT_TEXT));
        props.setFontSize(typography != null && typography.getFontSize() != null
                ? typography.getFontSize() : DEFAULT_FONT_SIZE);
        props.setFontName(FontName.builder()
                .family(typography != null && typography.getFontFamily() != null
                        ? typography.getFontFamily() : DEFAULT_FONT_FAMILY)
                .style(FontWeights.styleOrRegular(typography != null ? typography.getFontWeight() : null))
                .build());
        props.setTextAlignHorizontal(textAlign(widget));
        props.setFills(textFills(widget, ctx));

        return TargetNodeSpec.builder()
                .id(ctx.nextNodeId())
                .type(TargetNodeType.TEXT)
                .name(nodeName(widget))
                .properties(props)
                .build();
    }

    private TargetNodeSpec lowerRectangle(WidgetNode widget, LoweringContext ctx) {
        NodeProperties props = basicProperties(widget);
        props.setFills(fills(widget, ctx));
        props.setStrokes(strokes(widget, ctx));
        double radius = cornerRadius(widget);
        if (radius > 0) {
            props.setCornerRadius(radius);
        }
        TargetNodeSpec node = TargetNodeSpec.builder()
                .id(ctx.nextNodeId())
                .type(TargetNodeType.RECTANGLE)
                .name(nodeName(widget))
                .properties(props)
                .build();
        if (!childrenOf(widget).isEmpty()) {
            // Rectangles cannot hold children; keep the tree shape by lowering them anyway
            childrenOf(widget).forEach(child -> node.getChildren().add(lower(child, ctx)));
        }
        return node;
    }

    private TargetNodeSpec lowerComponent(WidgetNode widget, LoweringContext ctx) {
        TargetNodeSpec node = lowerFrame(widget, ctx, TargetNodeType.COMPONENT);
        node.getProperties().setDescription("Component generated from " + widget.getType().getDisplayName() + " widget");
        return node;
    }

    // ========================= PROPERTY EXTRACTION =========================

    private NodeProperties basicProperties(WidgetNode widget) {
        NodeProperties props = new NodeProperties();
        WidgetProperties source = widget.getProperties();
        if (source != null) {
            props.setWidth(source.getNumber(WidgetProperties.WIDTH));
            props.setHeight(source.getNumber(WidgetProperties.HEIGHT));
        }
        props.setVisible(true);
        props.setLocked(false);
        return props;
    }

    /**
     * Literal background colours. Theme references are left to the style resolver.
     */
    private List<Paint> fills(WidgetNode widget, LoweringContext ctx) {
        List<Paint> fills = new ArrayList<>();
        for (ColorInfo color : styling(widget).getColors()) {
            if (!BACKGROUND_COLOR.equals(color.getProperty()) && !COLOR.equals(color.getProperty())) continue;
            if (color.isThemeReference() || ColorParser.isTransparent(color.getValue())) continue;
            parseLiteral(color.getValue(), widget, ctx).ifPresent(rgb -> fills.add(Paint.solid(rgb)));
        }
        if (fills.isEmpty()) {
            fills.add(Paint.solid(RgbColor.white(), 0));
        }
        return fills;
    }

    private List<Paint> textFills(WidgetNode widget, LoweringContext ctx) {
        Optional<RgbColor> textColor = styling(widget).getColors().stream()
                .filter(c -> COLOR.equals(c.getProperty()) && !c.isThemeReference())
                .findFirst()
                .flatMap(c -> parseLiteral(c.getValue(), widget, ctx));
        List<Paint> fills = new ArrayList<>();
        fills.add(Paint.solid(textColor.orElseGet(RgbColor::black)));
        return fills;
    }

    private List<Paint> strokes(WidgetNode widget, LoweringContext ctx) {
        List<Paint> strokes = new ArrayList<>();
        BorderInfo border = styling(widget).getBorders();
        if (border != null && border.getWidth() != null && border.getWidth() > 0 && border.getColor() != null) {
            parseLiteral(border.getColor(), widget, ctx).ifPresent(rgb -> strokes.add(Paint.solid(rgb)));
        }
        return strokes;
    }

    private double cornerRadius(WidgetNode widget) {
        WidgetProperties props = widget.getProperties();
        if (props != null && props.getDecoration() != null && props.getDecoration().getBorderRadius() != null) {
            return props.getDecoration().getBorderRadius().getTopLeft();
        }
        BorderInfo border = styling(widget).getBorders();
        if (border != null && border.getRadius() != null) {
            BorderRadius radius = border.getRadius();
            return radius.getTopLeft();
        }
        return 0;
    }

    private TextAlign textAlign(WidgetNode widget) {
        String align = widget.getProperties() != null ? widget.getProperties().getText(WidgetProperties.TEXT_ALIGN) : null;
        if (align == null) {
            return TextAlign.LEFT;
        }
        return switch (align) {
            case "center" -> TextAlign.CENTER;
            case "right" -> TextAlign.RIGHT;
            case "justify" -> TextAlign.JUSTIFIED;
            default -> TextAlign.LEFT;
        };
    }

    private Optional<RgbColor> parseLiteral(String value, WidgetNode widget, LoweringContext ctx) {
        try {
            return Optional.of(ColorParser.parseHex(value));
        } catch (InvalidColorException e) {
            ctx.warn("Skipped malformed color on " + widget.getType().getDisplayName()
                    + (widget.getId() != null ? " " + widget.getId() : "") + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private String nodeName(WidgetNode widget) {
        return WidgetContent.label(widget.getType().getDisplayName(), widget.literalText(), WidgetContent.keyOf(widget));
    }

    private static StyleInfo styling(WidgetNode widget) {
        return widget.getStyling() != null ? widget.getStyling() : StyleInfo.empty();
    }

    private static List<WidgetNode> childrenOf(WidgetNode widget) {
        return widget.getChildren() != null ? widget.getChildren() : List.of();
    }
}
