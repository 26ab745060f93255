package com.architecture.design.nodeforge.service.lowering;

import com.architecture.design.nodeforge.dto.widget.PositionInfo;
import com.architecture.design.nodeforge.dto.widget.WidgetNode;
import com.architecture.design.nodeforge.dto.widget.WidgetProperties;
import com.architecture.design.nodeforge.model.node.ConstraintType;
import com.architecture.design.nodeforge.model.node.LayoutPositioning;
import com.architecture.design.nodeforge.model.node.NodeProperties;
import com.architecture.design.nodeforge.model.node.TargetNodeSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Absolute placement of positioned children.
 *
 * Edge rules: left/top set x/y directly. A right/bottom offset pins the node to that edge and,
 * when the matching size is known and no left/top is given, back-computes x = -right - width
 * (y = -bottom - height). When both opposing edges are present, left/top win.
 */
@Component
@Slf4j
public class StackPositioner {

    /**
     * Place a Stack child. z-order is the source child index.
     */
    public void placeInStack(TargetNodeSpec node, WidgetNode widget, int zIndex) {
        PositionInfo position = positionOf(widget);
        if (position != null) {
            applyEdges(node, position);
        }
        node.getProperties().setZIndex(zIndex);
    }

    /**
     * Place a positioned child whose parent is not a Stack. No z-index is assigned.
     */
    public void placeOutsideStack(TargetNodeSpec node, WidgetNode widget) {
        PositionInfo position = positionOf(widget);
        if (position != null) {
            applyEdges(node, position);
        }
        node.getProperties().setLayoutPositioning(LayoutPositioning.ABSOLUTE);
    }

    public boolean isPositioned(WidgetNode widget) {
        return widget.getPosition() != null
                || (widget.getProperties() != null && widget.getProperties().isSet(WidgetProperties.IS_POSITIONED));
    }

    /**
     * Explicit position, else the {@code positioned} property, else loose edge properties.
     */
    PositionInfo positionOf(WidgetNode widget) {
        if (widget.getPosition() != null) {
            return widget.getPosition();
        }
        WidgetProperties props = widget.getProperties();
        if (props == null) {
            return null;
        }
        if (props.getPositioned() != null) {
            return props.getPositioned();
        }
        if (props.has(WidgetProperties.LEFT) || props.has(WidgetProperties.RIGHT)
                || props.has(WidgetProperties.TOP) || props.has(WidgetProperties.BOTTOM)) {
            return PositionInfo.builder()
                    .left(props.getNumber(WidgetProperties.LEFT))
                    .right(props.getNumber(WidgetProperties.RIGHT))
                    .top(props.getNumber(WidgetProperties.TOP))
                    .bottom(props.getNumber(WidgetProperties.BOTTOM))
                    .width(props.getNumber(WidgetProperties.WIDTH))
                    .height(props.getNumber(WidgetProperties.HEIGHT))
                    .build();
        }
        return null;
    }

    private void applyEdges(TargetNodeSpec node, PositionInfo position) {
        NodeProperties props = node.getProperties();

        if (position.getLeft() != null) {
            props.setX(position.getLeft());
            props.constraints().setHorizontal(ConstraintType.LEFT);
            if (position.getRight() != null) {
                log.debug("[lowering] {} sets both left and right, left wins", node.getName());
            }
        } else if (position.getRight() != null) {
            props.constraints().setHorizontal(ConstraintType.RIGHT);
            if (position.getWidth() != null) {
                props.setX(-position.getRight() - position.getWidth());
            }
        }

        if (position.getTop() != null) {
            props.setY(position.getTop());
            props.constraints().setVertical(ConstraintType.TOP);
            if (position.getBottom() != null) {
                log.debug("[lowering] {} sets both top and bottom, top wins", node.getName());
            }
        } else if (position.getBottom() != null) {
            props.constraints().setVertical(ConstraintType.BOTTOM);
            if (position.getHeight() != null) {
                props.setY(-position.getBottom() - position.getHeight());
            }
        }

        if (position.getWidth() != null) props.setWidth(position.getWidth());
        if (position.getHeight() != null) props.setHeight(position.getHeight());
    }
}
