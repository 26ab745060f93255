package com.architecture.design.nodeforge.model.node;

import com.architecture.design.nodeforge.dto.widget.PropertyValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Typed property set of a target node. Which members are populated depends on the node type;
 * unset members are omitted from the JSON form.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeProperties {

    // Geometry
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private Double minWidth;
    private Double maxWidth;
    private Double minHeight;
    private Double maxHeight;
    private Boolean visible;
    private Boolean locked;

    // Paint
    private List<Paint> fills;
    private List<Paint> strokes;
    private Double strokeWeight;
    private Double cornerRadius;
    private Double topLeftRadius;
    private Double topRightRadius;
    private Double bottomRightRadius;
    private Double bottomLeftRadius;
    private Boolean clipsContent;
    private List<Effect> effects;

    // Placement inside the parent
    private LayoutConstraints constraints;
    @JsonProperty("zIndex")
    private Integer zIndex;
    private Double layoutGrow;
    private LayoutSizing layoutSizingHorizontal;
    private LayoutSizing layoutSizingVertical;
    private LayoutPositioning layoutPositioning;

    // Text
    private String characters;
    private Double fontSize;
    private FontName fontName;
    private TextAlign textAlignHorizontal;
    private UnitValue lineHeight;
    private UnitValue letterSpacing;

    // Components and instances
    private String description;
    private String componentId;
    private Map<String, PropertyValue> overrides;

    public LayoutConstraints constraints() {
        if (constraints == null) {
            constraints = new LayoutConstraints();
        }
        return constraints;
    }
}
