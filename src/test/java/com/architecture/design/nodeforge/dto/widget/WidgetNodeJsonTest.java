package com.architecture.design.nodeforge.dto.widget;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WidgetNodeJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsStructuredAndScalarPropertiesFromOneObject() throws Exception {
        String json = "{\"id\": \"c1\", \"type\": \"container\", \"properties\": {"
                + "\"padding\": {\"top\": 8, \"right\": 8, \"bottom\": 8, \"left\": 8},"
                + "\"width\": 120, \"isExpanded\": true, \"key\": \"hero\"}}";

        WidgetNode widget = objectMapper.readValue(json, WidgetNode.class);

        WidgetProperties props = widget.getProperties();
        assertThat(widget.getType()).isEqualTo(WidgetType.CONTAINER);
        assertThat(props.getPadding()).isEqualTo(EdgeInsets.all(8));
        assertThat(props.getNumber(WidgetProperties.WIDTH)).isEqualTo(120d);
        assertThat(props.isSet(WidgetProperties.IS_EXPANDED)).isTrue();
        assertThat(props.getText(WidgetProperties.KEY)).isEqualTo("hero");
        assertThat(props.values()).containsOnlyKeys("width", "isExpanded", "key");
        assertThat(props.size()).isEqualTo(4);
    }

    @Test
    void mapsFlutterClassNamesAndUnknownTags() throws Exception {
        WidgetNode button = objectMapper.readValue("{\"type\": \"ElevatedButton\"}", WidgetNode.class);
        WidgetNode unknown = objectMapper.readValue("{\"type\": \"ListTile\"}", WidgetNode.class);
        WidgetNode untyped = objectMapper.readValue("{\"id\": \"x\"}", WidgetNode.class);

        assertThat(button.getType()).isEqualTo(WidgetType.BUTTON);
        assertThat(unknown.getType()).isEqualTo(WidgetType.CUSTOM);
        assertThat(untyped.getType()).isEqualTo(WidgetType.CUSTOM);
    }

    @Test
    void writesScalarsFlatNextToStructuredMembers() throws Exception {
        WidgetProperties props = new WidgetProperties()
                .with(WidgetProperties.FLEX, 2)
                .with(WidgetProperties.DATA, "Hi")
                .withMargin(EdgeInsets.all(4));

        JsonNode json = objectMapper.valueToTree(props);

        assertThat(json.get("flex").isNumber()).isTrue();
        assertThat(json.get("flex").asDouble()).isEqualTo(2d);
        assertThat(json.get("data").asText()).isEqualTo("Hi");
        assertThat(json.get("margin").get("left").asDouble()).isEqualTo(4d);
        assertThat(json.has("values")).isFalse();
    }

    @Test
    void rejectsNonScalarPropertyValue() {
        String json = "{\"type\": \"text\", \"properties\": {\"data\": [1, 2]}}";

        assertThatThrownBy(() -> objectMapper.readValue(json, WidgetNode.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    void rendersWholeNumbersWithoutFraction() {
        assertThat(PropertyValue.of(2.0).toString()).isEqualTo("2");
        assertThat(PropertyValue.of(1.5).toString()).isEqualTo("1.5");
        assertThat(PropertyValue.of(0).isTruthy()).isFalse();
        assertThat(PropertyValue.of("").isTruthy()).isFalse();
    }
}
