package com.architecture.design.nodeforge.service.style;

import com.architecture.design.nodeforge.exception.InvalidColorException;
import com.architecture.design.nodeforge.model.node.RgbColor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ColorParserTest {

    @Test
    void parsesSixDigitHex_intoUnitChannels() {
        RgbColor color = ColorParser.parseHex("#FF5733");

        assertThat(color.getR()).isCloseTo(1.0, within(0.001));
        assertThat(color.getG()).isCloseTo(0.341, within(0.001));
        assertThat(color.getB()).isCloseTo(0.2, within(0.001));
    }

    @Test
    void expandsShortHex_andAcceptsMissingHash() {
        assertThat(ColorParser.parseHex("#fff")).isEqualTo(new RgbColor(1, 1, 1));
        assertThat(ColorParser.parseHex("000000")).isEqualTo(new RgbColor(0, 0, 0));
    }

    @Test
    void rejectsMalformedValues() {
        assertThatThrownBy(() -> ColorParser.parseHex("#12345"))
                .isInstanceOf(InvalidColorException.class)
                .hasMessage("Invalid hex color format: 12345");
        assertThatThrownBy(() -> ColorParser.parseHex("#GG0000"))
                .isInstanceOf(InvalidColorException.class);
        assertThatThrownBy(() -> ColorParser.parseHex(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageEndingWith("null");
    }

    @Test
    void recognisesTransparentKeyword() {
        assertThat(ColorParser.isTransparent("transparent")).isTrue();
        assertThat(ColorParser.isTransparent("#00000000")).isFalse();
    }
}
