package com.pathwaygraph.core.generator;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Orientation}.
 */
class OrientationTest {

    @ParameterizedTest
    @ValueSource(strings = {"vertical", "TD", "tb", " Vertical "})
    void fromValue_withVerticalAliases_returnsVertical(String value) {
        assertThat(Orientation.fromValue(value)).isEqualTo(Orientation.VERTICAL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"horizontal", "LR", "lr"})
    void fromValue_withHorizontalAliases_returnsHorizontal(String value) {
        assertThat(Orientation.fromValue(value)).isEqualTo(Orientation.HORIZONTAL);
    }

    @Test
    void fromValue_withNull_returnsVertical() {
        assertThat(Orientation.fromValue(null)).isEqualTo(Orientation.VERTICAL);
    }

    @Test
    void fromValue_withUnknownValue_throwsException() {
        assertThatThrownBy(() -> Orientation.fromValue("diagonal"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("diagonal");
    }

    @Test
    void directions_matchDiagramLanguages() {
        assertThat(Orientation.VERTICAL.mermaidDirection()).isEqualTo("TD");
        assertThat(Orientation.VERTICAL.dotRankdir()).isEqualTo("TB");
        assertThat(Orientation.HORIZONTAL.mermaidDirection()).isEqualTo("LR");
        assertThat(Orientation.HORIZONTAL.dotRankdir()).isEqualTo("LR");
    }
}
