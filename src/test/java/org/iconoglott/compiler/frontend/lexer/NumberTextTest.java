package org.iconoglott.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class NumberTextTest {

    @Test
    void formatsIntegralValuesWithoutFraction() {
        assertThat(NumberText.format(10.0)).isEqualTo("10");
        assertThat(NumberText.format(-0.0)).isEqualTo("0");
        assertThat(NumberText.format(-250)).isEqualTo("-250");
    }

    @Test
    void formatsFractionsWithoutExponent() {
        assertThat(NumberText.format(2.5)).isEqualTo("2.5");
        assertThat(NumberText.format(0.0001)).isEqualTo("0.0001");
        assertThat(NumberText.format(1e20)).isEqualTo("100000000000000000000");
    }

    @Test
    void formatsNonFiniteValuesAsZero() {
        assertThat(NumberText.format(Double.NaN)).isEqualTo("0");
        assertThat(NumberText.format(Double.POSITIVE_INFINITY)).isEqualTo("0");
    }
}
