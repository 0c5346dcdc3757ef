package com.phillippitts.syd.service.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterTypeTest {

    @Test
    void intParsesIntegralFloats() {
        assertThat(ParameterType.INT.parse("20")).isEqualTo(20);
        assertThat(ParameterType.INT.parse(" 20.0 ")).isEqualTo(20);
    }

    @Test
    void intRejectsFractions() {
        assertThatThrownBy(() -> ParameterType.INT.parse("2.5"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ParameterType.INT.parse("abc"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void intOutOfRangeIsIllegalArgument() {
        assertThatThrownBy(() -> ParameterType.INT.parse("1e12"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> ParameterType.INT.normalize(5_000_000_000L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ParameterType.INT.parse(String.valueOf(Integer.MAX_VALUE))).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void boolAcceptsCommonSpellings() {
        assertThat(ParameterType.BOOL.parse("True")).isEqualTo(true);
        assertThat(ParameterType.BOOL.parse("1")).isEqualTo(true);
        assertThat(ParameterType.BOOL.parse("f")).isEqualTo(false);
        assertThat(ParameterType.BOOL.parse("0.0")).isEqualTo(false);
        assertThatThrownBy(() -> ParameterType.BOOL.parse("maybe"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void floatAndStringParse() {
        assertThat(ParameterType.FLOAT.parse("643.2")).isEqualTo(643.2);
        assertThat(ParameterType.STRING.parse("median")).isEqualTo("median");
        assertThat(ParameterType.STRING.parse("  median ")).isEqualTo("median");
    }

    @Test
    void acceptsChecksJavaTypes() {
        assertThat(ParameterType.INT.accepts(3)).isTrue();
        assertThat(ParameterType.INT.accepts(3L)).isTrue();
        assertThat(ParameterType.INT.accepts(3.0)).isFalse();
        assertThat(ParameterType.FLOAT.accepts(3)).isTrue();
        assertThat(ParameterType.BOOL.accepts("true")).isFalse();
        assertThat(ParameterType.STRING.accepts(null)).isTrue();
    }

    @Test
    void normalizeWidensToCanonicalTypes() {
        assertThat(ParameterType.FLOAT.normalize(3)).isEqualTo(3.0);
        assertThat(ParameterType.INT.normalize(7L)).isEqualTo(7);
        assertThatThrownBy(() -> ParameterType.INT.normalize(1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
