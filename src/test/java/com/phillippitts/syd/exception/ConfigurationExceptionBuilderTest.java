package com.phillippitts.syd.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationExceptionBuilderTest {

    @Test
    void buildsMessageWithExpectedActualAndDetails() {
        ConfigurationException ex = ConfigurationExceptionBuilder.create("Length mismatch")
                .parameter("numax")
                .expected(3)
                .actual(2)
                .detail("source", "cli")
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Length mismatch [expected=3, actual=2, source=cli] (parameter: numax)");
        assertThat(ex.getParameter()).isEqualTo("numax");
    }

    @Test
    void plainMessageWhenNoDetails() {
        ConfigurationException ex = ConfigurationExceptionBuilder.create("No stars").build();

        assertThat(ex.getMessage()).isEqualTo("No stars");
        assertThat(ex.getParameter()).isNull();
    }

    @Test
    void keepsCauseAndIgnoresNullDetails() {
        IOException cause = new IOException("boom");
        ConfigurationException ex = ConfigurationExceptionBuilder.create("Cannot read")
                .cause(cause)
                .detail("path", null)
                .detail(null, "x")
                .build();

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage()).isEqualTo("Cannot read");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> ConfigurationExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConfigurationExceptionBuilder.create(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
