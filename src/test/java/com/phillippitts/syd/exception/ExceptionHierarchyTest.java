package com.phillippitts.syd.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void sydExceptionShouldIncludeMessage() {
        SydException ex = new SydException("test error");
        assertThat(ex.getMessage()).isEqualTo("test error");
    }

    @Test
    void sydExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        SydException ex = new SydException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void configurationExceptionShouldNameParameter() {
        ConfigurationException ex = new ConfigurationException("bad length", "numax");

        assertThat(ex.getMessage()).isEqualTo("bad length (parameter: numax)");
        assertThat(ex.getParameter()).isEqualTo("numax");
    }

    @Test
    void configurationExceptionWithoutParameter() {
        ConfigurationException ex = new ConfigurationException("no stars");

        assertThat(ex.getMessage()).isEqualTo("no stars");
        assertThat(ex.getParameter()).isNull();
    }

    @Test
    void processingExceptionShouldNameStar() {
        IOException cause = new IOException("disk full");
        ProcessingException ex = new ProcessingException("cannot write", "KIC123", cause);

        assertThat(ex.getMessage()).contains("cannot write").contains("KIC123");
        assertThat(ex.getStar()).isEqualTo("KIC123");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allExceptionsShouldExtendSydException() {
        assertThat(new ConfigurationException("x")).isInstanceOf(SydException.class);
        assertThat(new ProcessingException("x", "s")).isInstanceOf(SydException.class);
        assertThat(new SydException("x")).isInstanceOf(RuntimeException.class);
    }
}
