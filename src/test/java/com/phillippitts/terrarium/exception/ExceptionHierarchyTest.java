package com.phillippitts.terrarium.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void terrariumExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("disk");
        TerrariumException ex = new TerrariumException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void configurationExceptionShouldIncludePath() {
        ConfigurationException ex = new ConfigurationException("config/safety_limits.json", "Malformed");

        assertThat(ex.getMessage()).contains("Malformed").contains("config/safety_limits.json");
        assertThat(ex.getPath()).isEqualTo("config/safety_limits.json");
        assertThat(ex).isInstanceOf(TerrariumException.class);
    }

    @Test
    void serviceRestartExceptionShouldIncludeServiceName() {
        RuntimeException cause = new RuntimeException("port busy");
        ServiceRestartException ex = new ServiceRestartException("sensors", "start() failed", cause);

        assertThat(ex.getMessage()).contains("start() failed").contains("sensors");
        assertThat(ex.getServiceName()).isEqualTo("sensors");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void cycleExecutionExceptionShouldIncludeCycleNumber() {
        CycleExecutionException ex = new CycleExecutionException(42, new IllegalStateException("sensor gone"));

        assertThat(ex.getCycle()).isEqualTo(42);
        assertThat(ex.getMessage()).contains("42").contains("sensor gone");
    }

    @Test
    void allDomainExceptionsShouldBeUnchecked() {
        assertThat(new ControlServiceException("x")).isInstanceOf(RuntimeException.class);
        assertThat(new ServiceRestartException("s", "m")).isInstanceOf(TerrariumException.class);
        assertThat(new CycleExecutionException(1, new RuntimeException())).isInstanceOf(TerrariumException.class);
    }
}
