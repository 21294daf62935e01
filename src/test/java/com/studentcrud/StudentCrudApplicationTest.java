package com.studentcrud;

import com.studentcrud.shell.ShellConsole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.SpringApplication;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StudentCrudApplicationTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T09:30:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Malformed PGPORT should name the setting, timestamped, with exit status 1")
    void malformedPort_shouldReportSettingAndExitOne() {
        RuntimeException failure = assertThrows(RuntimeException.class,
                () -> SpringApplication.run(StudentCrudApplication.class, "--PGPORT=fifty"));

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ShellConsole console = new ShellConsole(new BufferedReader(new StringReader("")),
                new PrintStream(output, true, StandardCharsets.UTF_8), CLOCK);

        int exitCode = StudentCrudApplication.reportStartupFailure(failure, console);

        assertThat(exitCode).isEqualTo(1);
        assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo(
                "[2024-05-01 09:30:00] Initialization error: PGPORT must be an integer but was 'fifty'"
                        + System.lineSeparator());
    }

    @Test
    void startupFailureMessage_onlySpringCauses_shouldUseInnermost() {
        BeanCreationException failure = new BeanCreationException("outer",
                new BeanCreationException("dataSource could not be created"));

        assertThat(StudentCrudApplication.startupFailureMessage(failure))
                .isEqualTo("Initialization error: dataSource could not be created");
    }

    @Test
    void startupFailureMessage_withoutMessage_shouldUseClassName() {
        assertThat(StudentCrudApplication.startupFailureMessage(new IllegalStateException()))
                .isEqualTo("Initialization error: IllegalStateException");
    }
}
