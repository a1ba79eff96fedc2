package io.hearthwarrio.pagelens.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CliOptionsTest {

    @Test
    void parsesRunWithAllOptions() {
        CliOptions o = CliOptions.parse("run", "--task", "task.json", "--config", "conf/p.yaml", "--pretty", "--engine", "STATIC");

        assertEquals(CliOptions.RUN, o.getCommand());
        assertEquals("task.json", o.getTask());
        assertEquals(Path.of("conf/p.yaml"), o.getConfig());
        assertTrue(o.isPretty());
        assertEquals("static", o.getEngine());
    }

    @Test
    void runIsTheDefaultCommand() {
        CliOptions o = CliOptions.parse("--task", "-");

        assertEquals(CliOptions.RUN, o.getCommand());
        assertEquals(CliOptions.STDIN, o.getTask());
        assertEquals(CliOptions.DEFAULT_CONFIG, o.getConfig());
        assertFalse(o.isPretty());
        assertNull(o.getEngine());
    }

    @Test
    void validateDoesNotNeedTask() {
        CliOptions o = CliOptions.parse("validate", "--config", "p.yaml");

        assertEquals(CliOptions.VALIDATE, o.getCommand());
        assertNull(o.getTask());
    }

    @Test
    void runWithoutTaskIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CliOptions.parse("run"));

        assertEquals("--task is required", e.getMessage());
    }

    @Test
    void optionWithoutValueIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CliOptions.parse("run", "--task", "--pretty"));

        assertEquals("--task needs a value", e.getMessage());
    }

    @Test
    void unknownEngineIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse("run", "--task", "-", "--engine", "firefox"));
    }

    @Test
    void unknownCommandAndOptionAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse("serve"));
        assertThrows(IllegalArgumentException.class, () -> CliOptions.parse("run", "--task", "-", "--verbose"));
    }
}
