package com.ttennebkram.focusstack.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleLoggerTest {

    @Test
    void verboseOnlyWhenEnabled() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ConsoleLogger logger = new ConsoleLogger(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), false);

        logger.verbose("hidden %d", 1);
        logger.info("shown %d", 2);
        assertFalse(out.toString(StandardCharsets.UTF_8).contains("hidden"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("[INFO] shown 2"));

        logger.setVerboseEnabled(true);
        logger.verbose("now visible\n");
        String text = out.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("[VERBOSE] now visible"));
        assertFalse(text.contains("now visible\n\n"));
    }

    @Test
    void errorsGoToErrorStream() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        ConsoleLogger logger = new ConsoleLogger(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), true);

        logger.error("Could not load %s", "a.jpg");

        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[ERROR] Could not load a.jpg"));
    }

    @Test
    void messageWithoutArgumentsIsNotFormatted() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ConsoleLogger logger = new ConsoleLogger(new PrintStream(out, true, StandardCharsets.UTF_8), System.err, true);

        logger.info("100% done");

        assertTrue(out.toString(StandardCharsets.UTF_8).contains("100% done"));
    }
}
