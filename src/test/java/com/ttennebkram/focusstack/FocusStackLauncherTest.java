package com.ttennebkram.focusstack;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FocusStackLauncherTest {

    @TempDir
    Path tempDir;

    @Test
    void wrongArgumentCount() {
        assertEquals(FocusStackLauncher.EXIT_BAD_JOB, FocusStackLauncher.run(new String[0]));
        assertEquals(FocusStackLauncher.EXIT_BAD_JOB, FocusStackLauncher.run(new String[]{"a.json", "b.json"}));
    }

    @Test
    void unreadableJobFile() {
        String missing = tempDir.resolve("missing.json").toString();
        assertEquals(FocusStackLauncher.EXIT_BAD_JOB, FocusStackLauncher.run(new String[]{missing}));
    }

    @Test
    void invalidJobFile() throws Exception {
        Path job = tempDir.resolve("job.json");
        Files.write(job, "{\"images\": []}".getBytes(StandardCharsets.UTF_8));
        assertEquals(FocusStackLauncher.EXIT_BAD_JOB, FocusStackLauncher.run(new String[]{job.toString()}));

        Files.write(job, "not json {".getBytes(StandardCharsets.UTF_8));
        assertEquals(FocusStackLauncher.EXIT_BAD_JOB, FocusStackLauncher.run(new String[]{job.toString()}));

        Files.write(job, "{\"threads\": {}, \"images\": [{\"input\": null}]}".getBytes(StandardCharsets.UTF_8));
        assertEquals(FocusStackLauncher.EXIT_BAD_JOB, FocusStackLauncher.run(new String[]{job.toString()}));
    }
}
