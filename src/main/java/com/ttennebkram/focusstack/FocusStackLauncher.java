package com.ttennebkram.focusstack;

import com.google.gson.JsonParseException;
import com.ttennebkram.focusstack.model.RunResult;
import com.ttennebkram.focusstack.model.StackJob;
import com.ttennebkram.focusstack.processing.PipelineRunner;
import com.ttennebkram.focusstack.serialization.StackJobSerializer;
import com.ttennebkram.focusstack.util.ConsoleLogger;

import java.io.IOException;

/**
 * Command line entry point: runs the stack job described by a JSON file.
 *
 * Exit codes: 0 success, 1 a task failed, 2 timed out, 3 unusable job file or arguments.
 */
public class FocusStackLauncher {

    static final int EXIT_BAD_JOB = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: focus-stack <job.json>");
            return EXIT_BAD_JOB;
        }

        StackJob job;
        try {
            job = StackJobSerializer.load(args[0]);
        } catch (IOException | JsonParseException | IllegalArgumentException e) {
            System.err.println("[FocusStackLauncher] Could not read job " + args[0] + ": " + e.getMessage());
            return EXIT_BAD_JOB;
        }

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        ConsoleLogger logger = new ConsoleLogger(job.isVerbose());
        RunResult result = new PipelineRunner(job, logger).run();
        return result.getExitCode();
    }
}
