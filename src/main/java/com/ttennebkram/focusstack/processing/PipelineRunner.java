package com.ttennebkram.focusstack.processing;

import com.ttennebkram.focusstack.model.RunResult;
import com.ttennebkram.focusstack.model.StackJob;
import com.ttennebkram.focusstack.model.WorkerStatus;
import com.ttennebkram.focusstack.tasks.LoadImgTask;
import com.ttennebkram.focusstack.tasks.SaveImgTask;
import com.ttennebkram.focusstack.util.PipelineLogger;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the task graph for a {@link StackJob} and runs it on a {@link Worker}.
 *
 * Graph: an optional alpha mask load task shared by all images, then for each image
 * a load task followed by a save task. Tasks are indexed in pipeline order so that
 * progress reports name the image furthest along.
 */
public class PipelineRunner {

    private final StackJob job;
    private final PipelineLogger logger;
    private final ImageCodec codec;
    private final WaveletSizer waveletSizer;

    private final List<SaveImgTask> saveTasks = new ArrayList<>();
    private String error;

    public PipelineRunner(StackJob job, PipelineLogger logger) {
        this(job, logger, new OpenCvImageCodec(), new DyadicWaveletSizer());
    }

    public PipelineRunner(StackJob job, PipelineLogger logger, ImageCodec codec, WaveletSizer waveletSizer) {
        this.job = job;
        this.logger = logger != null ? logger : PipelineLogger.NONE;
        this.codec = codec;
        this.waveletSizer = waveletSizer;
    }

    /**
     * Run the whole job and block until it is done or the job timeout elapses.
     */
    public RunResult run() {
        saveTasks.clear();
        error = null;

        try (Worker worker = new Worker(job.getThreads(), logger, job.getOpenClLimit(), job.getFailurePolicy())) {
            int index = 0;

            LoadImgTask mask = null;
            if (job.getAlphaMask() != null) {
                mask = new LoadImgTask(job.getAlphaMask(), job.getWaitImages(), codec, waveletSizer);
                mask.setIndex(index++);
                worker.add(mask);
            }

            for (StackJob.ImageEntry entry : job.getImages()) {
                LoadImgTask load = new LoadImgTask(entry.input, job.getWaitImages(), codec, waveletSizer);
                load.setIndex(index++);
                worker.add(load);

                SaveImgTask save = new SaveImgTask(entry.output, load, mask, job.getJpgQuality(), job.isNoCrop(), codec);
                save.setIndex(index++);
                worker.add(save);
                saveTasks.add(save);
            }

            logger.info("Processing %d images with %d threads", job.getImages().size(), job.getThreads());

            if (!worker.waitAll(job.getTimeoutMs())) {
                WorkerStatus status = worker.getStatus();
                error = "Timed out after " + job.getTimeoutMs() + " ms at " + status;
                logger.error("%s", error);
                worker.discardPending("Timed out");
                return RunResult.TIMED_OUT;
            }

            WorkerStatus status = worker.getStatus();
            if (worker.failed()) {
                error = worker.error();
                logger.error("Processing failed: %s", error);
                return RunResult.FAILED;
            }

            logger.info("Completed %d of %d tasks", status.getCompletedTasks(), status.getTotalTasks());
            return RunResult.SUCCESS;
        }
    }

    /**
     * Results of the save tasks that write nowhere, keyed by input path.
     */
    public Map<String, Mat> getMemoryResults() {
        Map<String, Mat> results = new LinkedHashMap<>();
        List<StackJob.ImageEntry> images = job.getImages();
        for (int i = 0; i < saveTasks.size(); i++) {
            SaveImgTask save = saveTasks.get(i);
            if (!save.writesFile() && save.img() != null) {
                results.put(images.get(i).input, save.img());
            }
        }
        return Collections.unmodifiableMap(results);
    }

    /**
     * First error of the last run, or null.
     */
    public String getError() {
        return error;
    }
}
