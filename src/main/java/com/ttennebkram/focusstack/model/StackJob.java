package com.ttennebkram.focusstack.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A batch of images to load, crop and save, plus the settings for the Worker.
 * Loaded from and saved to JSON by {@code StackJobSerializer}.
 */
public class StackJob {

    public static final int DEFAULT_JPG_QUALITY = 95;

    /**
     * One input image and where its result goes.
     */
    public static class ImageEntry {
        public final String input;
        public final String output;

        public ImageEntry(String input, String output) {
            this.input = input;
            this.output = output;
        }
    }

    private final List<ImageEntry> images = new ArrayList<>();
    private String alphaMask = null;
    private int threads = Runtime.getRuntime().availableProcessors();
    private int openClLimit = 1;
    private FailurePolicy failurePolicy = FailurePolicy.SKIP_DEPENDENTS;
    private double waitImages = 0;
    private int jpgQuality = DEFAULT_JPG_QUALITY;
    private boolean noCrop = false;
    private boolean verbose = false;
    private long timeoutMs = -1;

    public List<ImageEntry> getImages() {
        return Collections.unmodifiableList(images);
    }

    public void addImage(String input, String output) {
        images.add(new ImageEntry(input, output));
    }

    /** Path of the alpha mask image, or null for none. */
    public String getAlphaMask() { return alphaMask; }
    public void setAlphaMask(String v) { alphaMask = v; }

    public int getThreads() { return threads; }
    public void setThreads(int v) { threads = v; }

    public int getOpenClLimit() { return openClLimit; }
    public void setOpenClLimit(int v) { openClLimit = v; }

    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public void setFailurePolicy(FailurePolicy v) { failurePolicy = v; }

    /** Seconds to wait for input files to appear. */
    public double getWaitImages() { return waitImages; }
    public void setWaitImages(double v) { waitImages = v; }

    public int getJpgQuality() { return jpgQuality; }
    public void setJpgQuality(int v) { jpgQuality = v; }

    public boolean isNoCrop() { return noCrop; }
    public void setNoCrop(boolean v) { noCrop = v; }

    public boolean isVerbose() { return verbose; }
    public void setVerbose(boolean v) { verbose = v; }

    /** Overall time limit in milliseconds, negative for none. */
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long v) { timeoutMs = v; }
}
