package com.ttennebkram.focusstack.tasks;

import com.ttennebkram.focusstack.processing.DyadicWaveletSizer;
import com.ttennebkram.focusstack.processing.ImageCodec;
import com.ttennebkram.focusstack.processing.OpenCvImageCodec;
import com.ttennebkram.focusstack.processing.WaveletLevels;
import com.ttennebkram.focusstack.processing.WaveletSizer;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Loads an image from file (or takes one from memory) and pads it to a size
 * the wavelet transform can handle.
 *
 * With a wait window, a missing file is not an error until the window has elapsed.
 * This allows processing images as they are written by another program.
 */
public class LoadImgTask extends ImgTask {

    /** Interval between decode attempts while waiting for a file. */
    public static final long RETRY_INTERVAL_MS = 100;

    private final ImageCodec codec;
    private final WaveletSizer waveletSizer;
    private final double waitImagesSeconds;
    private final long waitImagesUntilNanos;

    // Image supplied in memory, used instead of decoding
    private Mat preloaded;

    private Size originalSize;
    private Mat originalImage;
    private int waveletLevels;

    public LoadImgTask(String filename) {
        this(filename, 0);
    }

    public LoadImgTask(String filename, double waitImagesSeconds) {
        this(filename, waitImagesSeconds, new OpenCvImageCodec(), new DyadicWaveletSizer());
    }

    public LoadImgTask(String filename, double waitImagesSeconds, ImageCodec codec, WaveletSizer waveletSizer) {
        this.filename = filename;
        this.name = "Load " + filename;
        this.codec = codec;
        this.waveletSizer = waveletSizer;
        this.waitImagesSeconds = Math.max(0, waitImagesSeconds);
        this.waitImagesUntilNanos = System.nanoTime() + (long) (this.waitImagesSeconds * 1e9);
    }

    /**
     * Use an already decoded image. The image is copied.
     *
     * @throws IllegalArgumentException if img is null or empty
     */
    public LoadImgTask(String name, Mat img) {
        this(name, img, new DyadicWaveletSizer());
    }

    public LoadImgTask(String name, Mat img, WaveletSizer waveletSizer) {
        this.filename = name;
        this.name = "Memory image " + name;
        this.codec = null;
        this.waveletSizer = waveletSizer;
        this.waitImagesSeconds = 0;
        this.waitImagesUntilNanos = System.nanoTime();
        if (img == null || img.empty()) {
            throw new IllegalArgumentException("Memory image " + name + " is empty");
        }
        this.preloaded = img.clone();
    }

    private boolean waitWindowOpen() {
        return waitImagesSeconds > 0 && System.nanoTime() < waitImagesUntilNanos;
    }

    @Override
    public boolean readyToRun() {
        if (!super.readyToRun()) {
            return false;
        }

        // Wait for image files to appear instead of occupying a thread
        if (waitWindowOpen()) {
            File file = new File(filename);
            if (!file.isFile() || !file.canRead()) {
                return false;
            }
        }

        return true;
    }

    @Override
    public boolean awaitsExternalEvent() {
        return preloaded == null && waitWindowOpen();
    }

    @Override
    protected void task() throws Exception {
        Mat img = preloaded;
        preloaded = null;

        if (img == null || img.empty()) {
            img = codec.decode(filename);
        }

        while ((img == null || img.empty()) && System.nanoTime() < waitImagesUntilNanos) {
            TimeUnit.MILLISECONDS.sleep(RETRY_INTERVAL_MS);
            img = codec.decode(filename);
        }

        if (img == null || img.empty()) {
            throw new IOException("Could not load " + filename);
        }

        // Store original size and the image itself before any padding
        originalSize = img.size();
        originalImage = img.clone();
        int origWidth = img.cols();
        int origHeight = img.rows();

        WaveletLevels sizing = waveletSizer.levelsForSize(origWidth, origHeight);
        waveletLevels = sizing.getLevels();
        int expandedWidth = sizing.getExpandedWidth();
        int expandedHeight = sizing.getExpandedHeight();

        logger.verbose("%s has resolution %dx%d, using %d wavelet levels and expanding to %dx%d",
                basename(), origWidth, origHeight, waveletLevels, expandedWidth, expandedHeight);

        if (expandedWidth == origWidth && expandedHeight == origHeight) {
            setResult(img, new Rect(0, 0, origWidth, origHeight));
            return;
        }

        if (expandedWidth < origWidth || expandedHeight < origHeight) {
            throw new IllegalStateException(String.format("Wavelet size %dx%d is smaller than image %s (%dx%d)",
                    expandedWidth, expandedHeight, basename(), origWidth, origHeight));
        }

        int expandX = expandedWidth - origWidth;
        int expandY = expandedHeight - origHeight;
        Mat padded = new Mat();

        // Pad with reflection at the borders, splitting the extra pixels between both sides
        Core.copyMakeBorder(img, padded,
                expandY / 2, expandY - expandY / 2,
                expandX / 2, expandX - expandX / 2,
                Core.BORDER_REFLECT);

        setResult(padded, new Rect(expandX / 2, expandY / 2, origWidth, origHeight));
        img.release();
    }

    /**
     * Size of the image before padding, or null if not loaded yet.
     */
    public Size getOriginalSize() {
        return originalSize;
    }

    /**
     * Copy of the decoded image without padding, or null if not loaded yet.
     */
    public Mat getOriginalImage() {
        return originalImage;
    }

    public int getWaveletLevels() {
        return waveletLevels;
    }

    public double getWaitImagesSeconds() {
        return waitImagesSeconds;
    }
}
