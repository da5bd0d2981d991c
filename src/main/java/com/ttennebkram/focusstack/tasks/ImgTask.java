package com.ttennebkram.focusstack.tasks;

import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Task that has an image as its result.
 *
 * Besides the image, the task tracks a valid area: the part of the buffer that holds
 * real image content as opposed to padding added for the wavelet transform.
 * The two are only replaced together, through {@link #setResult(Mat, Rect)}.
 */
public abstract class ImgTask extends Task {

    // Guards result and validArea; readers on other threads see a consistent pair
    private final Object resultLock = new Object();

    private Mat result;
    private Rect validArea;

    private final AtomicBoolean defaultAreaReported = new AtomicBoolean(false);

    protected ImgTask() {
    }

    protected ImgTask(Mat result) {
        this.result = result;
    }

    /**
     * The current result buffer, unmodified. May be null before the task has run.
     */
    public Mat img() {
        synchronized (resultLock) {
            return result;
        }
    }

    /**
     * Replace the result buffer and its valid area in one step.
     *
     * @param img new buffer
     * @param area valid area in the coordinates of img, or null for the entire buffer
     */
    protected void setResult(Mat img, Rect area) {
        synchronized (resultLock) {
            this.result = img;
            this.validArea = area != null ? area.clone() : null;
        }
    }

    /**
     * Drop the reference to the result buffer so it can be garbage collected.
     */
    public void releaseResult() {
        setResult(null, null);
    }

    public boolean hasValidArea() {
        synchronized (resultLock) {
            return validArea != null && validArea.width != 0 && validArea.height != 0;
        }
    }

    /**
     * The valid area, or the full buffer if none has been set.
     */
    public Rect validArea() {
        synchronized (resultLock) {
            if (validArea != null && validArea.width != 0 && validArea.height != 0) {
                return validArea.clone();
            }
            if (defaultAreaReported.compareAndSet(false, true)) {
                logger.verbose("Valid area not defined for %s, using default.", name);
            }
            return result != null ? new Rect(0, 0, result.cols(), result.rows()) : new Rect();
        }
    }

    /**
     * The buffer with padding removed. Returns the buffer itself when there is nothing to remove.
     */
    public Mat imgCropped() {
        Mat img;
        Rect area;
        synchronized (resultLock) {
            img = result;
            area = validArea;
        }
        if (img == null || area == null || area.width == 0 || area.height == 0) {
            return img;
        }

        if (area.x > 0 || area.y > 0 || area.width < img.cols() || area.height < img.rows()) {
            return extractOriginalArea(img);
        }
        return img;
    }

    /**
     * Extract the original image area from an expanded image.
     * The valid area is clamped to the given buffer first, in case the caller passes
     * a buffer of a different size than this task's own result.
     *
     * @param expanded buffer in the same coordinates as this task's result
     * @return deep copy of the valid area, or expanded itself when no cropping is needed
     */
    public Mat extractOriginalArea(Mat expanded) {
        Rect area;
        synchronized (resultLock) {
            area = validArea;
        }
        if (area == null || area.width == 0 || area.height == 0) {
            return expanded;
        }

        int cols = expanded.cols();
        int rows = expanded.rows();
        if (area.x == 0 && area.y == 0 && area.width == cols && area.height == rows) {
            return expanded;
        }

        // Make sure the rectangle is within image bounds
        int x = Math.max(0, Math.min(area.x, cols - 1));
        int y = Math.max(0, Math.min(area.y, rows - 1));
        int width = Math.min(area.width, cols - x);
        int height = Math.min(area.height, rows - y);
        Rect safeRect = new Rect(x, y, width, height);

        Mat submat = new Mat(expanded, safeRect);
        try {
            return submat.clone();
        } finally {
            submat.release();
        }
    }

    /**
     * Limit the valid area to its intersection with another rectangle.
     * Used when two images are combined and only their common content is valid.
     */
    protected void limitValidArea(Rect other) {
        synchronized (resultLock) {
            Rect current = validArea != null ? validArea
                    : new Rect(0, 0, result != null ? result.cols() : 0, result != null ? result.rows() : 0);
            int x0 = Math.max(current.x, other.x);
            int y0 = Math.max(current.y, other.y);
            int x1 = Math.min(current.x + current.width, other.x + other.width);
            int y1 = Math.min(current.y + current.height, other.y + other.height);
            if (x1 <= x0 || y1 <= y0) {
                validArea = new Rect(x0, y0, 0, 0);
            } else {
                validArea = new Rect(x0, y0, x1 - x0, y1 - y0);
            }
        }
    }
}
