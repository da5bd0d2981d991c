package com.ttennebkram.focusstack.tasks;

import com.ttennebkram.focusstack.processing.ImageCodec;
import com.ttennebkram.focusstack.processing.OpenCvImageCodec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes padding from an image, optionally adds an alpha channel, and writes it to file.
 *
 * With an empty path or {@link #MEMORY_PATH} nothing is written: the task only
 * produces the final cropped image, available through {@link #img()}.
 */
public class SaveImgTask extends ImgTask {

    /** Output path meaning "keep the result in memory only". */
    public static final String MEMORY_PATH = ":memory:";

    private final ImageCodec codec;
    private final int jpgQuality;
    private final boolean noCrop;

    // Inputs, released once consumed
    private ImgTask input;
    private ImgTask alphaMask;

    public SaveImgTask(String filename, ImgTask input, ImgTask alphaMask, int jpgQuality, boolean noCrop) {
        this(filename, input, alphaMask, jpgQuality, noCrop, new OpenCvImageCodec());
    }

    public SaveImgTask(String filename, ImgTask input, ImgTask alphaMask, int jpgQuality, boolean noCrop,
                       ImageCodec codec) {
        this.filename = filename != null ? filename : "";

        if (writesFile()) {
            this.name = "Save " + this.filename;
        } else {
            this.name = "Final crop of " + input.getFilename();
        }

        this.codec = codec;
        this.jpgQuality = jpgQuality;
        this.noCrop = noCrop;
        this.input = input;
        addDependency(input);

        if (alphaMask != null) {
            this.alphaMask = alphaMask;
            addDependency(alphaMask);
        }
    }

    /**
     * True unless the path is empty or the memory sentinel.
     */
    public boolean writesFile() {
        return !filename.isEmpty() && !MEMORY_PATH.equals(filename);
    }

    @Override
    protected void task() throws Exception {
        try {
            cropAndSave();
        } finally {
            // Input images can be released now, whether or not saving worked
            input = null;
            alphaMask = null;
        }
    }

    private void cropAndSave() throws Exception {
        Mat inputImg = input.img();
        if (inputImg == null || inputImg.empty()) {
            throw new IllegalStateException("No image from " + input.getName());
        }

        Mat result;
        if (noCrop) {
            // Even without cropping, the padding added for the wavelet transform is removed
            Rect area = input.validArea();
            if (area.x > 0 || area.y > 0 || area.width < inputImg.cols() || area.height < inputImg.rows()) {
                logger.verbose("%s extracting original area from padded image: x=%d, y=%d, w=%d, h=%d",
                        filename, area.x, area.y, area.width, area.height);
                result = input.extractOriginalArea(inputImg);
            } else {
                result = inputImg;
            }
        } else {
            result = input.imgCropped();
            if (result.cols() != inputImg.cols() || result.rows() != inputImg.rows()) {
                logger.verbose("%s cropped from (%d, %d) to (%d, %d)",
                        filename, inputImg.cols(), inputImg.rows(), result.cols(), result.rows());
            }
        }

        if (result.channels() == 2) {
            result = complexToRgb(result);
        }

        if (alphaMask != null) {
            result = addAlphaChannel(result);
        }

        setResult(result, new Rect(0, 0, result.cols(), result.rows()));

        if (writesFile()) {
            codec.encode(filename, result, jpgQuality);
            logger.verbose("Saved %s (%dx%d, %d channels)", filename, result.cols(), result.rows(), result.channels());
        }
    }

    /**
     * Convert a 2-channel (complex wavelet) image to a viewable 3-channel 8-bit image.
     */
    private static Mat complexToRgb(Mat complex) {
        List<Mat> channels = new ArrayList<>();
        Core.split(complex, channels);

        Mat c0 = new Mat();
        Mat c1 = new Mat();
        channels.get(0).convertTo(c0, CvType.CV_8U);
        channels.get(1).convertTo(c1, CvType.CV_8U);
        Mat c2 = Mat.zeros(complex.rows(), complex.cols(), CvType.CV_8U);

        List<Mat> rgb = new ArrayList<>();
        rgb.add(c0);
        rgb.add(c1);
        rgb.add(c2);
        Mat merged = new Mat();
        Core.merge(rgb, merged);
        return merged;
    }

    private Mat addAlphaChannel(Mat img) {
        List<Mat> channels = new ArrayList<>();
        if (img.channels() == 1) {
            channels.add(img);
            channels.add(img);
            channels.add(img);
        } else {
            List<Mat> split = new ArrayList<>();
            Core.split(img, split);
            channels.addAll(split.subList(0, Math.min(3, split.size())));
        }

        Mat alpha;
        if (noCrop) {
            Mat maskImg = alphaMask.img();
            alpha = alphaMask.hasValidArea() ? alphaMask.extractOriginalArea(maskImg) : maskImg;
        } else {
            alpha = alphaMask.imgCropped();
        }
        if (alpha == null || alpha.empty()) {
            throw new IllegalStateException("No image from alpha mask " + alphaMask.getName());
        }

        if (alpha.cols() != img.cols() || alpha.rows() != img.rows()) {
            throw new IllegalStateException(String.format("Alpha mask %s is %dx%d but image is %dx%d",
                    alphaMask.basename(), alpha.cols(), alpha.rows(), img.cols(), img.rows()));
        }

        if (alpha.channels() > 1) {
            Mat first = new Mat();
            Core.extractChannel(alpha, first, 0);
            alpha = first;
        }
        if (alpha.depth() != img.depth()) {
            Mat converted = new Mat();
            alpha.convertTo(converted, img.depth());
            alpha = converted;
        }

        // Pad out channel list for images with fewer than three channels (e.g. gray + alpha input)
        while (channels.size() < 3) {
            channels.add(channels.get(0));
        }
        channels.add(alpha);

        Mat merged = new Mat();
        Core.merge(channels, merged);
        return merged;
    }

    /**
     * Whether the input and mask tasks are still referenced.
     */
    boolean holdsInputs() {
        return input != null || alphaMask != null;
    }

    public int getJpgQuality() {
        return jpgQuality;
    }

    public boolean isNoCrop() {
        return noCrop;
    }
}
