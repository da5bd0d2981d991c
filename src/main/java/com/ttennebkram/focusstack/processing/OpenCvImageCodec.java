package com.ttennebkram.focusstack.processing;

import org.opencv.core.Mat;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;

/**
 * Image codec backed by OpenCV's imgcodecs module.
 * Images are read with their original channel count (IMREAD_ANYCOLOR).
 */
public class OpenCvImageCodec implements ImageCodec {

    @Override
    public Mat decode(String path) {
        Mat img = Imgcodecs.imread(path, Imgcodecs.IMREAD_ANYCOLOR);
        return img != null ? img : new Mat();
    }

    @Override
    public void encode(String path, Mat img, int quality) throws IOException {
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        boolean written;
        try {
            written = Imgcodecs.imwrite(path, img, params);
        } finally {
            params.release();
        }
        if (!written) {
            throw new IOException("Could not write " + path);
        }
    }
}
