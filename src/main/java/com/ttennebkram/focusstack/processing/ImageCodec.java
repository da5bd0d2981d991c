package com.ttennebkram.focusstack.processing;

import org.opencv.core.Mat;

import java.io.IOException;

/**
 * Reads and writes image files. Implementations may block for a long time.
 */
public interface ImageCodec {

    /**
     * Decode an image file.
     *
     * @param path file to read
     * @return the decoded image, or an empty Mat if the file is missing or not a valid image
     */
    Mat decode(String path);

    /**
     * Encode an image to a file. The format follows the file extension.
     *
     * @param path file to write
     * @param img image to write (caller keeps ownership)
     * @param quality JPEG quality 0-100, ignored by lossless formats
     * @throws IOException if the image could not be written
     */
    void encode(String path, Mat img, int quality) throws IOException;
}
