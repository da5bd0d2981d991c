package com.ttennebkram.focusstack.processing;

/**
 * Computes how many wavelet levels an image gets and the minimum buffer size that supports them.
 */
@FunctionalInterface
public interface WaveletSizer {

    /**
     * @param width original image width
     * @param height original image height
     * @return decomposition depth and the (possibly larger) compatible buffer size
     */
    WaveletLevels levelsForSize(int width, int height);
}
