package com.ttennebkram.focusstack.processing;

/**
 * Wavelet decomposition depth for an image, and the buffer size the transform needs at that depth.
 */
public class WaveletLevels {
    private final int levels;
    private final int expandedWidth;
    private final int expandedHeight;

    public WaveletLevels(int levels, int expandedWidth, int expandedHeight) {
        this.levels = levels;
        this.expandedWidth = expandedWidth;
        this.expandedHeight = expandedHeight;
    }

    public int getLevels() {
        return levels;
    }

    public int getExpandedWidth() {
        return expandedWidth;
    }

    public int getExpandedHeight() {
        return expandedHeight;
    }
}
