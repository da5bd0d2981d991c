package com.ttennebkram.focusstack.processing;

/**
 * Default wavelet sizing: each level halves the image, so the buffer must be a multiple
 * of 2^levels in both directions. Levels are added while the coarsest level keeps at least
 * {@code minCoarseSize} pixels along the shorter side.
 */
public class DyadicWaveletSizer implements WaveletSizer {

    public static final int DEFAULT_MAX_LEVELS = 10;
    public static final int DEFAULT_MIN_COARSE_SIZE = 8;

    private final int maxLevels;
    private final int minCoarseSize;

    public DyadicWaveletSizer() {
        this(DEFAULT_MAX_LEVELS, DEFAULT_MIN_COARSE_SIZE);
    }

    public DyadicWaveletSizer(int maxLevels, int minCoarseSize) {
        if (maxLevels < 1 || minCoarseSize < 1) {
            throw new IllegalArgumentException("maxLevels and minCoarseSize must be positive");
        }
        this.maxLevels = maxLevels;
        this.minCoarseSize = minCoarseSize;
    }

    @Override
    public WaveletLevels levelsForSize(int width, int height) {
        int minDimension = Math.min(width, height);

        int levels = 1;
        while (levels < maxLevels && (minDimension >> (levels + 1)) >= minCoarseSize) {
            levels++;
        }

        int divider = 1 << levels;
        int expandedWidth = roundUp(width, divider);
        int expandedHeight = roundUp(height, divider);
        return new WaveletLevels(levels, expandedWidth, expandedHeight);
    }

    private static int roundUp(int value, int multiple) {
        return ((value + multiple - 1) / multiple) * multiple;
    }
}
