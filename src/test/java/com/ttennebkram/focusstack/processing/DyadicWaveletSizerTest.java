package com.ttennebkram.focusstack.processing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DyadicWaveletSizerTest {

    private final DyadicWaveletSizer sizer = new DyadicWaveletSizer();

    @Test
    void alignedImageNeedsNoPadding() {
        WaveletLevels sizing = sizer.levelsForSize(1024, 768);

        assertEquals(6, sizing.getLevels());
        assertEquals(1024, sizing.getExpandedWidth());
        assertEquals(768, sizing.getExpandedHeight());
    }

    @Test
    void roundsUpToMultipleOfLevelSize() {
        WaveletLevels sizing = sizer.levelsForSize(1000, 700);

        assertEquals(6, sizing.getLevels());
        assertEquals(1024, sizing.getExpandedWidth());
        assertEquals(704, sizing.getExpandedHeight());
    }

    @Test
    void smallImageGetsSingleLevel() {
        WaveletLevels square = sizer.levelsForSize(20, 20);
        assertEquals(1, square.getLevels());
        assertEquals(20, square.getExpandedWidth());
        assertEquals(20, square.getExpandedHeight());

        WaveletLevels odd = sizer.levelsForSize(21, 15);
        assertEquals(1, odd.getLevels());
        assertEquals(22, odd.getExpandedWidth());
        assertEquals(16, odd.getExpandedHeight());
    }

    @Test
    void levelsAreCapped() {
        WaveletLevels sizing = new DyadicWaveletSizer(3, 8).levelsForSize(4000, 3000);

        assertEquals(3, sizing.getLevels());
        assertEquals(4000, sizing.getExpandedWidth());
        assertEquals(3000, sizing.getExpandedHeight());
    }

    @Test
    void expandedSizeNeverShrinks() {
        for (int w = 1; w < 300; w += 7) {
            for (int h = 1; h < 300; h += 11) {
                WaveletLevels sizing = sizer.levelsForSize(w, h);
                int multiple = 1 << sizing.getLevels();
                assertTrue(sizing.getExpandedWidth() >= w);
                assertTrue(sizing.getExpandedHeight() >= h);
                assertEquals(0, sizing.getExpandedWidth() % multiple);
                assertEquals(0, sizing.getExpandedHeight() % multiple);
            }
        }
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new DyadicWaveletSizer(0, 8));
        assertThrows(IllegalArgumentException.class, () -> new DyadicWaveletSizer(10, 0));
    }
}
