package com.project.image.differences;

import com.project.image.differences.DTOs.DiffMap;
import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.exceptions.AnalysisError;
import com.project.image.differences.exceptions.DifferenceAnalysisException;
import com.project.image.differences.service.DiffMapBuilder;
import com.project.image.differences.service.GaussianSmoother;
import org.junit.jupiter.api.Test;

import static com.project.image.differences.TestImages.GRAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiffMapBuilderTest {
    private final DiffMapBuilder builder = new DiffMapBuilder(new GaussianSmoother());

    @Test
    void compare_marksOnlyPixelsAboveThreshold() {
        PixelBuffer a = TestImages.solid(4, 4, GRAY);
        PixelBuffer b = TestImages.withRect(a, 1, 1, 1, 1, new int[]{138, 128, 128}); // distance 10
        b = TestImages.withRect(b, 2, 2, 2, 2, new int[]{148, 128, 128});             // distance 20

        DiffMap map = builder.compare(a, b, 10);

        assertThat(map.differencePixelCount()).isEqualTo(1);
        assertThat(map.mask()[2 * 4 + 2]).isTrue();
        assertThat(map.mask()[4 + 1]).isFalse();
    }

    @Test
    void compare_ignoresAlpha() {
        PixelBuffer a = TestImages.solid(3, 3, GRAY);
        byte[] rgba = a.rgba().clone();
        for (int i = 3; i < rgba.length; i += 4) rgba[i] = 0;
        PixelBuffer transparent = new PixelBuffer(3, 3, rgba);

        assertThat(builder.compare(a, transparent, 0).isEmpty()).isTrue();
    }

    @Test
    void build_raisingThresholdNeverAddsPixels() {
        PixelBuffer a = TestImages.noise(60, 40, 11L);
        PixelBuffer b = TestImages.noise(60, 40, 12L);

        int previous = Integer.MAX_VALUE;
        for (int threshold = 0; threshold <= 450; threshold += 15) {
            int count = builder.build(a, b, 1, threshold).differencePixelCount();
            assertThat(count).isLessThanOrEqualTo(previous);
            previous = count;
        }
        assertThat(previous).isZero();
    }

    @Test
    void build_doesNotModifyInputs() {
        PixelBuffer a = TestImages.noise(20, 20, 5L);
        byte[] before = a.rgba().clone();

        builder.build(a, TestImages.solid(20, 20, GRAY), 2, 30);

        assertThat(a.rgba()).isEqualTo(before);
    }

    @Test
    void build_rejectsMismatchedDimensions() {
        assertThatThrownBy(() -> builder.build(
                TestImages.solid(10, 10, GRAY), TestImages.solid(11, 10, GRAY), 1, 40))
                .isInstanceOf(DifferenceAnalysisException.class)
                .extracting(e -> ((DifferenceAnalysisException) e).getError())
                .isEqualTo(AnalysisError.DIMENSION_MISMATCH);
    }

    @Test
    void buffersAndMaps_compareByContent() {
        PixelBuffer a = TestImages.solid(5, 5, GRAY);
        PixelBuffer copy = new PixelBuffer(5, 5, a.rgba().clone());
        PixelBuffer other = TestImages.withRect(a, 2, 2, 2, 2, new int[]{0, 0, 0});

        assertThat(copy).isEqualTo(a).hasSameHashCodeAs(a);
        assertThat(other).isNotEqualTo(a);
        assertThat(builder.compare(a, other, 40)).isEqualTo(builder.compare(copy, other, 40));
        assertThat(builder.compare(a, other, 40)).isNotEqualTo(builder.compare(a, copy, 40));
    }
}
