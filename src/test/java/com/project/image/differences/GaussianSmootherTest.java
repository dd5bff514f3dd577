package com.project.image.differences;

import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.service.GaussianSmoother;
import org.junit.jupiter.api.Test;

import static com.project.image.differences.TestImages.GRAY;
import static com.project.image.differences.TestImages.RED;
import static org.assertj.core.api.Assertions.assertThat;

class GaussianSmootherTest {
    private final GaussianSmoother smoother = new GaussianSmoother();

    @Test
    void zeroRadius_returnsInput() {
        PixelBuffer img = TestImages.noise(8, 8, 1L);
        assertThat(smoother.smooth(img, 0)).isSameAs(img);
    }

    @Test
    void uniformImage_staysUniform() {
        PixelBuffer gray = TestImages.solid(16, 9, GRAY);
        assertThat(smoother.smooth(gray, 3).rgba()).isEqualTo(gray.rgba());
    }

    @Test
    void sharpEdge_isSoftenedSymmetrically() {
        PixelBuffer img = TestImages.withRect(TestImages.solid(21, 21, GRAY), 10, 10, 10, 10, RED);

        PixelBuffer out = smoother.smooth(img, 1);

        int centre = 10 * 21 + 10;
        assertThat(out.red(centre)).isLessThan(255).isGreaterThan(128);
        assertThat(out.red(centre - 1)).isEqualTo(out.red(centre + 1));
        assertThat(out.red(centre - 21)).isEqualTo(out.red(centre + 21));
        assertThat(out.red(centre - 1)).isGreaterThan(128);
        assertThat(out.red(0)).isEqualTo(128);
    }

    @Test
    void alphaIsPreservedAndInputUntouched() {
        PixelBuffer img = TestImages.noise(12, 12, 4L);
        byte[] before = img.rgba().clone();

        PixelBuffer out = smoother.smooth(img, 2);

        assertThat(img.rgba()).isEqualTo(before);
        for (int i = 0; i < out.pixelCount(); i++) {
            assertThat(out.alpha(i)).isEqualTo(img.alpha(i));
        }
    }
}
