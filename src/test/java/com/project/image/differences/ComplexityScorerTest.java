package com.project.image.differences;

import com.project.image.differences.DTOs.PixelBuffer;
import com.project.image.differences.service.ComplexityScorer;
import org.junit.jupiter.api.Test;

import static com.project.image.differences.TestImages.GRAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ComplexityScorerTest {
    private final ComplexityScorer scorer = new ComplexityScorer();

    @Test
    void flatImage_scoresZero() {
        assertThat(scorer.score(TestImages.solid(40, 30, GRAY))).isZero();
    }

    @Test
    void stripes_makeEveryInteriorPixelAnEdge() {
        PixelBuffer img = TestImages.solid(10, 10, new int[]{0, 0, 0});
        for (int x = 0; x < 10; x += 2) {
            img = TestImages.withRect(img, x, 0, x, 9, new int[]{255, 255, 255});
        }

        assertThat(scorer.score(img)).isEqualTo(1.0);
    }

    @Test
    void singleVerticalStep_countsOneInteriorColumn() {
        // columns 0..4 black, 5..9 white: only interior pixels at x = 4 see a jump to the right
        PixelBuffer img = TestImages.withRect(TestImages.solid(10, 10, new int[]{0, 0, 0}),
                5, 0, 9, 9, new int[]{255, 255, 255});

        assertThat(scorer.score(img)).isCloseTo(8.0 / 64.0, within(1e-12));
    }

    @Test
    void smallStepsBelowThreshold_areIgnored() {
        PixelBuffer img = TestImages.withRect(TestImages.solid(10, 10, new int[]{100, 100, 100}),
                5, 0, 9, 9, new int[]{125, 125, 125});

        assertThat(scorer.score(img)).isZero();
    }

    @Test
    void imagesWithoutInterior_scoreZero() {
        assertThat(scorer.score(TestImages.noise(2, 50, 1L))).isZero();
    }
}
