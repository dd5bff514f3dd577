package com.project.image.differences;

import com.project.image.differences.DTOs.AnalysisParams;
import com.project.image.differences.DTOs.Difference;
import com.project.image.differences.DTOs.Region;
import com.project.image.differences.service.CircleResolver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CircleResolverTest {
    private final CircleResolver resolver = new CircleResolver();
    private final AnalysisParams params = new AnalysisParams(1, 40, 10, 5, 0.2, 0.1, 10, 0.4, 1.0);

    @Test
    void circleIsBoxMidpointWithPaddedRadius() {
        List<Difference> diffs = resolver.resolve(
                List.of(new Region(10, 30, 20, 30, 100)), params.withCircleRadiusMultiplier(1.5), 200, 100);

        assertThat(diffs).hasSize(1);
        Difference d = diffs.get(0);
        assertThat(d.x()).isCloseTo(20.0 / 200, within(1e-12));
        assertThat(d.y()).isCloseTo(25.0 / 100, within(1e-12));
        assertThat(d.radius()).isCloseTo(10 * 1.5 / 100, within(1e-12));
    }

    @Test
    void largerCircleWinsOverOverlappingSmallerOne() {
        Region small = new Region(25, 31, 25, 31, 40);
        Region big = new Region(10, 30, 10, 30, 300);

        List<Difference> diffs = resolver.resolve(List.of(small, big), params, 100, 100);

        assertThat(diffs).hasSize(1);
        assertThat(diffs.get(0).id()).isZero();
        assertThat(diffs.get(0).x()).isCloseTo(0.20, within(1e-12));
    }

    @Test
    void touchingCircles_doNotCountAsOverlapping() {
        Region a = new Region(0, 10, 0, 10, 50);    // centre 5, radius 5
        Region b = new Region(10, 20, 0, 10, 50);   // centre 15, radius 5

        assertThat(resolver.resolve(List.of(a, b), params, 100, 100)).hasSize(2);
    }

    @Test
    void output_isSortedByRadiusAndReindexed() {
        Region r1 = new Region(0, 4, 0, 4, 20);
        Region r2 = new Region(50, 70, 50, 70, 200);
        Region r3 = new Region(0, 10, 80, 90, 80);

        List<Difference> diffs = resolver.resolve(List.of(r1, r2, r3), params, 100, 100);

        assertThat(diffs).extracting(Difference::id).containsExactly(0, 1, 2);
        assertThat(diffs).extracting(Difference::radius).containsExactly(0.10, 0.05, 0.02);
    }

    @Test
    void oversizedRegions_areDropped() {
        Region wide = new Region(0, 45, 0, 5, 200);    // spans 45% of the shorter side
        Region fine = new Region(60, 80, 60, 80, 200);

        List<Difference> diffs = resolver.resolve(List.of(wide, fine), params, 100, 100);

        assertThat(diffs).hasSize(1);
        assertThat(diffs.get(0).x()).isCloseTo(0.70, within(1e-12));
    }

    @Test
    void singlePixelRegions_produceNoClickTarget() {
        assertThat(resolver.resolve(List.of(new Region(5, 5, 5, 5, 1)), params, 10, 10)).isEmpty();
    }

    @Test
    void regionAtSizeCap_isKept() {
        Region atCap = new Region(0, 40, 0, 10, 200);  // span 40 of 100, equal to 0.4

        List<Difference> diffs = resolver.resolve(List.of(atCap), params, 100, 100);

        assertThat(diffs).hasSize(1);
        assertThat(diffs.get(0).radius()).isCloseTo(0.20, within(1e-12));
    }
}
