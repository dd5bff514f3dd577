package com.project.image.differences;

import com.project.image.differences.DTOs.Region;
import com.project.image.differences.service.RegionMerger;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RegionMergerTest {
    private final RegionMerger merger = new RegionMerger();

    @Test
    void nearbyRegions_areUnited() {
        Region a = new Region(0, 9, 0, 9, 100);
        Region b = new Region(15, 24, 0, 9, 100);   // gap 6 on x

        assertThat(merger.merge(List.of(a, b), 10)).containsExactly(new Region(0, 24, 0, 9, 200));
        assertThat(merger.merge(List.of(a, b), 6)).containsExactly(a, b);
    }

    @Test
    void gapIsDiagonalDistanceBetweenBoxes() {
        Region a = new Region(0, 9, 0, 9, 50);
        Region b = new Region(13, 20, 13, 20, 50);  // dx = dy = 4, gap ~5.66

        assertThat(merger.merge(List.of(a, b), 5.6)).hasSize(2);
        assertThat(merger.merge(List.of(a, b), 5.7)).hasSize(1);
    }

    @Test
    void growthEnablesChainedMergesInLaterPasses() {
        Region left = new Region(0, 9, 0, 9, 100);
        Region far = new Region(40, 49, 0, 9, 100);
        Region middle = new Region(18, 29, 0, 9, 120);

        // far is only in reach once middle has joined left
        List<Region> merged = merger.merge(List.of(left, far, middle), 12);

        assertThat(merged).containsExactly(new Region(0, 49, 0, 9, 320));
    }

    @Test
    void inputListIsNotModified() {
        List<Region> input = new ArrayList<>(List.of(new Region(0, 1, 0, 1, 4), new Region(2, 3, 2, 3, 4)));

        merger.merge(input, 5);

        assertThat(input).hasSize(2);
    }

    @Test
    void mergingIsAFixpoint() {
        Random rnd = new Random(42);
        List<Region> regions = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            int x = rnd.nextInt(500), y = rnd.nextInt(500);
            int w = 1 + rnd.nextInt(20), h = 1 + rnd.nextInt(20);
            regions.add(new Region(x, x + w, y, y + h, 1 + rnd.nextInt(w * h)));
        }

        List<Region> once = merger.merge(regions, 15);
        List<Region> twice = merger.merge(once, 15);

        assertThat(twice).isEqualTo(once);
        assertThat(once.size()).isLessThan(regions.size());
        assertThat(once.stream().mapToInt(Region::size).sum())
                .isEqualTo(regions.stream().mapToInt(Region::size).sum());
    }
}
