package com.project.image.differences.service;

import com.project.image.differences.DTOs.Region;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins regions whose bounding boxes lie closer than the merge distance. Passes repeat until
 * one completes without a merge, so the output is stable under a second run.
 */
public class RegionMerger {

    public List<Region> merge(List<Region> regions, double mergeDistance) {
        List<Region> current = new ArrayList<>(regions);
        if (current.size() < 2) return current;

        boolean mergedInPass = true;
        while (mergedInPass) {
            mergedInPass = false;
            int n = current.size();
            boolean[] absorbed = new boolean[n];
            List<Region> next = new ArrayList<>(n);

            for (int i = 0; i < n; i++) {
                if (absorbed[i]) continue;
                Region acc = current.get(i);
                for (int j = i + 1; j < n; j++) {
                    if (absorbed[j]) continue;
                    Region other = current.get(j);
                    if (acc.gapTo(other) < mergeDistance) {
                        acc = acc.union(other);
                        absorbed[j] = true;
                        mergedInPass = true;
                    }
                }
                next.add(acc);
            }
            current = next;
        }
        return current;
    }
}
