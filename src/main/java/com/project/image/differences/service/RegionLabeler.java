package com.project.image.differences.service;

import com.project.image.differences.DTOs.DiffMap;
import com.project.image.differences.DTOs.Region;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a difference mask into 8-connected components. Regions are returned in the order
 * their first pixel is met by a raster scan.
 */
public class RegionLabeler {

    private static final int[] DX = {1, -1, 0, 0, 1, -1, 1, -1};
    private static final int[] DY = {0, 0, 1, -1, 1, -1, -1, 1};

    public List<Region> label(DiffMap map) {
        final int w = map.width(), h = map.height();
        final boolean[] mask = map.mask();
        boolean[] visited = new boolean[w * h];
        // one shared stack of linear indices; never holds more than w * h entries
        int[] stack = new int[Math.max(1, Math.min(w * h, 1024))];
        List<Region> regions = new ArrayList<>();

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!mask[idx] || visited[idx]) continue;

                stack = floodFill(mask, visited, stack, w, h, idx, regions);
            }
        }
        return regions;
    }

    private static int[] floodFill(boolean[] mask, boolean[] visited, int[] stack,
                                   int w, int h, int seed, List<Region> out) {
        int top = 0;
        stack[top++] = seed;
        visited[seed] = true;

        int minX = seed % w, maxX = minX;
        int minY = seed / w, maxY = minY;
        int size = 0;

        while (top > 0) {
            int idx = stack[--top];
            int px = idx % w, py = idx / w;
            size++;
            if (px < minX) minX = px;
            if (px > maxX) maxX = px;
            if (py < minY) minY = py;
            if (py > maxY) maxY = py;

            for (int d = 0; d < DX.length; d++) {
                int nx = px + DX[d];
                int ny = py + DY[d];
                if (nx < 0 || nx >= w || ny < 0 || ny >= h) continue;

                int nIdx = ny * w + nx;
                if (mask[nIdx] && !visited[nIdx]) {
                    visited[nIdx] = true;
                    if (top == stack.length) {
                        stack = Arrays.copyOf(stack, Math.min(w * h, stack.length * 2));
                    }
                    stack[top++] = nIdx;
                }
            }
        }
        out.add(new Region(minX, maxX, minY, maxY, size));
        return stack;
    }
}
