package com.project.image.differences.service;

import com.project.image.differences.DTOs.AnalysisParams;
import com.project.image.differences.DTOs.Circle;
import com.project.image.differences.DTOs.Difference;
import com.project.image.differences.DTOs.Region;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns merged regions into non-overlapping, normalized click targets. Larger circles are
 * placed first and a smaller circle is only kept if it does not overlap any placed one.
 */
public class CircleResolver {

    public List<Difference> resolve(List<Region> regions, AnalysisParams params, int width, int height) {
        final int minDim = Math.min(width, height);

        List<Circle> circles = new ArrayList<>(regions.size());
        for (Region region : regions) {
            if (isOversized(region, params, minDim)) continue;

            Circle circle = toCircle(region, params.circleRadiusMultiplier());
            // a single-pixel span has no clickable area
            if (circle.radius() > 0) circles.add(circle);
        }

        circles.sort(Comparator.comparingDouble(Circle::radius).reversed());

        List<Circle> kept = new ArrayList<>();
        for (Circle circle : circles) {
            boolean overlaps = false;
            for (Circle existing : kept) {
                if (circle.overlaps(existing)) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) kept.add(circle);
        }

        List<Difference> differences = new ArrayList<>(kept.size());
        for (int i = 0; i < kept.size(); i++) {
            Circle c = kept.get(i);
            differences.add(new Difference(i, c.x() / width, c.y() / height, c.radius() / minDim));
        }
        return differences;
    }

    /** Box spans are measured between the outermost pixel centres. */
    static boolean isOversized(Region region, AnalysisParams params, int minDim) {
        double spanX = (region.maxX() - region.minX()) / (double) minDim;
        double spanY = (region.maxY() - region.minY()) / (double) minDim;
        return spanX > params.maxRegionSizePercent() || spanY > params.maxRegionSizePercent();
    }

    static Circle toCircle(Region region, double radiusMultiplier) {
        double cx = (region.minX() + region.maxX()) / 2.0;
        double cy = (region.minY() + region.maxY()) / 2.0;
        double rx = (region.maxX() - region.minX()) / 2.0;
        double ry = (region.maxY() - region.minY()) / 2.0;
        return new Circle(cx, cy, Math.max(rx, ry) * radiusMultiplier);
    }
}
