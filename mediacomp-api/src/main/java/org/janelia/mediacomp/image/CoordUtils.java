package org.janelia.mediacomp.image;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;

public class CoordUtils {

    public static long clamp(long v, long min, long max) {
        return Math.max(min, Math.min(max, v));
    }

    public static boolean contains(Interval interval, long x, long y) {
        return x >= interval.min(0) && x <= interval.max(0) && y >= interval.min(1) && y <= interval.max(1);
    }

    /**
     * Build the region <code>[left, right) x [top, bottom)</code> clipped to the given image interval.
     * Inverted bounds are swapped first.
     *
     * @return the clipped region or null if nothing is left after clipping.
     */
    public static Interval clipRegion(Interval imageInterval, long left, long top, long right, long bottom) {
        long minX = Math.max(Math.min(left, right), imageInterval.min(0));
        long maxX = Math.min(Math.max(left, right) - 1, imageInterval.max(0));
        long minY = Math.max(Math.min(top, bottom), imageInterval.min(1));
        long maxY = Math.min(Math.max(top, bottom) - 1, imageInterval.max(1));
        if (minX > maxX || minY > maxY) {
            // there is no intersection
            return null;
        }
        return new FinalInterval(new long[] {minX, minY}, new long[] {maxX, maxY});
    }
}
