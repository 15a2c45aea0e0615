package org.janelia.mediacomp.image;

import java.util.Arrays;

/**
 * Maps a position in the scaled image to the position it was sampled from, so that
 * a nearest neighbor resize can read the source directly.
 */
public class ScaleTransform implements GeomTransform {
    private final long[] sourceShape;
    private final long[] targetShape;

    public ScaleTransform(long[] sourceShape, long[] targetShape) {
        assert sourceShape.length == targetShape.length;
        this.sourceShape = Arrays.copyOf(sourceShape, sourceShape.length);
        this.targetShape = Arrays.copyOf(targetShape, targetShape.length);
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        for (int d = 0; d < sourceShape.length; d++) {
            long pos = (long) ((double) currentPos[d] * sourceShape[d] / targetShape[d]);
            originPos[d] = CoordUtils.clamp(pos, 0, sourceShape[d] - 1);
        }
    }
}
