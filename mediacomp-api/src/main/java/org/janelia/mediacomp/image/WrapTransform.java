package org.janelia.mediacomp.image;

import java.util.Arrays;

/**
 * Wraps any position back into <code>[0, shape)</code> along every axis.
 */
public class WrapTransform implements GeomTransform {
    private final long[] shape;

    public WrapTransform(long[] shape) {
        this.shape = Arrays.copyOf(shape, shape.length);
    }

    @Override
    public void apply(long[] currentPos, long[] originPos) {
        for (int d = 0; d < shape.length; d++) {
            originPos[d] = Math.floorMod(currentPos[d], shape[d]);
        }
    }
}
