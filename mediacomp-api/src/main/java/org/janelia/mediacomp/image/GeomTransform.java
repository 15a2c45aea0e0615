package org.janelia.mediacomp.image;

/**
 * This type of Geometric transformation preserves dimensionality.
 */
public interface GeomTransform {
    void apply(long[] currentPos, long[] originPos);
}
