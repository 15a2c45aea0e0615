package org.janelia.mediacomp.image;

import org.janelia.mediacomp.color.Color;

/**
 * Computes a color from the pixels found at the same location in two pictures.
 */
@FunctionalInterface
public interface PixelCombiner {
    Color combine(PixelInfo pixel, PixelInfo otherPixel);
}
