package org.janelia.mediacomp.image;

import org.janelia.mediacomp.color.Color;

/**
 * Computes the new color of a pixel from a snapshot of it.
 */
@FunctionalInterface
public interface PixelTransform {

    Color apply(PixelInfo pixel);

    /**
     * Chain the transformations: the result of this one is fed, at the same location, to <code>after</code>.
     */
    default PixelTransform andThen(PixelTransform after) {
        return (PixelInfo pixel) -> after.apply(pixel.withColor(apply(pixel)));
    }

    static PixelTransform identity() { return PixelInfo::getColor; }
}
