package org.janelia.mediacomp.image;

/**
 * Maps a source pixel to the location and color it should have in the remapped picture.
 * The returned location is not required to be inside the picture - it wraps around.
 */
@FunctionalInterface
public interface PixelRemapper {

    PixelInfo remap(PixelInfo sourcePixel);

    static PixelRemapper identity() { return p -> p; }
}
