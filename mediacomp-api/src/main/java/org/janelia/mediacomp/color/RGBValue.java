package org.janelia.mediacomp.color;

import org.janelia.mediacomp.MediaPreconditions;

/**
 * Anything that exposes an 8 bit red, green and blue value - a color,
 * a pixel snapshot or a live pixel.
 */
public interface RGBValue {
    int getRed();

    int getGreen();

    int getBlue();

    /**
     * @return the color value itself, detached from wherever it was read.
     */
    Color getColor();

    /**
     * @return the packed 0xAARRGGBB value with an opaque alpha.
     */
    default int getRGB() {
        return 0xff000000 | (getRed() << 16) | (getGreen() << 8) | getBlue();
    }

    default boolean isBlack() {
        return getRed() == 0 && getGreen() == 0 && getBlue() == 0;
    }

    /**
     * Euclidean distance between this value and another one, taking the channels
     * as coordinates in a 3D space.
     *
     * @param other
     * @return
     */
    default double distance(RGBValue other) {
        MediaPreconditions.checkType(other, "distance", "color", "Color");
        double dr = (double) getRed() - other.getRed();
        double dg = (double) getGreen() - other.getGreen();
        double db = (double) getBlue() - other.getBlue();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
