package org.janelia.mediacomp.image;

@FunctionalInterface
public interface PixelPredicate {

    boolean test(PixelInfo pixel);

    default PixelPredicate negate() {
        return (PixelInfo pixel) -> !test(pixel);
    }
}
