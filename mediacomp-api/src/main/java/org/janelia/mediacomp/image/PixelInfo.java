package org.janelia.mediacomp.image;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.janelia.mediacomp.MediaPreconditions;
import org.janelia.mediacomp.color.Color;
import org.janelia.mediacomp.color.RGBValue;

/**
 * Read-only snapshot of a pixel: its coordinates and the color it had when the
 * snapshot was taken. It holds no reference to the picture, so it never changes
 * even if the picture is modified afterwards.
 */
public final class PixelInfo implements RGBValue {

    private final int x;
    private final int y;
    private final Color color;

    public PixelInfo(int x, int y, Color color) {
        this.x = x;
        this.y = y;
        this.color = MediaPreconditions.checkType(color, "PixelInfo", "color", "Color");
    }

    PixelInfo(int x, int y, int rgb) {
        this(x, y, Color.fromRGB(rgb));
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public Color getColor() {
        return color;
    }

    @Override
    public int getRed() {
        return color.getRed();
    }

    @Override
    public int getGreen() {
        return color.getGreen();
    }

    @Override
    public int getBlue() {
        return color.getBlue();
    }

    /**
     * @return a snapshot at the same location with a different color.
     */
    public PixelInfo withColor(Color newColor) {
        return new PixelInfo(x, y, newColor);
    }

    /**
     * @return a snapshot of the same color at a different location.
     */
    public PixelInfo withLocation(int newX, int newY) {
        return new PixelInfo(newX, newY, color);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        PixelInfo that = (PixelInfo) o;

        return new EqualsBuilder()
                .append(x, that.x)
                .append(y, that.y)
                .append(color, that.color)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(x)
                .append(y)
                .append(color)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("x", x)
                .append("y", y)
                .append("color", color)
                .toString();
    }
}
