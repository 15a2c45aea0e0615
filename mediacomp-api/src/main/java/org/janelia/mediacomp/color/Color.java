package org.janelia.mediacomp.color;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * Immutable RGB color. Every channel is clamped to [0, 255] when the color is created.
 */
public final class Color implements RGBValue {

    private static final double SCALE_FACTOR = 0.7;

    private final int red;
    private final int green;
    private final int blue;

    public Color(int red, int green, int blue) {
        this.red = clampChannel(red);
        this.green = clampChannel(green);
        this.blue = clampChannel(blue);
    }

    /**
     * Gray level color.
     */
    public static Color makeColor(int level) {
        return new Color(level, level, level);
    }

    public static Color fromRGB(int rgb) {
        return new Color((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
    }

    /**
     * Create a color from channel values on a 0.0 - 1.0 scale. Each channel is
     * scaled to 0 - 255 and rounded by adding 0.5 and truncating.
     */
    public static Color fromRGBFloat(double r, double g, double b) {
        return new Color(clampChannel(r * 255 + 0.5), clampChannel(g * 255 + 0.5), clampChannel(b * 255 + 0.5));
    }

    public static int clampChannel(long value) {
        if (value < 0) {
            return 0;
        } else if (value > 255) {
            return 255;
        } else {
            return (int) value;
        }
    }

    /**
     * Truncate the value towards zero then clamp it to [0, 255].
     */
    public static int clampChannel(double value) {
        return clampChannel((long) value);
    }

    public static int[] clamp(double r, double g, double b) {
        return new int[] {clampChannel(r), clampChannel(g), clampChannel(b)};
    }

    @Override
    public int getRed() {
        return red;
    }

    @Override
    public int getGreen() {
        return green;
    }

    @Override
    public int getBlue() {
        return blue;
    }

    @Override
    public Color getColor() {
        return this;
    }

    public double[] rgbFloat() {
        return new double[] {red / 255.0, green / 255.0, blue / 255.0};
    }

    /**
     * @return hue, saturation, value - each in [0, 1].
     */
    public double[] hsv() {
        double[] rgb = rgbFloat();
        double maxc = Math.max(rgb[0], Math.max(rgb[1], rgb[2]));
        double minc = Math.min(rgb[0], Math.min(rgb[1], rgb[2]));
        if (minc == maxc) {
            return new double[] {0., 0., maxc};
        }
        double s = (maxc - minc) / maxc;
        return new double[] {hue(rgb, maxc, minc), s, maxc};
    }

    /**
     * @return hue, lightness, saturation - each in [0, 1].
     */
    public double[] hls() {
        double[] rgb = rgbFloat();
        double maxc = Math.max(rgb[0], Math.max(rgb[1], rgb[2]));
        double minc = Math.min(rgb[0], Math.min(rgb[1], rgb[2]));
        double l = (minc + maxc) / 2.0;
        if (minc == maxc) {
            return new double[] {0., l, 0.};
        }
        double s;
        if (l <= 0.5) {
            s = (maxc - minc) / (maxc + minc);
        } else {
            s = (maxc - minc) / (2.0 - maxc - minc);
        }
        return new double[] {hue(rgb, maxc, minc), l, s};
    }

    private static double hue(double[] rgb, double maxc, double minc) {
        double span = maxc - minc;
        double rc = (maxc - rgb[0]) / span;
        double gc = (maxc - rgb[1]) / span;
        double bc = (maxc - rgb[2]) / span;
        double h;
        if (rgb[0] == maxc) {
            h = bc - gc;
        } else if (rgb[1] == maxc) {
            h = 2.0 + rc - bc;
        } else {
            h = 4.0 + gc - rc;
        }
        double normalized = (h / 6.0) % 1.0;
        return normalized < 0 ? normalized + 1.0 : normalized;
    }

    /**
     * Scales red and green by 0.7. The blue channel of the result is the scaled
     * <em>green</em> value; this legacy behavior is kept for compatibility.
     * Use {@link #darkerPerChannel()} to scale every channel independently.
     */
    public Color darker() {
        return new Color((int) (red * SCALE_FACTOR), (int) (green * SCALE_FACTOR), (int) (green * SCALE_FACTOR));
    }

    /**
     * Scales red and green by 1/0.7 with the same green-for-blue substitution as {@link #darker()}.
     */
    public Color lighter() {
        return new Color(clampChannel(red / SCALE_FACTOR), clampChannel(green / SCALE_FACTOR), clampChannel(green / SCALE_FACTOR));
    }

    public Color darkerPerChannel() {
        return scale(SCALE_FACTOR);
    }

    public Color lighterPerChannel() {
        return scale(1.0 / SCALE_FACTOR);
    }

    /**
     * Multiply every channel by the given factor, truncate and clamp the result.
     */
    public Color scale(double factor) {
        return new Color(clampChannel(red * factor), clampChannel(green * factor), clampChannel(blue * factor));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        Color color = (Color) o;

        return new EqualsBuilder()
                .append(red, color.red)
                .append(green, color.green)
                .append(blue, color.blue)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(red)
                .append(green)
                .append(blue)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("r", red)
                .append("g", green)
                .append("b", blue)
                .toString();
    }
}
