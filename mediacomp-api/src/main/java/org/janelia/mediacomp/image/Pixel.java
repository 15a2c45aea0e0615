package org.janelia.mediacomp.image;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.janelia.mediacomp.MediaPreconditions;
import org.janelia.mediacomp.color.Color;
import org.janelia.mediacomp.color.RGBValue;

/**
 * Live view of one pixel of a picture. Reads return the current value stored in the picture
 * and writes go straight to the picture's pixel store. A pixel only borrows the picture's storage,
 * so it must not be used once the picture is discarded.
 */
public class Pixel implements RGBValue {

    private final int x;
    private final int y;
    private final RandomAccess<ARGBType> pixelAccess;

    /**
     * The coordinates are clamped to the image extent.
     */
    Pixel(Img<ARGBType> img, long x, long y) {
        this.x = (int) CoordUtils.clamp(x, 0, img.max(0));
        this.y = (int) CoordUtils.clamp(y, 0, img.max(1));
        this.pixelAccess = img.randomAccess();
        this.pixelAccess.setPosition(this.x, 0);
        this.pixelAccess.setPosition(this.y, 1);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public int getRGB() {
        return pixelAccess.get().get();
    }

    @Override
    public int getRed() {
        return ARGBType.red(getRGB());
    }

    @Override
    public int getGreen() {
        return ARGBType.green(getRGB());
    }

    @Override
    public int getBlue() {
        return ARGBType.blue(getRGB());
    }

    @Override
    public Color getColor() {
        return Color.fromRGB(getRGB());
    }

    public void setColor(RGBValue color) {
        MediaPreconditions.checkType(color, "Pixel.setColor", "color", "Color");
        setRGB(color.getRed(), color.getGreen(), color.getBlue());
    }

    public void setRed(int red) {
        int rgb = getRGB();
        setRGB(Color.clampChannel(red), ARGBType.green(rgb), ARGBType.blue(rgb));
    }

    public void setGreen(int green) {
        int rgb = getRGB();
        setRGB(ARGBType.red(rgb), Color.clampChannel(green), ARGBType.blue(rgb));
    }

    public void setBlue(int blue) {
        int rgb = getRGB();
        setRGB(ARGBType.red(rgb), ARGBType.green(rgb), Color.clampChannel(blue));
    }

    /**
     * @return a detached snapshot of the pixel's current location and color.
     */
    public PixelInfo snapshot() {
        return new PixelInfo(x, y, getRGB());
    }

    private void setRGB(int r, int g, int b) {
        pixelAccess.get().set(ARGBType.rgba(r, g, b, 0xff));
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("x", x)
                .append("y", y)
                .append("color", getColor())
                .toString();
    }
}
