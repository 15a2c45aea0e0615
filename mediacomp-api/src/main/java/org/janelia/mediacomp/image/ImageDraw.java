package org.janelia.mediacomp.image;

import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.ARGBType;

public class ImageDraw {

    /**
     * Draw a one pixel wide line between the two end points, both included.
     * The line is stepped along its dominant axis; only the steps that can land
     * inside the <code>w x h</code> image are visited, so the cost does not depend
     * on how far the end points are outside the image.
     */
    public static <T extends Type<T>> void draw2dLine(RandomAccess<T> img,
                                                      int w, int h,
                                                      long x1, long y1,
                                                      long x2, long y2,
                                                      T value) {
        long a = Math.abs(x2 - x1), b = Math.abs(y2 - y1);
        if (a >= b) {
            drawAlongMajorAxis(img, w, h, x1, y1, x2, y2, false, value);
        } else {
            drawAlongMajorAxis(img, h, w, y1, x1, y2, x2, true, value);
        }
    }

    private static <T extends Type<T>> void drawAlongMajorAxis(RandomAccess<T> img,
                                                               long majorSize, long minorSize,
                                                               long major1, long minor1,
                                                               long major2, long minor2,
                                                               boolean swapAxes,
                                                               T value) {
        long steps = Math.abs(major2 - major1);
        int sign = major2 >= major1 ? 1 : -1;
        double slope = steps == 0 ? 0. : (double) (minor2 - minor1) / steps;

        // steps for which the major coordinate is inside the image
        long first;
        long last;
        if (sign > 0) {
            first = -major1;
            last = majorSize - 1 - major1;
        } else {
            first = major1 - (majorSize - 1);
            last = major1;
        }
        first = Math.max(first, 0);
        last = Math.min(last, steps);

        // narrow them to the steps for which the rounded minor coordinate can be inside the image
        if (slope != 0) {
            double t1 = (-0.5 - minor1) / slope;
            double t2 = (minorSize - 0.5 - minor1) / slope;
            first = Math.max(first, (long) Math.floor(Math.min(t1, t2)) - 1);
            last = Math.min(last, (long) Math.ceil(Math.max(t1, t2)) + 1);
        } else if (minor1 < 0 || minor1 >= minorSize) {
            return;
        }

        for (long i = first; i <= last; i++) {
            long major = major1 + i * sign;
            long minor = Math.round(minor1 + slope * i);
            if (major >= 0 && major < majorSize && minor >= 0 && minor < minorSize) {
                if (swapAxes) {
                    img.setPositionAndGet(minor, major).set(value);
                } else {
                    img.setPositionAndGet(major, minor).set(value);
                }
            }
        }
    }

    /**
     * Render the text with its top left corner at (x, y). Text is drawn without anti-aliasing
     * so every touched pixel gets exactly the given color; the part outside the image is clipped.
     */
    public static void drawText(ArrayImg<ARGBType, IntArray> img, int x, int y, String text, Font font, int rgb) {
        int w = (int) img.dimension(0);
        int h = (int) img.dimension(1);
        int[] pixels = RGBImgUtils.getRGBStorage(img);
        BufferedImage canvas = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        canvas.setRGB(0, 0, w, h, pixels, 0, w);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_OFF);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
            g.setFont(font);
            g.setColor(new java.awt.Color(rgb & 0xffffff));
            g.drawString(text, x, y + g.getFontMetrics().getAscent());
        } finally {
            g.dispose();
        }
        // getRGB always returns an opaque alpha for TYPE_INT_RGB
        canvas.getRGB(0, 0, w, h, pixels, 0, w);
    }
}
