package org.janelia.mediacomp.image;

import java.awt.Font;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;
import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;
import org.janelia.mediacomp.MediaPreconditions;
import org.janelia.mediacomp.color.Color;
import org.janelia.mediacomp.color.Colors;
import org.janelia.mediacomp.files.MediaPath;
import org.janelia.mediacomp.image.io.PictureReader;
import org.janelia.mediacomp.image.io.PictureWriter;

/**
 * A width x height grid of opaque RGB pixels.
 *
 * Reads outside the picture are clamped to the nearest edge pixel while writes outside the picture
 * are silently ignored. Width and height never change; {@link #resize(int, int)} returns a new picture.
 */
public class Picture implements Iterable<Pixel> {

    public static final int MAX_DIMENSION = 10000;

    private static final Font DEFAULT_FONT = new Font(Font.DIALOG, Font.PLAIN, 12);

    public static Picture makeEmpty(int width, int height) {
        return makeEmpty(width, height, Colors.WHITE);
    }

    /**
     * Create a picture filled with the given color. Width and height are clamped to <code>[1, 10000]</code>.
     */
    public static Picture makeEmpty(int width, int height, Color color) {
        MediaPreconditions.checkType(color, "makeEmpty", "color", "Color");
        return new Picture(RGBImgUtils.createRGBImg(
                CoordUtils.clamp(width, 1, MAX_DIMENSION),
                CoordUtils.clamp(height, 1, MAX_DIMENSION),
                color.getRGB()));
    }

    /**
     * Load a picture; a relative name is resolved against the current media path.
     */
    public static Picture fromFile(String name) throws IOException {
        MediaPreconditions.checkType(name, "fromFile", "name", "String");
        return fromFile(MediaPath.resolve(name));
    }

    public static Picture fromFile(Path path) throws IOException {
        return PictureReader.readPicture(path);
    }

    /**
     * Create a picture from packed <code>0xRRGGBB</code> values in row-major order. The alpha bits are ignored.
     *
     * @throws IllegalArgumentException if the size is not positive or does not match the number of values
     */
    public static Picture fromRGBData(int[] rgbData, int width, int height) {
        MediaPreconditions.checkType(rgbData, "fromRGBData", "rgbData", "int[]");
        Preconditions.checkArgument(width > 0 && height > 0,
                "In fromRGBData: size must be positive, actually %sx%s", width, height);
        return new Picture(RGBImgUtils.wrapRGBData(rgbData.clone(), width, height));
    }

    private final ArrayImg<ARGBType, IntArray> pixelsImg;

    Picture(ArrayImg<ARGBType, IntArray> pixelsImg) {
        this.pixelsImg = pixelsImg;
    }

    ArrayImg<ARGBType, IntArray> getImg() {
        return pixelsImg;
    }

    public int getWidth() {
        return (int) pixelsImg.dimension(0);
    }

    public int getHeight() {
        return (int) pixelsImg.dimension(1);
    }

    /**
     * @return a live cursor to the pixel at (x, y); out of range coordinates are clamped.
     */
    public Pixel getPixel(int x, int y) {
        return new Pixel(pixelsImg, x, y);
    }

    /**
     * @return the color at (x, y); out of range coordinates are clamped.
     */
    public Color getColor(int x, int y) {
        return Color.fromRGB(pixelsImg.randomAccess().setPositionAndGet(
                CoordUtils.clamp(x, 0, pixelsImg.max(0)),
                CoordUtils.clamp(y, 0, pixelsImg.max(1))).get());
    }

    /**
     * Set the color at (x, y). A location outside the picture is ignored.
     */
    public void setColor(int x, int y, Color color) {
        MediaPreconditions.checkType(color, "setColor", "color", "Color");
        if (CoordUtils.contains(pixelsImg, x, y)) {
            pixelsImg.randomAccess().setPositionAndGet(x, y).set(color.getRGB());
        }
    }

    /**
     * Iterate the pixels in row-major order: all x for y = 0, then all x for y = 1, and so on.
     * Each call starts a fresh iteration.
     */
    @Override
    public Iterator<Pixel> iterator() {
        Cursor<ARGBType> cursor = Views.flatIterable(pixelsImg).localizingCursor();
        return new Iterator<Pixel>() {
            @Override
            public boolean hasNext() {
                return cursor.hasNext();
            }

            @Override
            public Pixel next() {
                if (!cursor.hasNext()) {
                    throw new NoSuchElementException();
                }
                cursor.fwd();
                return new Pixel(pixelsImg, cursor.getLongPosition(0), cursor.getLongPosition(1));
            }
        };
    }

    public List<Pixel> getPixels() {
        List<Pixel> pixels = new ArrayList<>(getWidth() * getHeight());
        for (Pixel p : this) {
            pixels.add(p);
        }
        return pixels;
    }

    /**
     * @return an independent deep copy.
     */
    public Picture copy() {
        return new Picture(RGBImgUtils.copyRGBImg(pixelsImg));
    }

    public void setAllPixelsToAColor(Color color) {
        MediaPreconditions.checkType(color, "setAllPixelsToAColor", "color", "Color");
        for (ARGBType px : pixelsImg) {
            px.set(color.getRGB());
        }
    }

    /**
     * Paste this picture into <code>bigPicture</code> with its top left corner at (x, y).
     * The part that falls outside <code>bigPicture</code> is dropped.
     */
    public void copyInto(Picture bigPicture, int x, int y) {
        MediaPreconditions.checkType(bigPicture, "copyInto", "bigPicture", "Picture");
        ArrayImg<ARGBType, IntArray> targetImg = bigPicture.getImg();
        RandomAccess<ARGBType> targetAccess = targetImg.randomAccess();
        Cursor<ARGBType> cursor = pixelsImg.localizingCursor();
        while (cursor.hasNext()) {
            ARGBType px = cursor.next();
            long tx = x + cursor.getLongPosition(0);
            long ty = y + cursor.getLongPosition(1);
            if (CoordUtils.contains(targetImg, tx, ty)) {
                targetAccess.setPositionAndGet(tx, ty).set(px);
            }
        }
    }

    /**
     * Draw a one pixel wide line from (x1, y1) to (x2, y2); the part outside the picture is clipped.
     */
    public void addLine(int x1, int y1, int x2, int y2, Color color) {
        MediaPreconditions.checkType(color, "addLine", "color", "Color");
        ImageDraw.draw2dLine(pixelsImg.randomAccess(), getWidth(), getHeight(), x1, y1, x2, y2, new ARGBType(color.getRGB()));
    }

    public void addText(int x, int y, String text) {
        addText(x, y, text, Colors.BLACK);
    }

    /**
     * Draw the text with its top left corner at (x, y) using the default 12 point dialog font.
     */
    public void addText(int x, int y, String text, Color color) {
        MediaPreconditions.checkType(text, "addText", "text", "String");
        MediaPreconditions.checkType(color, "addText", "color", "Color");
        ImageDraw.drawText(pixelsImg, x, y, text, DEFAULT_FONT, color.getRGB());
    }

    public void addTextWithStyle(int x, int y, String text, TextStyle style) {
        addTextWithStyle(x, y, text, style, Colors.BLACK);
    }

    public void addTextWithStyle(int x, int y, String text, TextStyle style, Color color) {
        MediaPreconditions.checkType(text, "addTextWithStyle", "text", "String");
        MediaPreconditions.checkType(style, "addTextWithStyle", "style", "TextStyle");
        MediaPreconditions.checkType(color, "addTextWithStyle", "color", "Color");
        ImageDraw.drawText(pixelsImg, x, y, text, style.getFont(), color.getRGB());
    }

    public Picture resize(int width, int height) {
        return PictureTransforms.resize(this, width, height);
    }

    public Picture map(PixelTransform transform) {
        return PictureTransforms.map(this, transform);
    }

    /**
     * Transform only the region <code>[left, right) x [top, bottom)</code>.
     */
    public Picture map(PixelTransform transform, int left, int top, int right, int bottom) {
        return PictureTransforms.map(this, transform, left, top, right, bottom);
    }

    public Picture mapIf(PixelPredicate condition, PixelTransform transform) {
        return PictureTransforms.mapIf(this, condition, transform);
    }

    public Picture combine(PixelCombiner combiner, Picture other) {
        return combine(combiner, other, false);
    }

    public Picture combine(PixelCombiner combiner, Picture other, boolean resize) {
        return PictureTransforms.combine(this, combiner, other, resize);
    }

    public Picture difference(Picture other) {
        return difference(other, 1.0);
    }

    public Picture difference(Picture other, double scale) {
        return PictureTransforms.difference(this, other, scale);
    }

    public Picture replaceIf(PixelPredicate condition, Picture other) {
        return replaceIf(condition, other, false);
    }

    public Picture replaceIf(PixelPredicate condition, Picture other, boolean resize) {
        return PictureTransforms.replaceIf(this, condition, other, resize);
    }

    public Picture remap(PixelRemapper remapper) {
        return remap(remapper, Colors.BLACK);
    }

    public Picture remap(PixelRemapper remapper, Color background) {
        return PictureTransforms.remap(this, remapper, background);
    }

    /**
     * @return a copy of the packed <code>0xffRRGGBB</code> pixel values in row-major order.
     */
    public int[] getRGBData() {
        return RGBImgUtils.getRGBData(pixelsImg);
    }

    /**
     * @return true if both pictures have the same shape and the same pixel values.
     */
    public boolean samePixels(Picture other) {
        return other != null && RGBImgUtils.sameRGBData(pixelsImg, other.getImg());
    }

    /**
     * Write the picture; a relative name is resolved against the current media path
     * and the format is taken from the file extension.
     */
    public void write(String name) throws IOException {
        MediaPreconditions.checkType(name, "write", "name", "String");
        PictureWriter.writePicture(this, MediaPath.resolve(name));
    }

    @Override
    public String toString() {
        return "Picture, image height=" + getHeight() + ", width=" + getWidth();
    }
}
