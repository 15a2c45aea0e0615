package org.janelia.mediacomp.image;

import java.util.function.Consumer;

import net.imglib2.Cursor;
import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;
import org.janelia.mediacomp.MediaPreconditions;
import org.janelia.mediacomp.color.Color;

/**
 * Whole-picture operations driven by caller supplied per-pixel functions.
 * None of these modifies its source; each result is built on a private copy and is only
 * handed back if every call of the caller's function succeeded, so a failure leaves
 * nothing half-transformed.
 * Pixels are always visited in row-major order (x varies fastest).
 */
public class PictureTransforms {

    public static Picture map(Picture source, PixelTransform transform) {
        return map(source, transform, 0, 0, source.getWidth(), source.getHeight());
    }

    /**
     * Apply the transform only to the pixels in <code>[left, right) x [top, bottom)</code>;
     * the pixels outside the region are copied unchanged.
     */
    public static Picture map(Picture source, PixelTransform transform, long left, long top, long right, long bottom) {
        MediaPreconditions.checkType(transform, "map", "transform", "PixelTransform");
        ArrayImg<ARGBType, IntArray> target = RGBImgUtils.copyRGBImg(source.getImg());
        Interval region = CoordUtils.clipRegion(target, left, top, right, bottom);
        if (region != null) {
            forEachPixel(Views.flatIterable(Views.interval(target, region)).localizingCursor(), (cursor) -> {
                ARGBType px = cursor.get();
                Color newColor = MediaPreconditions.checkResult(
                        transform.apply(new PixelInfo(cursor.getIntPosition(0), cursor.getIntPosition(1), px.get())),
                        "map", "transform", "Color");
                px.set(newColor.getRGB());
            });
        }
        return new Picture(target);
    }

    public static Picture mapIf(Picture source, PixelPredicate condition, PixelTransform transform) {
        MediaPreconditions.checkType(condition, "mapIf", "condition", "PixelPredicate");
        MediaPreconditions.checkType(transform, "mapIf", "transform", "PixelTransform");
        ArrayImg<ARGBType, IntArray> target = RGBImgUtils.copyRGBImg(source.getImg());
        forEachPixel(Views.flatIterable(target).localizingCursor(), (cursor) -> {
            ARGBType px = cursor.get();
            PixelInfo pixel = new PixelInfo(cursor.getIntPosition(0), cursor.getIntPosition(1), px.get());
            if (condition.test(pixel)) {
                Color newColor = MediaPreconditions.checkResult(transform.apply(pixel), "mapIf", "transform", "Color");
                px.set(newColor.getRGB());
            }
        });
        return new Picture(target);
    }

    /**
     * Combine each pixel with the pixel at the same location in <code>other</code>.
     * When <code>resize</code> is set and the shapes differ, <code>other</code> is first resized
     * to this picture's shape; otherwise reads outside <code>other</code> are clamped to its border.
     */
    public static Picture combine(Picture source, PixelCombiner combiner, Picture other, boolean resize) {
        MediaPreconditions.checkType(combiner, "combine", "combiner", "PixelCombiner");
        MediaPreconditions.checkType(other, "combine", "other", "Picture");
        ArrayImg<ARGBType, IntArray> target = RGBImgUtils.copyRGBImg(source.getImg());
        RandomAccess<ARGBType> otherAccess = otherAccess(source, other, resize);
        forEachPixel(Views.flatIterable(target).localizingCursor(), (cursor) -> {
            ARGBType px = cursor.get();
            int x = cursor.getIntPosition(0);
            int y = cursor.getIntPosition(1);
            int otherRGB = otherAccess.setPositionAndGet(x, y).get();
            Color newColor = MediaPreconditions.checkResult(
                    combiner.combine(new PixelInfo(x, y, px.get()), new PixelInfo(x, y, otherRGB)),
                    "combine", "combiner", "Color");
            px.set(newColor.getRGB());
        });
        return new Picture(target);
    }

    /**
     * Gray picture where each pixel's intensity is the scaled color distance
     * between the corresponding pixels of the two pictures.
     */
    public static Picture difference(Picture source, Picture other, double scale) {
        MediaPreconditions.checkType(other, "difference", "other", "Picture");
        return combine(
                source,
                (p1, p2) -> Color.makeColor(Color.clampChannel(p1.distance(p2) * scale)),
                other,
                false);
    }

    /**
     * Replace the pixels that satisfy the condition with the corresponding pixels of <code>other</code>.
     */
    public static Picture replaceIf(Picture source, PixelPredicate condition, Picture other, boolean resize) {
        MediaPreconditions.checkType(condition, "replaceIf", "condition", "PixelPredicate");
        MediaPreconditions.checkType(other, "replaceIf", "other", "Picture");
        ArrayImg<ARGBType, IntArray> target = RGBImgUtils.copyRGBImg(source.getImg());
        RandomAccess<ARGBType> otherAccess = otherAccess(source, other, resize);
        forEachPixel(Views.flatIterable(target).localizingCursor(), (cursor) -> {
            ARGBType px = cursor.get();
            int x = cursor.getIntPosition(0);
            int y = cursor.getIntPosition(1);
            if (condition.test(new PixelInfo(x, y, px.get()))) {
                px.set(otherAccess.setPositionAndGet(x, y).get());
            }
        });
        return new Picture(target);
    }

    /**
     * Move pixels around. The result starts filled with the background color and every source pixel,
     * visited in row-major order, is written where the remapper sends it; target locations wrap around
     * the picture and when several pixels land on the same location the last one wins.
     */
    public static Picture remap(Picture source, PixelRemapper remapper, Color background) {
        MediaPreconditions.checkType(remapper, "remap", "remapper", "PixelRemapper");
        MediaPreconditions.checkType(background, "remap", "background", "Color");
        ArrayImg<ARGBType, IntArray> target = RGBImgUtils.createRGBImg(source.getWidth(), source.getHeight(), background.getRGB());
        RandomAccess<ARGBType> targetAccess = target.randomAccess();
        GeomTransform wrap = new WrapTransform(target.dimensionsAsLongArray());
        long[] remappedPos = new long[2];
        long[] targetPos = new long[2];
        forEachPixel(Views.flatIterable(source.getImg()).localizingCursor(), (cursor) -> {
            PixelInfo remapped = MediaPreconditions.checkResult(
                    remapper.remap(new PixelInfo(cursor.getIntPosition(0), cursor.getIntPosition(1), cursor.get().get())),
                    "remap", "remapper", "PixelInfo");
            remappedPos[0] = remapped.getX();
            remappedPos[1] = remapped.getY();
            wrap.apply(remappedPos, targetPos);
            targetAccess.setPositionAndGet(targetPos).set(remapped.getRGB());
        });
        return new Picture(target);
    }

    /**
     * Nearest neighbor resize; each target pixel takes the value of the source pixel it falls on.
     */
    public static Picture resize(Picture source, int width, int height) {
        long[] targetShape = new long[] {
                CoordUtils.clamp(width, 1, Picture.MAX_DIMENSION),
                CoordUtils.clamp(height, 1, Picture.MAX_DIMENSION)
        };
        ArrayImg<ARGBType, IntArray> target = RGBImgUtils.createRGBImg(targetShape[0], targetShape[1], 0);
        RandomAccess<ARGBType> sourceAccess = source.getImg().randomAccess();
        GeomTransform scale = new ScaleTransform(source.getImg().dimensionsAsLongArray(), targetShape);
        long[] targetPos = new long[2];
        long[] sourcePos = new long[2];
        forEachPixel(Views.flatIterable(target).localizingCursor(), (cursor) -> {
            cursor.localize(targetPos);
            scale.apply(targetPos, sourcePos);
            cursor.get().set(sourceAccess.setPositionAndGet(sourcePos));
        });
        return new Picture(target);
    }

    private static RandomAccess<ARGBType> otherAccess(Picture source, Picture other, boolean resize) {
        Picture otherSource;
        if (resize && (source.getWidth() != other.getWidth() || source.getHeight() != other.getHeight())) {
            otherSource = resize(other, source.getWidth(), source.getHeight());
        } else {
            otherSource = other;
        }
        return Views.extendBorder(otherSource.getImg()).randomAccess();
    }

    private static void forEachPixel(Cursor<ARGBType> cursor, Consumer<Cursor<ARGBType>> pixelOp) {
        while (cursor.hasNext()) {
            cursor.fwd();
            pixelOp.accept(cursor);
        }
    }
}
