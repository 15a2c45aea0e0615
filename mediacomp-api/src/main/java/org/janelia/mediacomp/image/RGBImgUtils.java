package org.janelia.mediacomp.image;

import java.util.Arrays;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;

/**
 * Helpers for the packed RGB images that back a {@link Picture}.
 * Every pixel is stored as an opaque <code>0xffRRGGBB</code> int, row-major with x varying fastest.
 */
public class RGBImgUtils {

    public static ArrayImg<ARGBType, IntArray> createRGBImg(long width, long height, int rgb) {
        ArrayImg<ARGBType, IntArray> img = ArrayImgs.argbs(width, height);
        Arrays.fill(getRGBStorage(img), 0xff000000 | rgb);
        return img;
    }

    /**
     * Wrap the given packed pixel values; the array is used as is, so the caller must not hold on to it.
     */
    public static ArrayImg<ARGBType, IntArray> wrapRGBData(int[] rgbData, long width, long height) {
        if (rgbData.length != width * height) {
            throw new IllegalArgumentException("Pixel data has " + rgbData.length + " values but the image is " + width + "x" + height);
        }
        for (int i = 0; i < rgbData.length; i++) {
            rgbData[i] |= 0xff000000;
        }
        return ArrayImgs.argbs(rgbData, width, height);
    }

    public static ArrayImg<ARGBType, IntArray> copyRGBImg(ArrayImg<ARGBType, IntArray> img) {
        return ArrayImgs.argbs(getRGBStorage(img).clone(), img.dimension(0), img.dimension(1));
    }

    /**
     * @return the backing array of the image - changes to it are visible in the image.
     */
    static int[] getRGBStorage(ArrayImg<ARGBType, IntArray> img) {
        return img.update(null).getCurrentStorageArray();
    }

    public static int[] getRGBData(ArrayImg<ARGBType, IntArray> img) {
        return getRGBStorage(img).clone();
    }

    public static boolean sameRGBData(ArrayImg<ARGBType, IntArray> img1, ArrayImg<ARGBType, IntArray> img2) {
        return img1.dimension(0) == img2.dimension(0)
                && img1.dimension(1) == img2.dimension(1)
                && Arrays.equals(getRGBStorage(img1), getRGBStorage(img2));
    }
}
