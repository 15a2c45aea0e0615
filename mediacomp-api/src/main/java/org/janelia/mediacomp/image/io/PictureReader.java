package org.janelia.mediacomp.image.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.janelia.mediacomp.image.Picture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes image files into pictures. Every input is normalized to opaque 8 bit per channel RGB:
 * gray, palette and alpha images are converted, not rejected.
 */
public class PictureReader {

    private static final Logger LOG = LoggerFactory.getLogger(PictureReader.class);

    public static Picture readPicture(Path path) throws IOException {
        long startTime = System.currentTimeMillis();
        try (InputStream inputStream = Files.newInputStream(path)) {
            return readPictureFromStream(inputStream);
        } catch (IOException e) {
            throw new IOException("Error reading picture from " + path, e);
        } finally {
            LOG.trace("Loaded picture from {} in {}ms", path, System.currentTimeMillis() - startTime);
        }
    }

    public static Picture readPictureFromStream(InputStream inputStream) throws IOException {
        BufferedImage image = ImageIO.read(inputStream);
        if (image == null) {
            throw new IOException("No registered image reader could decode the stream");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        // getRGB converts any color model to packed sRGB
        int[] rgbData = image.getRGB(0, 0, width, height, null, 0, width);
        return Picture.fromRGBData(rgbData, width, height);
    }
}
