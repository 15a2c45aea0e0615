package org.janelia.mediacomp.image.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.mediacomp.image.Picture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PictureWriter {

    private static final Logger LOG = LoggerFactory.getLogger(PictureWriter.class);

    private static final String DEFAULT_FORMAT = "png";

    /**
     * Encode the picture using the format given by the file extension, png when there is none.
     *
     * @throws IOException if the format is not supported or the file cannot be written
     */
    public static void writePicture(Picture picture, Path path) throws IOException {
        long startTime = System.currentTimeMillis();
        String format = getFormat(path);
        if (!ImageIO.getImageWritersByFormatName(format).hasNext()) {
            throw new IOException("No image writer found for format " + format + " required by " + path);
        }
        Path outputPath = StringUtils.isBlank(FilenameUtils.getExtension(path.toString()))
                ? path.resolveSibling(path.getFileName() + "." + DEFAULT_FORMAT)
                : path;
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        try (OutputStream outputStream = Files.newOutputStream(outputPath)) {
            writePictureToStream(picture, format, outputStream);
        } finally {
            LOG.debug("Wrote {} to {} in {}ms", picture, outputPath, System.currentTimeMillis() - startTime);
        }
    }

    public static void writePictureToStream(Picture picture, String format, OutputStream outputStream) throws IOException {
        BufferedImage image = new BufferedImage(picture.getWidth(), picture.getHeight(), BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, picture.getWidth(), picture.getHeight(), picture.getRGBData(), 0, picture.getWidth());
        if (!ImageIO.write(image, format, outputStream)) {
            throw new IOException("No image writer found for format " + format);
        }
    }

    private static String getFormat(Path path) {
        String extension = FilenameUtils.getExtension(path.toString());
        if (StringUtils.isBlank(extension)) {
            return DEFAULT_FORMAT;
        } else if (StringUtils.equalsAnyIgnoreCase(extension, "jpg", "jpeg")) {
            return "jpeg";
        } else {
            return extension.toLowerCase();
        }
    }
}
