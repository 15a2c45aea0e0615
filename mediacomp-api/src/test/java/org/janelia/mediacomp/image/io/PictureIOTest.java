package org.janelia.mediacomp.image.io;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.janelia.mediacomp.color.Color;
import org.janelia.mediacomp.color.Colors;
import org.janelia.mediacomp.files.MediaPath;
import org.janelia.mediacomp.image.Picture;
import org.janelia.mediacomp.image.PictureTestUtils;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.janelia.mediacomp.image.PictureTestUtils.assertSamePixels;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PictureIOTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @After
    public void resetMediaPath() {
        MediaPath.set(null);
    }

    @Test
    public void pngRoundTrip() throws IOException {
        Picture picture = PictureTestUtils.createGradient(7, 5);
        Path pngPath = testFolder.getRoot().toPath().resolve("gradient.png");
        PictureWriter.writePicture(picture, pngPath);
        assertTrue(Files.exists(pngPath));
        assertSamePixels(picture, PictureReader.readPicture(pngPath));
    }

    @Test
    public void missingExtensionDefaultsToPng() throws IOException {
        Picture picture = Picture.makeEmpty(3, 3, Colors.RED);
        Path path = testFolder.getRoot().toPath().resolve("noext");
        PictureWriter.writePicture(picture, path);
        Path pngPath = testFolder.getRoot().toPath().resolve("noext.png");
        assertTrue(Files.exists(pngPath));
        assertSamePixels(picture, PictureReader.readPicture(pngPath));
    }

    @Test
    public void unknownFormatIsRejected() {
        Path path = testFolder.getRoot().toPath().resolve("picture.nosuchformat");
        try {
            PictureWriter.writePicture(Picture.makeEmpty(2, 2), path);
            fail("Expected an unknown format to be rejected");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("nosuchformat"));
        }
        assertFalse(Files.exists(path));
    }

    @Test
    public void unreadableFileIsRejected() throws IOException {
        File notAnImage = testFolder.newFile("notAnImage.png");
        Files.write(notAnImage.toPath(), "not an image".getBytes());
        try {
            PictureReader.readPicture(notAnImage.toPath());
            fail("Expected a non image file to be rejected");
        } catch (IOException e) {
            assertTrue(e.getMessage().contains("notAnImage.png"));
        }
    }

    @Test
    public void alphaIsDropped() throws IOException {
        BufferedImage argbImage = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        argbImage.setRGB(0, 0, 0x800a141e);
        argbImage.setRGB(1, 0, 0xff0000ff);
        File imageFile = testFolder.newFile("alpha.png");
        ImageIO.write(argbImage, "png", imageFile);

        Picture picture = PictureReader.readPicture(imageFile.toPath());
        assertEquals(new Color(10, 20, 30), picture.getColor(0, 0));
        assertEquals(Colors.BLUE, picture.getColor(1, 0));
    }

    @Test
    public void grayIsConvertedToRGB() throws IOException {
        BufferedImage grayImage = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        grayImage.getRaster().setSample(0, 0, 0, 0);
        grayImage.getRaster().setSample(1, 0, 0, 255);
        File imageFile = testFolder.newFile("gray.png");
        ImageIO.write(grayImage, "png", imageFile);

        Picture picture = PictureReader.readPicture(imageFile.toPath());
        assertEquals(Colors.BLACK, picture.getColor(0, 0));
        assertEquals(Colors.WHITE, picture.getColor(1, 0));
    }

    @Test
    public void relativeNamesUseMediaPath() throws IOException {
        assertTrue(MediaPath.set(testFolder.getRoot().getAbsolutePath()));
        Picture picture = PictureTestUtils.createGradient(4, 4);
        picture.write("relative.png");
        assertTrue(Files.exists(testFolder.getRoot().toPath().resolve("relative.png")));
        assertSamePixels(picture, Picture.fromFile("relative.png"));
    }
}
