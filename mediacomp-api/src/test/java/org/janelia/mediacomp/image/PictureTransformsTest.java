package org.janelia.mediacomp.image;

import org.janelia.mediacomp.color.Color;
import org.janelia.mediacomp.color.Colors;
import org.junit.Test;

import static org.janelia.mediacomp.image.PictureTestUtils.assertAllPixels;
import static org.janelia.mediacomp.image.PictureTestUtils.assertSamePixels;
import static org.janelia.mediacomp.image.PictureTestUtils.assertSamePixelsNotSameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class PictureTransformsTest {

    @Test
    public void mapWithIdentity() {
        Picture picture = PictureTestUtils.createGradient(5, 4);
        assertSamePixelsNotSameInstance(picture, picture.map(PixelTransform.identity()));
    }

    @Test
    public void mapDoesNotModifySource() {
        Picture picture = PictureTestUtils.createGradient(3, 3);
        Picture before = picture.copy();
        Picture result = picture.map(p -> p.getColor().darkerPerChannel());
        assertSamePixels(before, picture);
        assertEquals(before.getColor(2, 1).darkerPerChannel(), result.getColor(2, 1));
    }

    @Test
    public void mapRegion() {
        class TestData {
            final int left, top, right, bottom;
            final int expectedBlackPixels;

            TestData(int left, int top, int right, int bottom, int expectedBlackPixels) {
                this.left = left;
                this.top = top;
                this.right = right;
                this.bottom = bottom;
                this.expectedBlackPixels = expectedBlackPixels;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(1, 1, 3, 3, 4),
                new TestData(3, 3, 1, 1, 4), // inverted bounds are swapped
                new TestData(-5, -5, 100, 100, 16),
                new TestData(0, 0, 4, 1, 4),
                new TestData(2, 0, 2, 4, 0),
                new TestData(5, 5, 10, 10, 0),
        };
        Picture picture = Picture.makeEmpty(4, 4);
        for (TestData td : testData) {
            Picture result = picture.map(p -> Colors.BLACK, td.left, td.top, td.right, td.bottom);
            int blackPixels = 0;
            for (Pixel p : result) {
                boolean inRegion = p.getX() >= Math.min(td.left, td.right) && p.getX() < Math.max(td.left, td.right)
                        && p.getY() >= Math.min(td.top, td.bottom) && p.getY() < Math.max(td.top, td.bottom);
                assertEquals(inRegion ? Colors.BLACK : Colors.WHITE, p.getColor());
                if (inRegion) blackPixels++;
            }
            assertEquals(td.expectedBlackPixels, blackPixels);
        }
    }

    @Test
    public void mapReceivesCoordinates() {
        Picture picture = Picture.makeEmpty(3, 2);
        Picture result = picture.map(p -> new Color(p.getX() * 100, p.getY() * 100, 0));
        assertEquals(new Color(200, 100, 0), result.getColor(2, 1));
        assertEquals(new Color(100, 0, 0), result.getColor(1, 0));
    }

    @Test
    public void chainedTransforms() {
        Picture picture = Picture.makeEmpty(2, 2, new Color(100, 100, 100));
        PixelTransform halve = p -> p.getColor().scale(0.5);
        PixelTransform addRed = p -> new Color(p.getRed() + 10, p.getGreen(), p.getBlue());
        assertAllPixels(new Color(60, 50, 50), picture.map(halve.andThen(addRed)));
        assertAllPixels(new Color(55, 50, 50), picture.map(addRed.andThen(halve)));
    }

    @Test
    public void mapIf() {
        Picture picture = PictureTestUtils.createGradient(4, 3);
        assertSamePixelsNotSameInstance(picture, picture.mapIf(p -> false, p -> Colors.RED));

        PixelPredicate firstColumn = p -> p.getX() == 0;
        Picture result = picture.mapIf(firstColumn, p -> Colors.RED);
        Picture negatedResult = picture.mapIf(firstColumn.negate(), p -> Colors.RED);
        for (Pixel p : picture) {
            Color expected = p.getX() == 0 ? Colors.RED : p.getColor();
            assertEquals(expected, result.getColor(p.getX(), p.getY()));
            Color negatedExpected = p.getX() == 0 ? p.getColor() : Colors.RED;
            assertEquals(negatedExpected, negatedResult.getColor(p.getX(), p.getY()));
        }
    }

    @Test
    public void differenceWithItselfIsBlack() {
        Picture picture = Picture.makeEmpty(2, 2, Colors.WHITE);
        Picture result = picture.difference(picture);
        assertAllPixels(Colors.BLACK, result);
        assertAllPixels(Colors.WHITE, picture);
    }

    @Test
    public void scaledDifference() {
        Picture black = Picture.makeEmpty(2, 1, Colors.BLACK);
        Picture white = Picture.makeEmpty(2, 1, Colors.WHITE);
        assertAllPixels(Colors.WHITE, black.difference(white));
        // sqrt(3) * 255 * 0.1 = 44.17
        assertAllPixels(Color.makeColor(44), black.difference(white, 0.1));
        Picture other = Picture.makeEmpty(2, 1, new Color(3, 4, 0));
        assertAllPixels(Color.makeColor(10), black.difference(other, 2));
    }

    @Test
    public void combineWithFirstPixel() {
        Picture picture = PictureTestUtils.createGradient(3, 3);
        Picture other = Picture.makeEmpty(3, 3, Colors.PINK);
        assertSamePixelsNotSameInstance(picture, picture.combine((p1, p2) -> p1.getColor(), other));
        assertAllPixels(Colors.PINK, picture.combine((p1, p2) -> p2.getColor(), other));
    }

    @Test
    public void combineDifferentSizesWithoutResize() {
        Picture picture = Picture.makeEmpty(3, 2, Colors.WHITE);
        Picture other = PictureTestUtils.createFromColors(2, 1, Colors.RED, Colors.BLUE);
        Picture result = picture.combine((p1, p2) -> p2.getColor(), other, false);
        assertEquals(3, result.getWidth());
        assertEquals(2, result.getHeight());
        // reads outside the other picture are clamped to its border
        assertEquals(Colors.RED, result.getColor(0, 0));
        assertEquals(Colors.BLUE, result.getColor(1, 0));
        assertEquals(Colors.BLUE, result.getColor(2, 0));
        assertEquals(Colors.RED, result.getColor(0, 1));
        assertEquals(Colors.BLUE, result.getColor(2, 1));
    }

    @Test
    public void combineDifferentSizesWithResize() {
        Picture picture = Picture.makeEmpty(4, 4, Colors.WHITE);
        Picture other = PictureTestUtils.createFromColors(2, 2, Colors.RED, Colors.GREEN, Colors.BLUE, Colors.BLACK);
        Picture result = picture.combine((p1, p2) -> p2.getColor(), other, true);
        assertSamePixels(other.resize(4, 4), result);
        assertEquals(Colors.GREEN, result.getColor(3, 1));
        assertEquals(Colors.BLUE, result.getColor(1, 3));
    }

    @Test
    public void replaceIf() {
        Picture picture = PictureTestUtils.createGradient(3, 3);
        Picture other = Picture.makeEmpty(3, 3, Colors.MAGENTA);
        Picture result = picture.replaceIf(p -> p.getY() >= 1, other);
        for (Pixel p : result) {
            assertEquals(p.getY() >= 1 ? Colors.MAGENTA : picture.getColor(p.getX(), p.getY()), p.getColor());
        }
        assertSamePixelsNotSameInstance(picture, picture.replaceIf(p -> false, other));

        Picture small = PictureTestUtils.createFromColors(1, 2, Colors.RED, Colors.BLUE);
        Picture resized = picture.replaceIf(p -> true, small, true);
        assertEquals(Colors.RED, resized.getColor(2, 0));
        assertEquals(Colors.BLUE, resized.getColor(0, 2));
    }

    @Test
    public void remapWithIdentity() {
        Picture picture = PictureTestUtils.createGradient(10, 10);
        assertSamePixelsNotSameInstance(picture, picture.remap(PixelRemapper.identity(), Colors.BLACK));
    }

    @Test
    public void remapWrapsAround() {
        Picture picture = PictureTestUtils.createFromColors(3, 1, Colors.RED, Colors.GREEN, Colors.BLUE);
        Picture shiftedRight = picture.remap(p -> p.withLocation(p.getX() + 1, p.getY()));
        assertSamePixels(PictureTestUtils.createFromColors(3, 1, Colors.BLUE, Colors.RED, Colors.GREEN), shiftedRight);
        Picture shiftedLeft = picture.remap(p -> p.withLocation(p.getX() - 1, p.getY() + 7));
        assertSamePixels(PictureTestUtils.createFromColors(3, 1, Colors.GREEN, Colors.BLUE, Colors.RED), shiftedLeft);
    }

    @Test
    public void remapLastWriterWins() {
        Picture picture = PictureTestUtils.createGradient(3, 2);
        Picture result = picture.remap(p -> p.withLocation(0, 0), Colors.ORANGE);
        // (2, 1) is the last pixel in row-major order
        assertEquals(picture.getColor(2, 1), result.getColor(0, 0));
        for (Pixel p : result) {
            if (p.getX() != 0 || p.getY() != 0) {
                assertEquals(Colors.ORANGE, p.getColor());
            }
        }
    }

    @Test
    public void remapRecolors() {
        Picture picture = Picture.makeEmpty(2, 2, Colors.GRAY);
        Picture result = picture.remap(p -> p.withColor(p.getColor().scale(3)));
        assertAllPixels(Colors.WHITE, result);
    }

    @Test
    public void missingResultAbortsTransform() {
        Picture picture = PictureTestUtils.createGradient(3, 3);
        Picture before = picture.copy();
        try {
            picture.map(p -> p.getX() == 1 && p.getY() == 1 ? null : Colors.RED);
            fail("Expected a missing transform result to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("In map: the value returned by transform expected a Color"));
        }
        try {
            picture.combine((p1, p2) -> null, before);
            fail("Expected a missing combine result to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("In combine:"));
        }
        try {
            picture.remap(p -> null);
            fail("Expected a missing remap result to be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("In remap:"));
        }
        assertSamePixels(before, picture);
    }

    @Test
    public void missingArgumentsAreRejected() {
        Picture picture = Picture.makeEmpty(2, 2);
        class TestData {
            final Runnable operation;
            final String expectedMessage;

            TestData(Runnable operation, String expectedMessage) {
                this.operation = operation;
                this.expectedMessage = expectedMessage;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(() -> picture.map(null), "In map: transform expected a PixelTransform, actually null"),
                new TestData(() -> picture.mapIf(null, PixelTransform.identity()), "In mapIf: condition expected a PixelPredicate, actually null"),
                new TestData(() -> picture.combine((p1, p2) -> p1.getColor(), null), "In combine: other expected a Picture, actually null"),
                new TestData(() -> picture.difference(null), "In difference: other expected a Picture, actually null"),
                new TestData(() -> picture.replaceIf(p -> true, null), "In replaceIf: other expected a Picture, actually null"),
                new TestData(() -> picture.remap(PixelRemapper.identity(), null), "In remap: background expected a Color, actually null"),
        };
        for (TestData td : testData) {
            try {
                td.operation.run();
                fail("Expected: " + td.expectedMessage);
            } catch (IllegalArgumentException e) {
                assertEquals(td.expectedMessage, e.getMessage());
            }
        }
    }
}
