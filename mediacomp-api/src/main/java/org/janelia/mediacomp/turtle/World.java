package org.janelia.mediacomp.turtle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import org.janelia.mediacomp.image.Picture;

/**
 * The world where the turtles live. Turtles draw on the world's picture, which starts out white.
 */
public class World implements Iterable<Turtle> {

    public static final int DEFAULT_WIDTH = 640;
    public static final int DEFAULT_HEIGHT = 480;

    private final Picture picture;
    private final List<Turtle> turtles = new ArrayList<>();

    public World() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public World(int width, int height) {
        Preconditions.checkArgument(width > 0 && height > 0, "In World: size must be positive, actually %sx%s", width, height);
        this.picture = Picture.makeEmpty(width, height);
    }

    public Picture getPicture() {
        return picture;
    }

    public Turtle newTurtle() {
        return newTurtle(0, 0, 0);
    }

    public Turtle newTurtle(double x, double y) {
        return newTurtle(x, y, 0);
    }

    public Turtle newTurtle(double x, double y, double heading) {
        Turtle turtle = new Turtle(this, x, y, heading);
        turtles.add(turtle);
        return turtle;
    }

    public List<Turtle> getTurtles() {
        return Collections.unmodifiableList(turtles);
    }

    /**
     * Iterate the turtles in the order they were created.
     */
    @Override
    public Iterator<Turtle> iterator() {
        return getTurtles().iterator();
    }

    @Override
    public String toString() {
        return "World: " + turtles.size() + " turtles";
    }
}
