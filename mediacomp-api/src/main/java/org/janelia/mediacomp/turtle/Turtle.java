package org.janelia.mediacomp.turtle;

import org.janelia.mediacomp.MediaPreconditions;
import org.janelia.mediacomp.color.Colors;

/**
 * A turtle that moves around its world and, while its pen is down, leaves a black trail on the world's picture.
 * Headings are in degrees: 0 is along +y and turning adds degrees; headings are kept in <code>[0, 360)</code>.
 */
public class Turtle {

    private final World world;
    private double x;
    private double y;
    private double heading;
    private boolean penUp;

    /**
     * Use {@link World#newTurtle(double, double, double)} to create turtles.
     */
    Turtle(World world, double x, double y, double heading) {
        this.world = MediaPreconditions.checkType(world, "Turtle", "world", "World");
        this.x = x;
        this.y = y;
        this.heading = normalizeHeading(heading);
        this.penUp = false;
    }

    public World getWorld() {
        return world;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getHeading() {
        return heading;
    }

    public void setHeading(double degrees) {
        heading = normalizeHeading(degrees);
    }

    public boolean isPenUp() {
        return penUp;
    }

    public void setPenUp(boolean penUp) {
        this.penUp = penUp;
    }

    public void penUp() {
        setPenUp(true);
    }

    public void penDown() {
        setPenUp(false);
    }

    public void forward(double distance) {
        double radians = Math.toRadians(heading);
        moveTo(x + Math.sin(radians) * distance, y + Math.cos(radians) * distance);
    }

    public void backward(double distance) {
        forward(-distance);
    }

    /**
     * Add the given number of degrees to the heading.
     */
    public void turn(double degrees) {
        setHeading(heading + degrees);
    }

    public void turnLeft() {
        turn(90);
    }

    public void turnRight() {
        turn(-90);
    }

    /**
     * Move without changing the heading, drawing a line if the pen is down.
     */
    public void moveTo(double newX, double newY) {
        if (!penUp) {
            world.getPicture().addLine((int) x, (int) y, (int) newX, (int) newY, Colors.BLACK);
        }
        x = newX;
        y = newY;
    }

    /**
     * Set the heading so that moving forward goes towards (targetX, targetY). The location does not change.
     */
    public void turnToFace(double targetX, double targetY) {
        setHeading(Math.toDegrees(Math.atan2(targetX - x, targetY - y)));
    }

    private static double normalizeHeading(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        return normalized >= 360.0 ? 0 : normalized;
    }

    @Override
    public String toString() {
        return "Turtle: at x=" + x + ", y=" + y + ", heading: " + heading + " degrees, pen: " + (penUp ? "up" : "down");
    }
}
