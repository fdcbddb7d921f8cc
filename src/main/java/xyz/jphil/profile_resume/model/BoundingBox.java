package xyz.jphil.profile_resume.model;

/**
 * Axis-aligned box in page coordinates, y growing downwards
 */
public record BoundingBox(double top, double bottom, double left, double right) {

    public double height() {
        return bottom - top;
    }

    public double centerY() {
        return (top + bottom) / 2;
    }

    /**
     * Smallest box covering both boxes
     */
    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(
            Math.min(top, other.top), Math.max(bottom, other.bottom),
            Math.min(left, other.left), Math.max(right, other.right));
    }
}
