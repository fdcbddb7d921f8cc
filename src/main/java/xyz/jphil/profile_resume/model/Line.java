package xyz.jphil.profile_resume.model;

/**
 * Reading-order run of word tokens believed to form one visual line
 */
public record Line(String text, BoundingBox box, int page) {

    public double top() {
        return box.top();
    }

    public double bottom() {
        return box.bottom();
    }

    public double left() {
        return box.left();
    }

    public double height() {
        return box.height();
    }

    /**
     * Same geometry, different text (used when a trailing fragment is folded into this line)
     */
    public Line withText(String newText) {
        return new Line(newText, box, page);
    }
}
