package xyz.jphil.profile_resume.model;

/**
 * A single decoded word with its position, as produced by the document decoder
 */
public record WordToken(String text, BoundingBox box, int page) {

    public static WordToken wordToken(String text, double top, double bottom, double left, double right, int page) {
        return new WordToken(text, new BoundingBox(top, bottom, left, right), page);
    }
}
