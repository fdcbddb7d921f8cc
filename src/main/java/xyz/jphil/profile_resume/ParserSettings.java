package xyz.jphil.profile_resume;

/**
 * Geometry and text-shape thresholds of the extraction pipeline.
 * Distances are in page units (PDF points for documents decoded by PDFBox).
 */
public record ParserSettings(
    double bandTolerance,
    double minColumnGap,
    double columnGapPageRatio,
    int minLinesForColumns,
    double columnSplitGap,
    double blockGapFactor,
    double fallbackLineHeight,
    int headerWindow,
    int entryLookahead,
    int headingMaxLength,
    int headingMaxWords,
    boolean detectColumns
) {

    public static ParserSettings defaults() {
        return new ParserSettings(
            2.5,    // same band when vertical centers differ by at most this
            30,     // absolute floor of the in-band column gap
            0.08,   // in-band column gap as a share of page width
            40,     // shorter documents are always single-column
            80,     // left-edge gap that counts as a column boundary
            1.8,    // block break when the vertical gap exceeds median line height times this
            10,     // median line height when no line has a height
            12,     // lines searched for name, label and location
            2,      // lines after a header candidate searched for its date
            60,
            5,
            true
        );
    }

    public ParserSettings withDetectColumns(boolean detect) {
        return new ParserSettings(bandTolerance, minColumnGap, columnGapPageRatio, minLinesForColumns,
            columnSplitGap, blockGapFactor, fallbackLineHeight, headerWindow, entryLookahead,
            headingMaxLength, headingMaxWords, detect);
    }

    /**
     * Horizontal gap that splits one line band into separate lines
     */
    public double columnGapFor(double pageWidth) {
        return Math.max(minColumnGap, pageWidth * columnGapPageRatio);
    }
}
