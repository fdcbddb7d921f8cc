package xyz.jphil.profile_resume.layout;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.ParserSettings;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.PageTokens;
import xyz.jphil.profile_resume.model.WordToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Groups word tokens into reading-order lines.
 * Tokens whose vertical centers lie within the band tolerance share a band; a band is cut into
 * separate lines wherever the horizontal gap between neighbours exceeds the page's column gap,
 * so a sidebar item printed beside a heading does not end up glued to it.
 */
@RequiredArgsConstructor
public class LineReconstructor {

    private static final Comparator<WordToken> READING_ORDER = Comparator
        .comparingDouble((WordToken w) -> w.box().top())
        .thenComparingDouble(w -> w.box().left());

    private final ParserSettings settings;

    /**
     * Lines of all pages, page-major, top to bottom
     */
    public List<Line> reconstruct(List<PageTokens> pages) {
        var lines = new ArrayList<Line>();
        pages.stream()
            .sorted(Comparator.comparingInt(PageTokens::pageIndex))
            .forEach(page -> lines.addAll(linesOf(page)));
        return lines;
    }

    public List<Line> linesOf(PageTokens page) {
        var words = page.words().stream()
            .filter(w -> w != null && w.text() != null && !w.text().isBlank() && w.box() != null)
            .sorted(READING_ORDER)
            .toList();
        var lines = new ArrayList<Line>();
        if (words.isEmpty()) return lines;

        double gap = settings.columnGapFor(page.width());
        var band = new ArrayList<WordToken>();
        double bandCenter = 0;
        for (var word : words) {
            if (band.isEmpty()) {
                bandCenter = word.box().centerY();
            } else if (Math.abs(word.box().centerY() - bandCenter) > settings.bandTolerance()) {
                lines.addAll(splitBand(band, page.pageIndex(), gap));
                band.clear();
                bandCenter = word.box().centerY();
            }
            band.add(word);
        }
        lines.addAll(splitBand(band, page.pageIndex(), gap));
        return lines;
    }

    /**
     * Cut one band into lines at every horizontal gap wider than {@code gap}
     */
    List<Line> splitBand(List<WordToken> band, int page, double gap) {
        var sorted = band.stream()
            .sorted(Comparator.comparingDouble(w -> w.box().left()))
            .toList();
        var lines = new ArrayList<Line>();
        var segment = new ArrayList<WordToken>();
        double lastRight = 0;
        for (var word : sorted) {
            if (!segment.isEmpty() && word.box().left() - lastRight > gap) {
                lines.add(toLine(segment, page));
                segment = new ArrayList<>();
            }
            segment.add(word);
            lastRight = word.box().right();
        }
        if (!segment.isEmpty()) lines.add(toLine(segment, page));
        return lines;
    }

    private static Line toLine(List<WordToken> words, int page) {
        var text = words.stream()
            .map(w -> w.text().strip())
            .collect(Collectors.joining(" "))
            .strip();
        var box = words.get(0).box();
        for (var word : words) {
            box = box.union(word.box());
        }
        return new Line(text, box, page);
    }
}
