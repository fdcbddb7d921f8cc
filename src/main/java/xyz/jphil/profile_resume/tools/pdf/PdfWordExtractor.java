package xyz.jphil.profile_resume.tools.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import xyz.jphil.profile_resume.model.PageTokens;
import xyz.jphil.profile_resume.model.WordToken;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import static xyz.jphil.profile_resume.model.WordToken.wordToken;

/**
 * Decodes a PDF into positioned word tokens, one {@link PageTokens} per page.
 * Coordinates are PDF points with y growing downwards from the top of the page.
 * Not thread-safe; use one instance per document.
 */
public class PdfWordExtractor extends PDFTextStripper {

    private final List<PageTokens> pages = new ArrayList<>();
    private List<WordToken> words;
    private double pageWidth;

    public PdfWordExtractor() {
        setSortByPosition(true);
    }

    public static List<PageTokens> extract(File pdfFile) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            return new PdfWordExtractor().extract(document);
        }
    }

    public List<PageTokens> extract(PDDocument document) throws IOException {
        pages.clear();
        writeText(document, Writer.nullWriter());
        return List.copyOf(pages);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        super.startPage(page);
        words = new ArrayList<>();
        pageWidth = page.getCropBox().getWidth();
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
        pages.add(new PageTokens(getCurrentPageNo() - 1, pageWidth, words));
        super.endPage(page);
    }

    /**
     * Receives the glyphs of one word or of a run of words; whitespace glyphs separate the tokens
     */
    @Override
    protected void writeString(String text, List<TextPosition> positions) throws IOException {
        var glyphs = new ArrayList<TextPosition>();
        for (var p : positions) {
            var unicode = p.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                addWord(glyphs);
                glyphs.clear();
            } else {
                glyphs.add(p);
            }
        }
        addWord(glyphs);
    }

    private void addWord(List<TextPosition> glyphs) {
        if (glyphs.isEmpty()) return;
        var text = new StringBuilder();
        double top = Double.MAX_VALUE;
        double bottom = -Double.MAX_VALUE;
        double left = Double.MAX_VALUE;
        double right = -Double.MAX_VALUE;
        for (var p : glyphs) {
            text.append(p.getUnicode());
            top = Math.min(top, p.getYDirAdj() - p.getHeightDir());
            bottom = Math.max(bottom, p.getYDirAdj());
            left = Math.min(left, p.getXDirAdj());
            right = Math.max(right, p.getXDirAdj() + p.getWidthDirAdj());
        }
        words.add(wordToken(text.toString().strip(), top, bottom, left, right, getCurrentPageNo() - 1));
    }
}
