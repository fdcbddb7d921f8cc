package xyz.jphil.profile_resume.tools.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.File;
import java.util.Locale;

/**
 * Basic facts about a loaded PDF, for verbose logging
 */
public class PdfInfoUtil {

    /**
     * pg0Width/pg0Height are -1 if the PDF has no pages
     */
    public record PdfInfo(int pageCount, long fileSize, double pg0Width, double pg0Height) {

        public String describe() {
            if (pg0Width < 0) {
                return String.format("%d pages, %s", pageCount, formatBytes(fileSize));
            }
            return String.format("%d pages, %s, first page %.0fx%.0f pt", pageCount, formatBytes(fileSize),
                pg0Width, pg0Height);
        }
    }

    /**
     * Page count and first page crop box (in points, 1/72 inch)
     */
    public static PdfInfo getPdfInfo(PDDocument document, File pdfFile) {
        long fileSize = pdfFile.length();
        int pageCount = document.getNumberOfPages();
        if (pageCount == 0) {
            return new PdfInfo(0, fileSize, -1, -1);
        }
        var box = document.getPage(0).getCropBox();
        return new PdfInfo(pageCount, fileSize, box.getWidth(), box.getHeight());
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + "B";
        if (bytes < 1024 * 1024) return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024.0));
    }
}
