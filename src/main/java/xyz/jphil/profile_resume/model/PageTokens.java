package xyz.jphil.profile_resume.model;

import java.util.List;

/**
 * Word tokens of one page plus the page width needed for the column-gap threshold.
 * Tokens come in no particular order.
 */
public record PageTokens(int pageIndex, double width, List<WordToken> words) {

    public PageTokens {
        words = words == null ? List.of() : List.copyOf(words);
    }
}
