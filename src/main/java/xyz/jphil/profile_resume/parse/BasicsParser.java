package xyz.jphil.profile_resume.parse;

import lombok.RequiredArgsConstructor;
import xyz.jphil.profile_resume.model.Basics;
import xyz.jphil.profile_resume.model.Line;
import xyz.jphil.profile_resume.model.Profile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Identity and contact details. Name, label and location come from the top of the document;
 * email, phone and profile links from anywhere in it; the summary from the about section.
 */
@RequiredArgsConstructor
public class BasicsParser {

    private static final Pattern LINKEDIN_HANDLE = Pattern.compile("(\\S+)\\s*\\(LinkedIn\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCHEME_AND_WWW = Pattern.compile("^(?:https?://)?(?:www\\.)?", Pattern.CASE_INSENSITIVE);
    private static final String CONTACT_PREFIX = "contact ";
    private static final String LINKEDIN_IN = "linkedin.com/in/";
    private static final int MIN_PHONE_DIGITS = 7;

    private final TextRules rules;

    public Basics parse(List<Line> lines, List<Line> aboutLines) {
        var texts = lines.stream().map(l -> l.text().strip()).filter(t -> !t.isEmpty()).toList();
        var top = texts.subList(0, Math.min(texts.size(), rules.settings().headerWindow()));
        var allText = String.join("\n", texts);

        var nameAndLabel = nameAndLabel(top);
        var email = firstMatch(TextRules.EMAIL.matcher(allText));
        var summary = aboutLines.stream()
            .map(l -> l.text().strip())
            .filter(t -> !t.isEmpty() && !rules.isNoise(t))
            .collect(Collectors.joining(" "))
            .strip();

        return new Basics(nameAndLabel[0], nameAndLabel[1], email, findPhone(texts), findLocation(top),
            profiles(allText, texts), summary);
    }

    /**
     * [name, label]: the first plain line is the name, the next line that is not a location is the label.
     * Contact headings, section headings and lines carrying an email, link, LinkedIn handle or phone
     * number are skipped.
     */
    String[] nameAndLabel(List<String> top) {
        var name = "";
        for (var text : top) {
            if (rules.isFooter(text) || rules.vocabulary().isContactHeading(text) || isSectionHeading(text)) continue;
            if (TextRules.EMAIL.matcher(text).find() || TextRules.URL.matcher(text).find()
                    || TextRules.PHONE.matcher(text).find() || LINKEDIN_HANDLE.matcher(text).find()) {
                continue;
            }
            if (name.isEmpty()) {
                name = stripContactPrefix(text);
                continue;
            }
            if (!rules.isLocationText(text)) {
                return new String[]{name, text};
            }
        }
        return new String[]{name, ""};
    }

    String findLocation(List<String> top) {
        for (var text : top) {
            if (rules.isLocationText(text) && !TextRules.EMAIL.matcher(text).find()) return text;
            if (text.toLowerCase(Locale.ROOT).contains(" area")) return text;
        }
        return "";
    }

    /**
     * First phone-shaped run with at least seven digits, ignoring lines that hold links or date ranges
     */
    String findPhone(List<String> texts) {
        for (var text : texts) {
            var lowered = text.toLowerCase(Locale.ROOT);
            if (lowered.contains("linkedin") || lowered.contains("github") || TextRules.URL.matcher(text).find()) continue;
            if (rules.dates().hasRange(text)) continue;
            var m = TextRules.PHONE.matcher(text);
            while (m.find()) {
                if (m.group().replaceAll("\\D", "").length() >= MIN_PHONE_DIGITS) return m.group();
            }
        }
        return "";
    }

    /**
     * Profile links found in the text plus a "handle (LinkedIn)" line. When a complete
     * {@code linkedin.com/in/<handle>} link exists, wrapped fragments ending in "-", the bare "/in/"
     * path and the bare LinkedIn root are dropped.
     */
    List<Profile> profiles(String allText, List<String> texts) {
        var urls = new ArrayList<String>();
        var m = TextRules.URL.matcher(allText);
        while (m.find()) {
            urls.add(trimTrailing(m.group()));
        }
        var fromHandle = linkedinFromHandle(texts);
        if (!fromHandle.isEmpty()) urls.add(fromHandle);

        boolean hasFullLinkedin = urls.stream().anyMatch(BasicsParser::isFullLinkedin);
        var seen = new HashSet<String>();
        var profiles = new ArrayList<Profile>();
        for (var url : urls) {
            var lower = url.toLowerCase(Locale.ROOT);
            if (hasFullLinkedin && lower.contains("linkedin.com") && !isFullLinkedin(url)) continue;

            var network = networkOf(lower);
            var key = network + "::" + SCHEME_AND_WWW.matcher(stripSlashes(lower)).replaceFirst("");
            if (seen.add(key)) profiles.add(new Profile(network, url));
        }
        return profiles;
    }

    static String networkOf(String lowerUrl) {
        if (lowerUrl.contains("linkedin.com")) return "LinkedIn";
        if (lowerUrl.contains("github.com")) return "GitHub";
        if (lowerUrl.contains("twitter.com")) return "Twitter";
        return "Website";
    }

    /**
     * LinkedIn prints the profile URL in the sidebar, wrapped, with the last fragment followed by
     * "(LinkedIn)". A wrapped fragment on the line above is joined back on.
     */
    private String linkedinFromHandle(List<String> texts) {
        for (int i = 0; i < texts.size(); i++) {
            var m = LINKEDIN_HANDLE.matcher(texts.get(i));
            if (!m.find()) continue;
            var handle = m.group(1).strip();
            if (handle.isEmpty() || handle.toLowerCase(Locale.ROOT).contains("linkedin.com")) continue;
            if (i > 0) {
                var previous = texts.get(i - 1).strip();
                int at = previous.toLowerCase(Locale.ROOT).indexOf(LINKEDIN_IN);
                if (at >= 0 && previous.endsWith("-")) {
                    handle = previous.substring(at + LINKEDIN_IN.length()) + handle;
                }
            }
            return "https://www.linkedin.com/in/" + handle;
        }
        return "";
    }

    private boolean isSectionHeading(String text) {
        return rules.looksLikeHeading(text) && rules.vocabulary().sectionFor(text).isPresent();
    }

    private static boolean isFullLinkedin(String url) {
        var trimmed = stripSlashes(url.toLowerCase(Locale.ROOT));
        int at = trimmed.indexOf(LINKEDIN_IN);
        return at >= 0 && trimmed.length() > at + LINKEDIN_IN.length() && !trimmed.endsWith("-");
    }

    private static String stripContactPrefix(String text) {
        if (text.toLowerCase(Locale.ROOT).startsWith(CONTACT_PREFIX)) {
            return text.substring(CONTACT_PREFIX.length()).strip();
        }
        return text;
    }

    private static String trimTrailing(String url) {
        int end = url.length();
        while (end > 0 && ").,".indexOf(url.charAt(end - 1)) >= 0) end--;
        return url.substring(0, end);
    }

    private static String stripSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') end--;
        return url.substring(0, end);
    }

    private static String firstMatch(Matcher m) {
        return m.find() ? m.group() : "";
    }
}
