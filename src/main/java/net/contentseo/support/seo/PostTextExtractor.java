package net.contentseo.support.seo;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.contentseo.domain.seo.ExtractedHeading;
import net.contentseo.domain.seo.ExtractedText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Strips post markup into plain text and an ordered h1-h3 outline.
 *
 * <p>Never fails on malformed markup. jsoup repairs unclosed tags; if parsing
 * still throws, every {@code <...>} span is removed with a regex instead.</p>
 */
@Component
public class PostTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PostTextExtractor.class);

    static final String ANCHOR_PREFIX = "heading-";

    private static final String HEADING_SELECTOR = "h1, h2, h3";
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HEADING_TAG = Pattern.compile(
        "<h([1-3])(?:\\s[^>]*)?>(.*?)(?:</h\\1\\s*>|(?=<h[1-6][\\s>])|$)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    /**
     * Extracts plain text and headings from post markup.
     *
     * @param body rich markup, possibly malformed
     * @return extracted text; {@link ExtractedText#EMPTY} for blank input
     */
    public ExtractedText extract(String body) {
        if (!StringUtils.hasText(body)) {
            return ExtractedText.EMPTY;
        }
        try {
            return extractWithParser(body);
        } catch (RuntimeException parseFailure) {
            log.debug("Markup parser rejected post body; using tag stripping instead", parseFailure);
            return extractByStripping(body);
        }
    }

    private ExtractedText extractWithParser(String body) {
        Document document = Jsoup.parseBodyFragment(body);
        String plainText = collapseWhitespace(document.body().text());

        List<ExtractedHeading> headings = new ArrayList<>();
        for (Element element : document.body().select(HEADING_SELECTOR)) {
            int level = Character.getNumericValue(element.normalName().charAt(1));
            headings.add(new ExtractedHeading(level, element.text().trim(), anchorFor(headings.size())));
        }
        return new ExtractedText(plainText, headings);
    }

    // Safety net for parser failures; jsoup normally handles any markup string
    ExtractedText extractByStripping(String body) {
        String plainText = stripTags(body);

        List<ExtractedHeading> headings = new ArrayList<>();
        Matcher matcher = HEADING_TAG.matcher(body);
        while (matcher.find()) {
            int level = Integer.parseInt(matcher.group(1));
            String text = stripTags(matcher.group(2));
            headings.add(new ExtractedHeading(level, text, anchorFor(headings.size())));
        }
        return new ExtractedText(plainText, headings);
    }

    private static String stripTags(String markup) {
        return collapseWhitespace(Parser.unescapeEntities(TAG.matcher(markup).replaceAll(" "), false));
    }

    private static String anchorFor(int position) {
        return ANCHOR_PREFIX + position;
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
