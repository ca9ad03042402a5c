package fun.fengwk.snow.core.service.extract.parser;

import fun.fengwk.snow.core.service.extract.ExtractProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Picks the report region out of a rendered page.
 *
 * <p>Returns the region's text nodes joined by single spaces, or the input unchanged when no
 * configured selector matches, so extraction always has something to work on.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportContentSelector {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> SKIPPED_TAGS = Set.of("script", "style", "noscript", "template");

    private final ExtractProperties extractProperties;

    public String select(String html) {
        if (!StringUtils.hasText(html)) {
            return html == null ? "" : html;
        }
        Element region = findRegion(Jsoup.parse(html), extractProperties.getReportSelectors());
        if (region == null) {
            return html;
        }
        String text = collectText(region);
        return text.isEmpty() ? html : text;
    }

    private Element findRegion(Document document, List<String> selectors) {
        if (selectors == null) {
            return null;
        }
        for (String selector : selectors) {
            if (!StringUtils.hasText(selector)) {
                continue;
            }
            try {
                Element element = document.selectFirst(selector);
                if (element != null) {
                    return element;
                }
            } catch (Selector.SelectorParseException ex) {
                log.warn("invalid report selector, selector={}, error={}", selector, ex.getMessage());
            }
        }
        return null;
    }

    private String collectText(Element region) {
        StringJoiner joiner = new StringJoiner(" ");
        region.traverse((Node node, int depth) -> {
            if (!(node instanceof TextNode textNode) || isInsideSkippedTag(textNode)) {
                return;
            }
            String text = WHITESPACE.matcher(textNode.getWholeText()).replaceAll(" ").trim();
            if (!text.isEmpty()) {
                joiner.add(text);
            }
        });
        return joiner.toString();
    }

    private boolean isInsideSkippedTag(TextNode textNode) {
        Node parent = textNode.parent();
        while (parent instanceof Element element) {
            if (SKIPPED_TAGS.contains(element.normalName().toLowerCase(Locale.ROOT))) {
                return true;
            }
            parent = element.parent();
        }
        return false;
    }

}
