package com.searchcollector.service;

import com.searchcollector.config.CollectorProperties;
import com.searchcollector.model.FetchStrategy;
import com.searchcollector.model.StageOutcome;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleans fetched content before extraction and drops pages with too little
 * text to be worth an LLM call.
 */
@Slf4j
@Service
public class ContentNormalizer {

    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*?]\\([^)]*?\\)");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");

    private final int minContentLength;

    public ContentNormalizer(CollectorProperties properties) {
        this.minContentLength = properties.getNormalizer().getMinContentLength();
    }

    public StageOutcome<String> normalize(String raw, FetchStrategy strategy) {
        if (raw == null || strategy == null || strategy == FetchStrategy.NONE) {
            return StageOutcome.rejected("no content");
        }

        String cleaned = strategy == FetchStrategy.FALLBACK ? cleanHtml(raw) : cleanMarkdown(raw);

        if (cleaned.length() < minContentLength) {
            log.debug("Cleaned content below {} chars ({} chars)", minContentLength, cleaned.length());
            return StageOutcome.rejected("too short (" + cleaned.length() + " chars)");
        }
        return StageOutcome.success(cleaned);
    }

    /**
     * Reader proxy output: drop image embeds, collapse blank-line runs.
     */
    String cleanMarkdown(String markdown) {
        String text = MARKDOWN_IMAGE.matcher(markdown).replaceAll("");
        return collapseBlankLines(text);
    }

    /**
     * Direct fetch output: drop script/style blocks and comments, then every
     * remaining tag, keeping block boundaries as line breaks.
     */
    String cleanHtml(String html) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript, template").remove();

        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    text.append(textNode.getWholeText());
                } else if (node instanceof Element element && "br".equals(element.normalName())) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    text.append('\n');
                }
            }
        }, doc);

        String collapsed = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        collapsed = collapsed.lines().map(String::strip).collect(Collectors.joining("\n"));
        return collapseBlankLines(collapsed);
    }

    private static String collapseBlankLines(String text) {
        return BLANK_LINES.matcher(text).replaceAll("\n\n").trim();
    }
}
