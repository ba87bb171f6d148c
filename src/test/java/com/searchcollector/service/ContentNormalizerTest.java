package com.searchcollector.service;

import com.searchcollector.TestProperties;
import com.searchcollector.model.FetchStrategy;
import com.searchcollector.model.StageOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentNormalizerTest {

    private ContentNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ContentNormalizer(TestProperties.defaults());
    }

    @Test
    @DisplayName("Reader output loses image embeds and blank-line runs")
    void cleansMarkdown() {
        String markdown = "# Title\n\n![logo](https://example.com/logo.png)\n\n\n\nBody text here.\n \n\n\nMore text.";

        String cleaned = normalizer.cleanMarkdown(markdown);

        assertThat(cleaned).doesNotContain("![").doesNotContain("logo.png");
        assertThat(cleaned).doesNotContain("\n\n\n");
        assertThat(cleaned).startsWith("# Title").endsWith("More text.");
    }

    @Test
    @DisplayName("Direct fetch HTML loses scripts, styles, comments and tags")
    void cleansHtml() {
        String html = """
                <html><head><title>Page</title>
                <style>body { color: red; }</style>
                <script>var tracking = "secret";</script>
                </head><body>
                <!-- hidden comment -->
                <h1>Heading</h1>
                <p>First paragraph with <b>bold</b> text.</p>
                <div>Second&nbsp;block</div>
                </body></html>
                """;

        String cleaned = normalizer.cleanHtml(html);

        assertThat(cleaned).contains("Heading", "First paragraph with bold text.", "Second block");
        assertThat(cleaned).doesNotContain("tracking", "color: red", "hidden comment", "<", ">");
        assertThat(cleaned).doesNotContain("\n\n\n");
    }

    @Test
    @DisplayName("Block elements stay on separate lines")
    void keepsBlockBoundaries() {
        String cleaned = normalizer.cleanHtml("<p>alpha</p><p>beta</p>");

        assertThat(cleaned).isEqualTo("alpha\nbeta");
    }

    @Test
    @DisplayName("Content of 250 chars is rejected as too short")
    void rejectsShortContent() {
        StageOutcome<String> outcome = normalizer.normalize("a".repeat(250), FetchStrategy.PRIMARY);

        assertThat(outcome.getStatus()).isEqualTo(StageOutcome.Status.REJECTED);
        assertThat(outcome.getReason()).contains("too short");
    }

    @Test
    @DisplayName("Content at the threshold passes")
    void acceptsThresholdContent() {
        StageOutcome<String> outcome = normalizer.normalize("a".repeat(300), FetchStrategy.PRIMARY);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).hasSize(300);
    }

    @Test
    @DisplayName("Length is measured after cleaning")
    void measuresCleanedLength() {
        String html = "<html><body><script>" + "x".repeat(1000) + "</script><p>short</p></body></html>";

        StageOutcome<String> outcome = normalizer.normalize(html, FetchStrategy.FALLBACK);

        assertThat(outcome.getStatus()).isEqualTo(StageOutcome.Status.REJECTED);
    }

    @Test
    @DisplayName("Missing content is rejected")
    void rejectsMissingContent() {
        assertThat(normalizer.normalize(null, FetchStrategy.PRIMARY).isSuccess()).isFalse();
        assertThat(normalizer.normalize("text", FetchStrategy.NONE).isSuccess()).isFalse();
    }
}
