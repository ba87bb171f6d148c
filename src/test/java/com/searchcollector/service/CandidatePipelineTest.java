package com.searchcollector.service;

import com.searchcollector.TestProperties;
import com.searchcollector.model.Candidate;
import com.searchcollector.model.CandidateOutcome;
import com.searchcollector.model.CandidateOutcome.Disposition;
import com.searchcollector.model.FetchResult;
import com.searchcollector.model.StageOutcome;
import com.searchcollector.model.StructuredRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CandidatePipelineTest {

    private static final String LINK = "https://example.com/article";
    private static final String LONG_TEXT = "Useful article content. ".repeat(20);

    @Mock
    private ContentFetcher contentFetcher;

    @Mock
    private StructuredExtractor structuredExtractor;

    private CandidatePipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new CandidatePipeline(
                new BlocklistFilter(TestProperties.defaults()),
                contentFetcher,
                new ContentNormalizer(TestProperties.defaults()),
                structuredExtractor);
    }

    @Test
    @DisplayName("Blocked candidates never reach the fetcher")
    void blockedCandidate() {
        CandidateOutcome outcome = pipeline.process(candidate("https://www.youtube.com/watch?v=1"));

        assertThat(outcome.getDisposition()).isEqualTo(Disposition.BLOCKED);
        verifyNoInteractions(contentFetcher, structuredExtractor);
    }

    @Test
    @DisplayName("No content from either tier drops the candidate")
    void unfetchable() {
        when(contentFetcher.fetch(LINK)).thenReturn(FetchResult.none());

        CandidateOutcome outcome = pipeline.process(candidate(LINK));

        assertThat(outcome.getDisposition()).isEqualTo(Disposition.UNFETCHABLE);
        verifyNoInteractions(structuredExtractor);
    }

    @Test
    @DisplayName("Content of 250 chars never reaches the extractor")
    void shortContent() {
        when(contentFetcher.fetch(LINK)).thenReturn(FetchResult.primary("x".repeat(250)));

        CandidateOutcome outcome = pipeline.process(candidate(LINK));

        assertThat(outcome.getDisposition()).isEqualTo(Disposition.TOO_SHORT);
        assertThat(outcome.isCollected()).isFalse();
        verifyNoInteractions(structuredExtractor);
    }

    @Test
    @DisplayName("Cleaned content and the link are handed to the extractor")
    void collected() {
        StructuredRecord record = record(LINK);
        when(contentFetcher.fetch(LINK)).thenReturn(FetchResult.primary("![img](a.png)\n" + LONG_TEXT));
        when(structuredExtractor.extract(anyString(), eq(LINK))).thenReturn(StageOutcome.success(record));

        CandidateOutcome outcome = pipeline.process(candidate(LINK));

        assertThat(outcome.isCollected()).isTrue();
        assertThat(outcome.getRecord()).isSameAs(record);
        verify(structuredExtractor).extract(LONG_TEXT.trim(), LINK);
    }

    @Test
    @DisplayName("A page the model declares invalid is dropped")
    void declaredInvalid() {
        when(contentFetcher.fetch(LINK)).thenReturn(FetchResult.primary(LONG_TEXT));
        when(structuredExtractor.extract(anyString(), eq(LINK))).thenReturn(StageOutcome.rejected("declared invalid"));

        CandidateOutcome outcome = pipeline.process(candidate(LINK));

        assertThat(outcome.getDisposition()).isEqualTo(Disposition.DECLARED_INVALID);
        assertThat(outcome.getRecord()).isNull();
    }

    @Test
    @DisplayName("Exhausted extraction drops the candidate")
    void extractionFailed() {
        when(contentFetcher.fetch(LINK)).thenReturn(FetchResult.primary(LONG_TEXT));
        when(structuredExtractor.extract(anyString(), eq(LINK))).thenReturn(StageOutcome.failed("retries exhausted"));

        assertThat(pipeline.process(candidate(LINK)).getDisposition()).isEqualTo(Disposition.EXTRACTION_FAILED);
    }

    @Test
    @DisplayName("Unexpected exceptions become an error outcome instead of escaping")
    void unexpectedException() {
        when(contentFetcher.fetch(LINK)).thenThrow(new IllegalStateException("boom"));

        CandidateOutcome outcome = pipeline.process(candidate(LINK));

        assertThat(outcome.getDisposition()).isEqualTo(Disposition.ERROR);
        assertThat(outcome.getCandidate().getLink()).isEqualTo(LINK);
    }

    static Candidate candidate(String link) {
        return Candidate.builder().title("Title").link(link).snippet("snippet").rank(1).build();
    }

    static StructuredRecord record(String link) {
        return StructuredRecord.builder()
                .valid(true)
                .title("Title")
                .summary("Summary")
                .keyPoints(List.of("point"))
                .codeSnippets(List.of())
                .sourceUrl(link)
                .build();
    }
}
