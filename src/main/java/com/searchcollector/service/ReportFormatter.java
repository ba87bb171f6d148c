package com.searchcollector.service;

import com.searchcollector.model.CollectResult;
import com.searchcollector.model.StructuredRecord;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Renders a {@link CollectResult} as a plain-text digest that downstream
 * agents can read as a web search tool result.
 */
@Service
public class ReportFormatter {

    static final int MAX_SNIPPET_CHARS = 1500;

    public String format(CollectResult result) {
        String query = result.getQuery();

        if (result.isUpstreamFailed()) {
            return "[Search] Web search for '" + query + "' failed: " + result.getFailureReason();
        }
        if (result.isEmpty()) {
            return "[Search] No usable web information found for '" + query + "'.";
        }

        StringBuilder report = new StringBuilder();
        report.append("Web search results for '").append(query).append("':\n\n");

        List<StructuredRecord> records = result.getRecords();
        for (int i = 0; i < records.size(); i++) {
            StructuredRecord record = records.get(i);

            report.append("--- Source [").append(i + 1).append("] : ")
                    .append(orDefault(record.getTitle(), "Untitled")).append(" ---\n");
            report.append("Link: ").append(orDefault(record.getSourceUrl(), "#")).append("\n");
            report.append("Summary: ").append(orDefault(record.getSummary(), "No summary")).append("\n");

            List<String> keyPoints = record.getKeyPoints();
            if (keyPoints != null && !keyPoints.isEmpty()) {
                report.append("Key points:\n");
                for (String point : keyPoints) {
                    report.append("   - ").append(point).append("\n");
                }
            }

            List<String> snippets = record.getCodeSnippets();
            if (snippets != null && !snippets.isEmpty()) {
                report.append("Code snippets:\n");
                for (String code : snippets) {
                    report.append("```\n").append(cap(code)).append("\n```\n");
                }
            }

            report.append("\n");
        }

        return report.toString();
    }

    private static String cap(String code) {
        if (code.length() <= MAX_SNIPPET_CHARS) {
            return code;
        }
        return code.substring(0, MAX_SNIPPET_CHARS) + "...";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
