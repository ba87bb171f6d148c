package com.searchcollector.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Structured summary of one web page as produced by the LLM.
 * Field names on the wire follow the extraction schema.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StructuredRecord {

    // Boxed so an omitted field can be told apart from an explicit false
    @SerializedName("valid")
    private Boolean valid;

    @SerializedName("title")
    private String title;

    @SerializedName("summary")
    private String summary;

    @SerializedName("key_points")
    private List<String> keyPoints;

    @SerializedName("code_snippets")
    private List<String> codeSnippets;

    @SerializedName("source_url")
    private String sourceUrl;

    public boolean isDeclaredInvalid() {
        return Boolean.FALSE.equals(valid);
    }
}
