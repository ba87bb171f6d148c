package com.searchcollector.model;

import lombok.Builder;
import lombok.Value;

/**
 * One search result entry before its content is fetched
 */
@Value
@Builder
public class Candidate {

    String title;
    String link;
    String snippet;

    // 1-based position in the search response
    int rank;
}
