package com.searchcollector.model;

/**
 * Which fetch tier produced the content.
 */
public enum FetchStrategy {
    PRIMARY,
    FALLBACK,
    NONE
}
