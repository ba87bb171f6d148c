package com.searchcollector.exception;

/**
 * The search API call itself failed (auth, network, bad response).
 * Fatal for the whole query, unlike per-candidate failures.
 */
public class SearchApiException extends Exception {

    public SearchApiException(String message) {
        super(message);
    }

    public SearchApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
