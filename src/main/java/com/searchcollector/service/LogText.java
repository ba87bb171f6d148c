package com.searchcollector.service;

/**
 * Shortens free text (queries, error bodies, model output) before it goes
 * into a log line or exception message.
 */
final class LogText {

    private LogText() {
    }

    static String truncate(String str, int maxLength) {
        if (str == null) return "";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
