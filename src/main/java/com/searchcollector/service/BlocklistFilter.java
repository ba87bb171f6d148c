package com.searchcollector.service;

import com.searchcollector.config.CollectorProperties;
import com.searchcollector.model.Candidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Rejects candidates hosted on domains that never yield usable content
 * (video and social platforms). Plain substring match, no network access.
 */
@Slf4j
@Service
public class BlocklistFilter {

    private final List<String> domains;

    public BlocklistFilter(CollectorProperties properties) {
        this.domains = properties.getBlocklist().getDomains().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(d -> !d.isEmpty())
                .map(d -> d.toLowerCase(Locale.ROOT))
                .toList();
        log.info("Blocklist initialized with {} domains", domains.size());
    }

    /**
     * A candidate without a link is always blocked.
     */
    public boolean isBlocked(Candidate candidate) {
        if (candidate == null || candidate.getLink() == null || candidate.getLink().isBlank()) {
            return true;
        }
        String link = candidate.getLink().toLowerCase(Locale.ROOT);
        return domains.stream().anyMatch(link::contains);
    }
}
