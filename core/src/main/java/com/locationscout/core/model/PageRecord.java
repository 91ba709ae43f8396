package com.locationscout.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * 방문 성공한 페이지 1건의 기록. 사이트 크롤 동안만 오케스트레이터가 소유한다.
 */
public record PageRecord(String requestedUrl,
                         String finalUrl,
                         int statusCode,
                         String title,
                         int htmlByteLength,
                         Set<String> extractedLinks,
                         Instant crawledAt) {
    public PageRecord {
        Objects.requireNonNull(requestedUrl, "requestedUrl");
        finalUrl = finalUrl == null ? requestedUrl : finalUrl;
        title = title == null ? "" : title;
        extractedLinks = Set.copyOf(extractedLinks);
        Objects.requireNonNull(crawledAt, "crawledAt");
    }
}
