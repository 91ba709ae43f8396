package com.locationscout.core.crawler;

import com.locationscout.core.model.CrawlSummary;
import com.locationscout.core.model.PageRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * 사이트 1개 크롤의 상태. 한 SiteCrawler 실행만 소유하며 사이트 간 공유하지 않는다.
 * URL 상태: queued → visited | failed (둘 다 종단, visited 와 failed 는 서로소)
 */
public final class SiteCrawlState {
    private final String baseUrl;
    private final String domain;
    private final Frontier frontier = new Frontier();
    private final Set<String> visited = new LinkedHashSet<>();
    private final Set<String> failed = new LinkedHashSet<>();
    private final List<PageRecord> pages = new ArrayList<>();
    private final Instant startedAt;
    private Instant finishedAt;

    public SiteCrawlState(String baseUrl, String domain) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.domain = Objects.requireNonNull(domain, "domain");
        this.startedAt = Instant.now();
    }

    public String baseUrl() { return baseUrl; }
    public String domain() { return domain; }
    public Frontier frontier() { return frontier; }
    public Set<String> visited() { return Collections.unmodifiableSet(visited); }
    public Set<String> failed() { return Collections.unmodifiableSet(failed); }
    public List<PageRecord> pages() { return Collections.unmodifiableList(pages); }
    public Instant startedAt() { return startedAt; }
    public Optional<Instant> finishedAt() { return Optional.ofNullable(finishedAt); }

    /** 처리 완료(성공+실패) 수: 페이지 예산 비교 기준 */
    public int attempted() { return visited.size() + failed.size(); }

    public boolean isDone(String url) { return visited.contains(url) || failed.contains(url); }

    void markVisited(PageRecord record) {
        visited.add(record.requestedUrl());
        pages.add(record);
    }

    void markFailed(String url) {
        failed.add(url);
    }

    void finish() {
        this.finishedAt = Instant.now();
    }

    public double durationSeconds() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }

    /** 요약(신호 집계는 분류 후 CrawlSummary.withSignals 로 채운다) */
    public CrawlSummary toSummary(String carrierName) {
        CrawlSummary s = new CrawlSummary();
        s.carrierName = carrierName;
        s.baseUrl = baseUrl;
        s.domain = domain;
        double secs = durationSeconds();
        s.crawlStats.pagesCrawled = visited.size();
        s.crawlStats.pagesFailed = failed.size();
        s.crawlStats.pagesWithLocationSignals = 0;
        s.crawlStats.durationSeconds = secs;
        s.crawlStats.pagesPerSecond = secs > 0 ? visited.size() / secs : 0;
        s.crawledAt = startedAt;
        return s;
    }
}
