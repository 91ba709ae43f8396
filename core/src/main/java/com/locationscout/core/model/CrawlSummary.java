package com.locationscout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 사이트별 crawl_summary.json 포맷.
 * 크롤러가 신호 집계 없이 먼저 쓰고, 분류 후 withSignals(...) 결과로 다시 쓴다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CrawlSummary {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Stats {
        @JsonProperty("pages_crawled")               public int pagesCrawled;
        @JsonProperty("pages_failed")                public int pagesFailed;
        @JsonProperty("pages_with_location_signals") public int pagesWithLocationSignals;
        @JsonProperty("duration_seconds")            public double durationSeconds;
        @JsonProperty("pages_per_second")            public double pagesPerSecond;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PageSignals {
        @JsonProperty("url")     public String url;
        @JsonProperty("title")   public String title;
        @JsonProperty("score")   public int score;
        @JsonProperty("signals") public List<SignalEntry> signals = new ArrayList<>();
    }

    @JsonProperty("carrier_name")       public String carrierName;
    @JsonProperty("base_url")           public String baseUrl;
    @JsonProperty("domain")             public String domain;
    @JsonProperty("crawl_stats")        public Stats crawlStats = new Stats();
    @JsonProperty("signal_summary")     public Map<String, Integer> signalSummary = new LinkedHashMap<>();
    @JsonProperty("pages_with_signals") public List<PageSignals> pagesWithSignals = new ArrayList<>();
    @JsonProperty("crawled_at")         public Instant crawledAt;

    /** 분류 결과(accepted 페이지와 양수 신호)를 반영 */
    public CrawlSummary withSignals(SiteReport report) {
        this.signalSummary = new LinkedHashMap<>();
        report.modalityCounts().forEach((k, v) -> signalSummary.put(k.name(), v));
        this.pagesWithSignals = new ArrayList<>();
        for (PageClassification pc : report.topPages()) {
            PageSignals ps = new PageSignals();
            ps.url = pc.url();
            ps.title = pc.title();
            ps.score = pc.totalScore();
            for (Signal s : pc.positiveSignals()) ps.signals.add(SignalEntry.from(s));
            pagesWithSignals.add(ps);
        }
        this.crawlStats.pagesWithLocationSignals = report.acceptedPages();
        return this;
    }
}
