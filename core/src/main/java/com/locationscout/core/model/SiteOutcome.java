package com.locationscout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 사이트 1건의 실행 결과 (체크포인트/결과 파일 포맷).
 * 성공 항목은 크롤/분류 수치를, 오류 항목은 error(200자 제한)를 채운다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SiteOutcome {
    public static final int MAX_ERROR_LENGTH = 200;

    @JsonProperty("index")            public int index = -1;
    @JsonProperty("name")             public String name;
    @JsonProperty("url")              public String url;
    @JsonProperty("domain")           public String domain;
    @JsonProperty("status")           public OutcomeStatus status;
    @JsonProperty("pages_crawled")    public int pagesCrawled;
    @JsonProperty("pages_failed")     public int pagesFailed;
    @JsonProperty("location_pages")   public int locationPages;
    @JsonProperty("total_pages")      public int totalPages;
    @JsonProperty("top_url")          public String topUrl;
    @JsonProperty("top_score")        public int topScore;
    @JsonProperty("modalities")       public List<String> modalities = new ArrayList<>();
    @JsonProperty("extraction_approach") public String extractionApproach;
    @JsonProperty("reason")           public String reason;
    @JsonProperty("error")            public String error;
    @JsonProperty("time_seconds")     public double timeSeconds;

    public static SiteOutcome skipped(int index, Carrier c) {
        SiteOutcome o = base(index, c);
        o.status = OutcomeStatus.SKIPPED_INVALID_URL;
        o.reason = "No valid URL";
        return o;
    }

    public static SiteOutcome error(int index, Carrier c, String domain, Throwable t, double seconds) {
        SiteOutcome o = base(index, c);
        o.domain = domain;
        o.status = OutcomeStatus.ERROR;
        o.error = trimError(t);
        o.timeSeconds = seconds;
        return o;
    }

    public static SiteOutcome completed(int index, Carrier c, String domain, CrawlSummary crawl,
                                        SiteReport report, double seconds) {
        SiteOutcome o = base(index, c);
        o.domain = domain;
        o.status = report.hasLocations() ? OutcomeStatus.SUCCESS_WITH_LOCATIONS : OutcomeStatus.SUCCESS_NO_LOCATIONS;
        if (crawl != null && crawl.crawlStats != null) {
            o.pagesCrawled = crawl.crawlStats.pagesCrawled;
            o.pagesFailed = crawl.crawlStats.pagesFailed;
        }
        o.locationPages = report.acceptedPages();
        o.totalPages = report.totalPagesSeen();
        report.topPage().ifPresent(p -> {
            o.topUrl = p.url();
            o.topScore = p.totalScore();
        });
        for (SignalKind k : report.modalityCounts().keySet()) o.modalities.add(k.name());
        o.extractionApproach = report.recommendedApproach();
        o.timeSeconds = seconds;
        return o;
    }

    private static SiteOutcome base(int index, Carrier c) {
        SiteOutcome o = new SiteOutcome();
        o.index = index;
        o.name = c.name();
        o.url = c.website();
        return o;
    }

    static String trimError(Throwable t) {
        if (t == null) return "unknown error";
        String msg = t.getMessage();
        String s = (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
        return s.length() <= MAX_ERROR_LENGTH ? s : s.substring(0, MAX_ERROR_LENGTH);
    }

    @Override public String toString() {
        return "SiteOutcome{" + index + ", " + name + ", " + status + "}";
    }
}
