package com.locationscout.core.crawler;

import com.locationscout.core.model.PageRecord;

import java.util.Objects;
import java.util.Optional;

/** 페이지 1건 방문 결과(성공/실패 값). 예외 대신 값으로 돌려 테스트/로그에서 보이게 한다. */
public final class PageOutcome {
    private final String url;
    private final PageRecord record;   // 성공 시
    private final String failure;      // 실패 시 사유
    private final Throwable cause;     // 실패 원인(없을 수 있음)

    private PageOutcome(String url, PageRecord record, String failure, Throwable cause) {
        this.url = Objects.requireNonNull(url, "url");
        this.record = record;
        this.failure = failure;
        this.cause = cause;
    }

    public static PageOutcome visited(PageRecord record) {
        return new PageOutcome(record.requestedUrl(), record, null, null);
    }

    public static PageOutcome failed(String url, String reason, Throwable cause) {
        return new PageOutcome(url, null, reason == null ? "failed" : reason, cause);
    }

    public String url() { return url; }
    public boolean isSuccess() { return record != null; }
    public Optional<PageRecord> record() { return Optional.ofNullable(record); }
    public Optional<String> failure() { return Optional.ofNullable(failure); }
    public Optional<Throwable> cause() { return Optional.ofNullable(cause); }

    @Override public String toString() {
        return isSuccess() ? "visited(" + url + ")" : "failed(" + url + ": " + failure + ")";
    }
}
