package com.locationscout.core.service;

import com.locationscout.core.model.SiteOutcome;
import com.locationscout.core.model.SiteReport;

import java.util.Objects;
import java.util.Optional;

/** 사이트 1건 처리 결과: 결과 행 + (성공 시) 분류 보고서 */
public record SiteResult(SiteOutcome outcome, SiteReport report) {

    public SiteResult {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static SiteResult of(SiteOutcome outcome) {
        return new SiteResult(outcome, null);
    }

    public Optional<SiteReport> reportOpt() {
        return Optional.ofNullable(report);
    }
}
