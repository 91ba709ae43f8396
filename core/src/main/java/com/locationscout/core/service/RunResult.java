package com.locationscout.core.service;

import com.locationscout.core.model.RunSummary;
import com.locationscout.core.model.SiteReport;

import java.time.Instant;
import java.util.List;

/** 실행 1회의 결과: 버킷 요약 + 사이트별 분류 보고서(보고서 생성 입력) */
public record RunResult(Instant startedAt, RunSummary summary, List<SiteReport> reports) {
    public RunResult {
        reports = List.copyOf(reports);
    }
}
