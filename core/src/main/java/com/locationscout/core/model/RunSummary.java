package com.locationscout.core.model;

import com.locationscout.core.util.Durations;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 실행 단위 결과 요약: 버킷별 개수 + 경과 시간.
 * 개별 페이지 실패 수와 무관하게 항상 4개 버킷을 모두 보고한다.
 */
public final class RunSummary {
    private final List<SiteOutcome> outcomes;
    private final EnumMap<OutcomeStatus, Integer> counts = new EnumMap<>(OutcomeStatus.class);
    private final double elapsedSeconds;

    public RunSummary(List<SiteOutcome> outcomes, double elapsedSeconds) {
        this.outcomes = List.copyOf(outcomes);
        this.elapsedSeconds = elapsedSeconds;
        for (OutcomeStatus s : OutcomeStatus.values()) counts.put(s, 0);
        for (SiteOutcome o : outcomes) {
            if (o.status != null) counts.merge(o.status, 1, Integer::sum);
        }
    }

    public List<SiteOutcome> outcomes() { return outcomes; }
    public int count(OutcomeStatus s) { return counts.getOrDefault(s, 0); }
    public Map<OutcomeStatus, Integer> counts() { return Collections.unmodifiableMap(counts); }
    public double elapsedSeconds() { return elapsedSeconds; }
    public int total() { return outcomes.size(); }

    /** 위치 페이지를 찾은 사이트 중 top 점수 상위 n */
    public List<SiteOutcome> topResults(int n) {
        return outcomes.stream()
                .filter(o -> o.status == OutcomeStatus.SUCCESS_WITH_LOCATIONS)
                .sorted(Comparator.comparingInt((SiteOutcome o) -> o.topScore).reversed())
                .limit(n)
                .collect(Collectors.toList());
    }

    /** 수동 검토가 필요한 사이트(위치 페이지 없음) */
    public List<SiteOutcome> needsManualReview() {
        return outcomes.stream()
                .filter(o -> o.status == OutcomeStatus.SUCCESS_NO_LOCATIONS)
                .collect(Collectors.toList());
    }

    /** 콘솔/로그용 여러 줄 요약 */
    public List<String> toLines() {
        List<String> lines = new ArrayList<>();
        int n = Math.max(1, total());
        lines.add("Total time: " + Durations.format(elapsedSeconds));
        lines.add(String.format(Locale.ROOT, "Average per site: %.1fs", elapsedSeconds / n));
        int ok = count(OutcomeStatus.SUCCESS_WITH_LOCATIONS);
        lines.add(String.format(Locale.ROOT, "  %s: %d (%.1f%%)",
                OutcomeStatus.SUCCESS_WITH_LOCATIONS.label(), ok, 100.0 * ok / n));
        lines.add("  " + OutcomeStatus.SUCCESS_NO_LOCATIONS.label() + ": " + count(OutcomeStatus.SUCCESS_NO_LOCATIONS));
        lines.add("  " + OutcomeStatus.ERROR.label() + ": " + count(OutcomeStatus.ERROR));
        lines.add("  " + OutcomeStatus.SKIPPED_INVALID_URL.label() + ": " + count(OutcomeStatus.SKIPPED_INVALID_URL));

        List<SiteOutcome> top = topResults(20);
        if (!top.isEmpty()) {
            lines.add("Top results (by score):");
            for (SiteOutcome o : top) {
                lines.add(String.format(Locale.ROOT, "  [%2dpts] %-35.35s | %s",
                        o.topScore, o.name, o.topUrl == null ? "N/A" : o.topUrl));
            }
        }
        List<SiteOutcome> review = needsManualReview();
        if (!review.isEmpty()) {
            lines.add("No location pages found (" + review.size() + ") - manual review needed:");
            for (SiteOutcome o : review) lines.add("  " + o.name + ": " + o.url);
        }
        return lines;
    }
}
