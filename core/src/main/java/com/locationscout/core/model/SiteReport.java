package com.locationscout.core.model;

import java.util.*;

/**
 * 사이트 단위 집계 결과.
 * - modalityCounts: accepted 페이지마다, 양수 점수 신호 종류별 1회 증가
 * - topPages: accepted 페이지를 점수 내림차순 정렬 후 상한까지
 *
 * Builder 로 페이지를 하나씩 넣고 build() 로 확정한다.
 */
public record SiteReport(String siteId,
                         String domain,
                         int totalPagesSeen,
                         int acceptedPages,
                         Map<SignalKind, Integer> modalityCounts,
                         List<PageClassification> topPages,
                         String recommendedApproach) {

    public SiteReport {
        Objects.requireNonNull(siteId, "siteId");
        domain = domain == null ? "" : domain;
        EnumMap<SignalKind, Integer> m = new EnumMap<>(SignalKind.class);
        if (modalityCounts != null) m.putAll(modalityCounts);
        modalityCounts = Collections.unmodifiableMap(m);
        topPages = List.copyOf(topPages);
        recommendedApproach = recommendedApproach == null ? "" : recommendedApproach;
    }

    public boolean hasLocations() { return acceptedPages > 0; }

    public Optional<PageClassification> topPage() {
        return topPages.isEmpty() ? Optional.empty() : Optional.of(topPages.get(0));
    }

    public static Builder builder(String siteId, String domain) {
        return new Builder(siteId, domain);
    }

    public static final class Builder {
        private final String siteId;
        private final String domain;
        private int seen;
        private final List<PageClassification> accepted = new ArrayList<>();
        private final EnumMap<SignalKind, Integer> modalities = new EnumMap<>(SignalKind.class);

        private Builder(String siteId, String domain) {
            this.siteId = Objects.requireNonNull(siteId, "siteId");
            this.domain = domain;
        }

        /** 저장된 페이지 1건을 봤음(분류 실패 포함) */
        public Builder seen() { seen++; return this; }

        public Builder add(PageClassification pc) {
            seen++;
            if (pc == null || !pc.accepted()) return this;
            accepted.add(pc);
            EnumSet<SignalKind> kinds = EnumSet.noneOf(SignalKind.class);
            for (Signal s : pc.signals()) {
                if (s.isPositive()) kinds.add(s.kind());
            }
            for (SignalKind k : kinds) modalities.merge(k, 1, Integer::sum);
            return this;
        }

        public Map<SignalKind, Integer> modalities() {
            return Collections.unmodifiableMap(modalities);
        }

        /** 정렬은 안정 정렬(동점이면 투입 순서 유지) */
        public SiteReport build(int topLimit, String recommendedApproach) {
            List<PageClassification> sorted = new ArrayList<>(accepted);
            sorted.sort(Comparator.comparingInt(PageClassification::totalScore).reversed());
            List<PageClassification> top = sorted.subList(0, Math.min(Math.max(0, topLimit), sorted.size()));
            return new SiteReport(siteId, domain, seen, accepted.size(), modalities, top, recommendedApproach);
        }
    }
}
