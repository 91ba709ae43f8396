package com.locationscout.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SiteReport.Builder: 모달리티 집계/상위 페이지")
class SiteReportTest {

    private static Signal sig(SignalKind k, int pts) {
        return Signal.of(k, Confidence.HIGH, pts, k.name(), "");
    }

    private static PageClassification scored(String url, int threshold, Signal... signals) {
        int sum = 0;
        for (Signal s : signals) sum += s.points();
        return PageClassification.scored(url, "t", List.of(signals), sum, threshold);
    }

    @Test
    @DisplayName("accepted 페이지의 양수 신호 종류만, 페이지당 1회씩 센다")
    void modality_counts_once_per_accepted_page() {
        SiteReport r = SiteReport.builder("Acme", "acme.com")
                .add(scored("https://acme.com/a", 3,
                        sig(SignalKind.ADDRESS_LIST, 10), sig(SignalKind.LOW_VALUE_PAGE, -5)))
                .add(scored("https://acme.com/b", 3,
                        sig(SignalKind.ADDRESS_LIST, 10), sig(SignalKind.MAP_LEAFLET, 3)))
                .add(scored("https://acme.com/c", 3, sig(SignalKind.GOOGLE_MAPS_LINK, 1)))   // 1 < 3 → 탈락
                .add(PageClassification.disqualified("https://acme.com/404", "404",
                        sig(SignalKind.DISQUALIFIED, 0)))
                .seen()
                .build(20, "x");

        assertThat(r.totalPagesSeen()).isEqualTo(5);
        assertThat(r.acceptedPages()).isEqualTo(2);
        assertThat(r.modalityCounts())
                .containsEntry(SignalKind.ADDRESS_LIST, 2)
                .containsEntry(SignalKind.MAP_LEAFLET, 1)
                .doesNotContainKeys(SignalKind.LOW_VALUE_PAGE, SignalKind.GOOGLE_MAPS_LINK);
        assertThat(r.hasLocations()).isTrue();
    }

    @Test
    @DisplayName("상위 페이지는 점수 내림차순, 동점은 투입 순서, 상한 적용")
    void top_pages_sorted_and_limited() {
        SiteReport r = SiteReport.builder("Acme", "acme.com")
                .add(scored("https://acme.com/low", 3, sig(SignalKind.URL_CONTEXT, 3)))
                .add(scored("https://acme.com/first15", 3, sig(SignalKind.INDEX_PAGE, 15)))
                .add(scored("https://acme.com/second15", 3, sig(SignalKind.INDEX_PAGE, 15)))
                .build(2, "x");

        assertThat(r.topPages()).extracting(PageClassification::url)
                .containsExactly("https://acme.com/first15", "https://acme.com/second15");
        assertThat(r.topPage()).map(PageClassification::totalScore).contains(15);
        assertThat(r.acceptedPages()).isEqualTo(3);
    }

    @Test
    void empty_site_has_no_locations() {
        SiteReport r = SiteReport.builder("Acme", null).build(20, "none");
        assertThat(r.hasLocations()).isFalse();
        assertThat(r.topPage()).isEmpty();
        assertThat(r.domain()).isEmpty();
    }
}
