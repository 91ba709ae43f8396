package com.locationscout.core.classifier;

import com.locationscout.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.locationscout.core.TestPages.FIVE_ADDRESSES;
import static com.locationscout.core.TestPages.page;
import static com.locationscout.core.TestPages.tiny;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("LocationClassifier: 실격 → 게이트 → 보너스/감점 → 점수")
class LocationClassifierTest {

    private final LocationClassifier classifier = new LocationClassifier(new ScoutConfig.Classifier());

    private static SignalDetector fixed(SignalKind kind, int points, boolean qualifies) {
        return new SignalDetector() {
            @Override public Optional<Signal> detect(PageContext page) {
                return Optional.of(Signal.of(kind, Confidence.HIGH, points, "fixed", ""));
            }
            @Override public boolean qualifies(Signal signal) { return qualifies; }
        };
    }

    private static String kinds(PageClassification pc) {
        StringBuilder sb = new StringBuilder();
        for (Signal s : pc.signals()) sb.append(s.kind()).append(' ');
        return sb.toString().trim();
    }

    @Test
    @DisplayName("최소 크기 미만 페이지는 위치 URL 이어도 실격")
    void tiny_page_is_disqualified_even_on_location_url() {
        PageClassification pc = classifier.classify(tiny("Our Locations"), "https://acme.com/locations");

        assertThat(pc.verdict()).isEqualTo(Verdict.DISQUALIFIED);
        assertThat(pc.totalScore()).isZero();
        assertThat(pc.accepted()).isFalse();
        assertThat(pc.signals()).singleElement()
                .satisfies(s -> assertThat(s.kind()).isEqualTo(SignalKind.DISQUALIFIED));
    }

    @Test
    @DisplayName("주소 5개 → ADDRESS_LIST(10, HIGH) 로 통과")
    void five_addresses_accepted() {
        PageClassification pc = classifier.classify(page("Our Network", FIVE_ADDRESSES), "https://acme.com/network");

        assertThat(pc.verdict()).isEqualTo(Verdict.SCORED);
        assertThat(pc.accepted()).isTrue();
        assertThat(pc.totalScore()).isEqualTo(10);
        assertThat(pc.signals().get(0).kind()).isEqualTo(SignalKind.ADDRESS_LIST);
        assertThat(pc.signals().get(0).confidence()).isEqualTo(Confidence.HIGH);
        assertThat(pc.title()).isEqualTo("Our Network");
    }

    @Test
    @DisplayName("주소 1개(본사)만 있으면 탈락, 진단 신호 NO_LOCATION_CONTENT")
    void single_address_rejected() {
        PageClassification pc = classifier.classify(
                page("Contact Acme", "<p>Head office: 100 Main Street, Dallas, TX 75201</p>"),
                "https://acme.com/contact-us");

        assertThat(pc.verdict()).isEqualTo(Verdict.REJECTED);
        assertThat(pc.totalScore()).isZero();
        assertThat(kinds(pc)).isEqualTo("NO_LOCATION_CONTENT");
    }

    @Test
    @DisplayName("지도 링크 1개는 1점짜리 약한 신호: 게이트 미통과, 신호는 남긴다")
    void single_maps_link_rejected_but_kept() {
        PageClassification pc = classifier.classify(
                page("Contact Acme", "<a href=\"https://maps.google.com/?q=acme+hq\">Directions</a>"),
                "https://acme.com/contact-us");

        assertThat(pc.verdict()).isEqualTo(Verdict.REJECTED);
        assertThat(pc.accepted()).isFalse();
        assertThat(pc.totalScore()).isZero();
        assertThat(pc.signals()).extracting(Signal::kind, Signal::points)
                .containsExactly(tuple(SignalKind.GOOGLE_MAPS_LINK, 1));
    }

    @Test
    @DisplayName("인덱스 URL 은 본문과 무관하게 15점")
    void index_url_scores_fifteen() {
        PageClassification pc = classifier.classify(page("Terminal Locations", "<p>Select a region.</p>"),
                "https://acme.com/locations");

        assertThat(pc.accepted()).isTrue();
        assertThat(pc.totalScore()).isEqualTo(15);
        assertThat(kinds(pc)).isEqualTo("INDEX_PAGE");
    }

    @Test
    @DisplayName("비영어 페이지 실격, 단 위치 URL 이면 통과 후 비미국 감점")
    void non_english() {
        PageClassification about = classifier.classify(page("de", "Über uns", FIVE_ADDRESSES), "https://acme.de/ueber-uns");
        assertThat(about.verdict()).isEqualTo(Verdict.DISQUALIFIED);
        assertThat(about.signals().get(0).rationale()).contains("Non-English");

        PageClassification terminal = classifier.classify(page("de", "Standorte", FIVE_ADDRESSES),
                "https://acme.de/standorte/terminal-hamburg");
        assertThat(terminal.verdict()).isEqualTo(Verdict.SCORED);
        assertThat(kinds(terminal)).isEqualTo("ADDRESS_LIST NON_US_LOCALE");
        assertThat(terminal.totalScore()).isEqualTo(7);
        assertThat(terminal.accepted()).isTrue();
    }

    @Test
    @DisplayName("견적/채용 등 제외 유형은 주소가 많아도 실격")
    void excluded_category_disqualified() {
        PageClassification pc = classifier.classify(page("Request a Quote", FIVE_ADDRESSES), "https://acme.com/get-a-quote");
        assertThat(pc.verdict()).isEqualTo(Verdict.DISQUALIFIED);
        assertThat(pc.signals().get(0).rationale()).contains("quote");
    }

    @Test
    @DisplayName("footer/보일러플레이트 영역의 주소는 세지 않는다")
    void footer_addresses_ignored() {
        PageClassification inFooter = classifier.classify(page("Our Network", "<footer>" + FIVE_ADDRESSES + "</footer>"),
                "https://acme.com/network");
        PageClassification inClass = classifier.classify(
                page("Our Network", "<div class=\"site-footer\">" + FIVE_ADDRESSES + "</div>"),
                "https://acme.com/network");

        assertThat(inFooter.verdict()).isEqualTo(Verdict.REJECTED);
        assertThat(inClass.verdict()).isEqualTo(Verdict.REJECTED);
    }

    @Test
    @DisplayName("찾기 어휘 + 반경 필드 폼 → LOCATION_FINDER(8)")
    void finder_form_accepted() {
        String form = """
                <form action="/search">
                  <label>Find terminal near you</label>
                  <input name="zip">
                  <select name="radius"><option>25 miles</option></select>
                  <button>Search</button>
                </form>
                """;
        PageClassification pc = classifier.classify(page("Acme Tools", form), "https://acme.com/tools");

        assertThat(pc.accepted()).isTrue();
        assertThat(pc.totalScore()).isEqualTo(8);
        assertThat(kinds(pc)).isEqualTo("LOCATION_FINDER");
    }

    @Test
    @DisplayName("감점 합이 커도 점수는 0 아래로 내려가지 않는다")
    void score_floor_at_zero() {
        DetectorRegistry reg = DetectorRegistry.builder()
                .primary(fixed(SignalKind.URL_CONTEXT, 3, true))
                .secondary(fixed(SignalKind.LOW_VALUE_PAGE, -5, false))
                .secondary(fixed(SignalKind.NON_US_LOCALE, -3, false))
                .build();

        PageClassification pc = new LocationClassifier(reg, 3).classify("<html></html>", "https://acme.com/x");

        assertThat(pc.verdict()).isEqualTo(Verdict.SCORED);
        assertThat(pc.totalScore()).isZero();
        assertThat(pc.accepted()).isFalse();
        assertThat(pc.signals()).hasSize(3);
        assertThat(pc.positiveSignals()).extracting(Signal::kind).containsExactly(SignalKind.URL_CONTEXT);
    }

    @Test
    @DisplayName("예외를 던지는 탐지기/실격 규칙은 무시하고 나머지로 판정")
    void throwing_detector_is_isolated() {
        DetectorRegistry reg = DetectorRegistry.builder()
                .disqualifier(p -> { throw new IllegalStateException("bad rule"); })
                .primary(p -> { throw new IllegalStateException("bad detector"); })
                .primary(fixed(SignalKind.GOOGLE_MAPS_LINKS, 5, true))
                .secondary(p -> { throw new RuntimeException("bad bonus"); })
                .build();

        PageClassification pc = new LocationClassifier(reg, 3).classify("<html></html>", "https://acme.com/x");

        assertThat(pc.accepted()).isTrue();
        assertThat(pc.totalScore()).isEqualTo(5);
        assertThat(kinds(pc)).isEqualTo("GOOGLE_MAPS_LINKS");
    }

    @Test
    @DisplayName("대체 신호(URL 문맥)는 1차 게이트가 통과하지 못했을 때만")
    void fallback_only_without_gate() {
        AtomicInteger fallbackCalls = new AtomicInteger();
        SignalDetector counting = new SignalDetector() {
            @Override public Optional<Signal> detect(PageContext page) {
                fallbackCalls.incrementAndGet();
                return Optional.of(Signal.of(SignalKind.URL_CONTEXT, Confidence.MEDIUM, 3, "url", ""));
            }
            @Override public boolean qualifies(Signal signal) { return true; }
        };

        PageClassification weak = new LocationClassifier(DetectorRegistry.builder()
                .primary(fixed(SignalKind.GOOGLE_MAPS_LINK, 1, false))
                .fallback(counting)
                .build(), 3).classify("<html></html>", "https://acme.com/terminal");
        assertThat(kinds(weak)).isEqualTo("GOOGLE_MAPS_LINK URL_CONTEXT");
        assertThat(weak.totalScore()).isEqualTo(4);
        assertThat(fallbackCalls).hasValue(1);

        new LocationClassifier(DetectorRegistry.builder()
                .primary(fixed(SignalKind.INDEX_PAGE, 15, true))
                .fallback(counting)
                .build(), 3).classify("<html></html>", "https://acme.com/locations");
        assertThat(fallbackCalls).hasValue(1);
    }
}
