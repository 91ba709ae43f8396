package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * PDF 링크.
 * - 파일명이 서비스/커버리지 지도 계열: PDF_SERVICEMAP(8)
 * - 그 외 위치 관련 문서(파일명 또는 링크 텍스트): PDF_LOCATIONS(2)
 */
public final class PdfLinkDetector implements SignalDetector {

    static final List<String> MAP_DOC_KEYWORDS = List.of(
            "servicemap", "service-map", "terminal-map", "location-map",
            "coverage-map", "network-map", "facility-map", "directory");
    static final List<String> LOCATION_DOC_KEYWORDS = List.of(
            "location", "terminal", "service", "facility", "map");

    @Override
    public Optional<Signal> detect(PageContext page) {
        List<String> maps = new ArrayList<>();
        List<String> docs = new ArrayList<>();
        for (Element a : page.document().select("a[href]")) {
            String href = a.attr("href").toLowerCase(Locale.ROOT);
            if (!href.contains(".pdf")) continue;
            String text = a.text().toLowerCase(Locale.ROOT);
            if (containsAny(href, MAP_DOC_KEYWORDS)) {
                maps.add(href);
            } else if (containsAny(href, LOCATION_DOC_KEYWORDS) || containsAny(text, LOCATION_DOC_KEYWORDS)) {
                docs.add(href);
            }
        }
        if (!maps.isEmpty()) {
            return Optional.of(Signal.of(SignalKind.PDF_SERVICEMAP, Confidence.HIGH, 8,
                    "Service/location map PDF: " + Signal.clip(maps.get(0), 50), join(maps)));
        }
        if (!docs.isEmpty()) {
            return Optional.of(Signal.of(SignalKind.PDF_LOCATIONS, Confidence.MEDIUM, 2,
                    docs.size() + " location-related PDF(s)", join(docs)));
        }
        return Optional.empty();
    }

    private static String join(List<String> hrefs) {
        return String.join("; ", hrefs.subList(0, Math.min(2, hrefs.size())));
    }

    private static boolean containsAny(String s, List<String> needles) {
        for (String n : needles) {
            if (s.contains(n)) return true;
        }
        return false;
    }
}
