package com.locationscout.core.classifier;

import com.locationscout.core.model.SignalKind;

import java.util.*;

/** 사이트에서 발견된 모달리티 → 추출 방식 권고(고정 우선순위 조회표). */
public final class RecommendationTable {
    private RecommendationTable() {}

    public static final String NONE = "No location data detected - manual review needed";
    public static final String UNMAPPED = "Manual review needed";

    private record Rule(Set<SignalKind> kinds, String advice) {}

    private static final List<Rule> RULES = List.of(
            new Rule(EnumSet.of(SignalKind.ADDRESS_LIST, SignalKind.ADDRESS_PAIR), "Parse addresses from HTML"),
            new Rule(EnumSet.of(SignalKind.GOOGLE_MAPS_EMBED, SignalKind.GOOGLE_MAPS_API), "Extract from Google Maps embed"),
            // 링크 목록(GOOGLE_MAPS_LINKS)만. 단일 링크는 추출 대상이 아니다
            new Rule(EnumSet.of(SignalKind.GOOGLE_MAPS_LINKS), "Parse Google Maps URLs"),
            new Rule(EnumSet.of(SignalKind.MAP_MAPBOX, SignalKind.MAP_LEAFLET, SignalKind.MAP_ARCGIS), "Query map API/data source"),
            new Rule(EnumSet.of(SignalKind.PDF_SERVICEMAP, SignalKind.PDF_LOCATIONS), "Parse PDF documents"),
            new Rule(EnumSet.of(SignalKind.LOCATION_FINDER, SignalKind.LOCATION_SEARCH), "Automate location search form"),
            new Rule(EnumSet.of(SignalKind.JSON_LD_LOCATIONS), "Parse JSON-LD structured data"));

    public static String recommend(Map<SignalKind, Integer> modalities) {
        if (modalities == null || modalities.isEmpty()) return NONE;
        StringJoiner out = new StringJoiner("; ");
        for (Rule r : RULES) {
            for (SignalKind k : r.kinds()) {
                if (modalities.getOrDefault(k, 0) > 0) {
                    out.add(r.advice());
                    break;
                }
            }
        }
        return out.length() == 0 ? UNMAPPED : out.toString();
    }
}
