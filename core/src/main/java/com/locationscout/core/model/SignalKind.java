package com.locationscout.core.model;

/**
 * 신호 종류(=모달리티 태그).
 * 보고서/JSON 에는 name() 그대로 기록된다.
 */
public enum SignalKind {
    // 1차(게이트) 후보
    INDEX_PAGE,
    ADDRESS_LIST,
    ADDRESS_PAIR,
    COORDINATE_DATA,
    GOOGLE_MAPS_EMBED,
    GOOGLE_MAPS_API,
    GOOGLE_MAPS_LINKS,
    GOOGLE_MAPS_LINK,
    LOCATION_FINDER,
    LOCATION_SEARCH,
    URL_CONTEXT,

    // 2차(보너스)
    JSON_LD_LOCATIONS,
    MAP_MAPBOX,
    MAP_LEAFLET,
    MAP_ARCGIS,
    LOCATION_IFRAME,
    PDF_SERVICEMAP,
    PDF_LOCATIONS,

    // 감점
    LOW_VALUE_PAGE,
    NON_US_LOCALE,

    // 진단용(0점)
    DISQUALIFIED,
    NO_LOCATION_CONTENT;

    /** 지도 라이브러리 지문(MAP_*) 여부 */
    public boolean isMapLibrary() {
        return name().startsWith("MAP_");
    }
}
