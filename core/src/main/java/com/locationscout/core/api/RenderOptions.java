package com.locationscout.core.api;

import java.time.Duration;
import java.util.Objects;

/**
 * @param timeout 페이지 1건 상한
 * @param settle  첫 페이지/인덱스 페이지 표시. JS 렌더러라면 캡처 전 대기 + 맨 아래 스크롤,
 *                정적 렌더러(JsoupPageRenderer)는 응답 뒤 같은 시간만큼 쉬는 간격으로 쓴다
 */
public record RenderOptions(Duration timeout, boolean settle) {
    public RenderOptions {
        Objects.requireNonNull(timeout, "timeout");
    }
}
