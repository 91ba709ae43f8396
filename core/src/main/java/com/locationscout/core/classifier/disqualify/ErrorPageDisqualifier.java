package com.locationscout.core.classifier.disqualify;

import com.locationscout.core.classifier.Disqualifier;
import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.List;
import java.util.Optional;

/**
 * 404/오류/placeholder 페이지 실격.
 * - 제목에 오류 키워드
 * - 본문 h1 이 "404" 또는 "page not found" 로 시작
 * - HTML 이 최소 바이트 미만(렌더 실패/빈 껍데기)
 */
public final class ErrorPageDisqualifier implements Disqualifier {

    static final List<String> ERROR_TITLES = List.of(
            "404", "not found", "page not found", "error", "oops",
            "page does not exist", "page doesn't exist");

    private final int minBytes;

    public ErrorPageDisqualifier(int minBytes) {
        this.minBytes = Math.max(0, minBytes);
    }

    @Override
    public Optional<Signal> check(PageContext page) {
        String title = page.titleLower();
        for (String t : ERROR_TITLES) {
            if (title.contains(t)) return Optional.of(reason("Error page title", page.title()));
        }
        String h = page.htmlLower();
        if (h.contains("<h1>404") || h.contains("<h1>page not found")) {
            return Optional.of(reason("Error heading in body", "h1"));
        }
        int bytes = page.htmlBytes();
        if (bytes < minBytes) {
            return Optional.of(reason("HTML too short (" + bytes + " bytes)", page.title()));
        }
        return Optional.empty();
    }

    private static Signal reason(String why, String evidence) {
        return Signal.of(SignalKind.DISQUALIFIED, Confidence.HIGH, 0, "Error/404 page: " + why, Signal.clip(evidence, 50));
    }
}
