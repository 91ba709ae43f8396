package com.locationscout.core.classifier.detectors;

import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.classifier.SignalDetector;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 본문(header/footer/nav 제거 후) 텍스트의 미국식 주소 개수.
 * - 5개 이상: ADDRESS_LIST(10, 게이트 통과)
 * - 2~4개: ADDRESS_PAIR(3)
 * - 0~1개: 신호 없음(개별 지점/본사 주소는 가치 낮음)
 */
public final class AddressListDetector implements SignalDetector {

    /** 번지 + 도로명 + 도로 유형 + 도시 + 주 + ZIP */
    static final Pattern STREET_ADDRESS = Pattern.compile(
            "\\d{1,5}\\s+[\\w\\s]{1,40}?(?:Street|St|Avenue|Ave|Road|Rd|Drive|Dr|Boulevard|Blvd|Way|Lane|Ln|Highway|Hwy|Parkway|Pkwy)"
                    + "\\.?[,\\s]+[\\w\\s]{1,30}?,?\\s*[A-Z]{2}\\s*\\d{5}",
            Pattern.CASE_INSENSITIVE);

    /** City, ST 12345 (대소문자 구분) */
    static final Pattern CITY_STATE_ZIP = Pattern.compile(
            "[A-Z][a-z]+(?:\\s+[A-Z][a-z]+){0,4},\\s*[A-Z]{2}\\s+\\d{5}");

    static final int MIN_LENGTH = 15;
    public static final int LIST_MIN = 5;
    static final int PAIR_MIN = 2;

    @Override
    public Optional<Signal> detect(PageContext page) {
        Set<String> found = findAddresses(page.mainText());
        int n = found.size();
        if (n >= LIST_MIN) {
            return Optional.of(Signal.of(SignalKind.ADDRESS_LIST, Confidence.HIGH, 10,
                    n + " addresses found - location listing page", evidence(found, 3)));
        }
        if (n >= PAIR_MIN) {
            return Optional.of(Signal.of(SignalKind.ADDRESS_PAIR, Confidence.MEDIUM, 3,
                    n + " addresses found", evidence(found, 2)));
        }
        return Optional.empty();
    }

    @Override
    public boolean qualifies(Signal signal) {
        return signal.kind() == SignalKind.ADDRESS_LIST;
    }

    /**
     * 서로 다른 주소 문자열(등장 순).
     * 도시/주/ZIP 패턴은 전체 주소 매치 구간과 겹치면 버린다(같은 주소 이중 집계 방지).
     */
    static Set<String> findAddresses(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) return out;

        List<int[]> spans = new ArrayList<>();
        Matcher m = STREET_ADDRESS.matcher(text);
        while (m.find()) {
            spans.add(new int[]{m.start(), m.end()});
            addIfLong(out, m.group());
        }
        Matcher c = CITY_STATE_ZIP.matcher(text);
        while (c.find()) {
            if (overlaps(spans, c.start(), c.end())) continue;
            addIfLong(out, c.group());
        }
        return out;
    }

    private static void addIfLong(Set<String> out, String match) {
        String s = match.trim();
        if (s.length() > MIN_LENGTH) out.add(s);
    }

    private static boolean overlaps(List<int[]> spans, int start, int end) {
        for (int[] s : spans) {
            if (start < s[1] && end > s[0]) return true;
        }
        return false;
    }

    private static String evidence(Set<String> found, int max) {
        StringJoiner j = new StringJoiner("; ");
        int i = 0;
        for (String s : found) {
            if (i++ >= max) break;
            j.add(s);
        }
        return j.toString();
    }
}
