package com.locationscout.core.classifier.disqualify;

import com.locationscout.core.classifier.Disqualifier;
import com.locationscout.core.classifier.PageContext;
import com.locationscout.core.model.Confidence;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;

import java.util.List;
import java.util.Optional;

/**
 * 견적/채용/로그인/법무/결제 등 위치와 무관한 페이지 유형 실격.
 * URL 은 host 를 빼고 path+query 만 본다(도메인 이름에 "press", "order" 가 들어간 회사 보호).
 */
public final class ExcludedCategoryDisqualifier implements Disqualifier {

    static final List<String> EXCLUDED = List.of(
            "quote", "get-a-quote", "instant-quote", "request-quote",
            "career", "job", "apply", "hiring",
            "login", "signin", "register", "signup",
            "blog", "news", "press-release", "article",
            "investor", "annual-report", "earnings",
            "privacy", "terms", "cookie", "legal",
            "cart", "checkout", "order");

    private final List<String> keywords;

    public ExcludedCategoryDisqualifier() { this(EXCLUDED); }

    public ExcludedCategoryDisqualifier(List<String> keywords) {
        this.keywords = List.copyOf(keywords);
    }

    @Override
    public Optional<Signal> check(PageContext page) {
        String path = page.pathLower();
        String title = page.titleLower();
        for (String k : keywords) {
            if (path.contains(k) || title.contains(k)) {
                return Optional.of(Signal.of(SignalKind.DISQUALIFIED, Confidence.HIGH, 0,
                        "Excluded page type (" + k + ")", Signal.clip(page.url(), 50)));
            }
        }
        return Optional.empty();
    }
}
