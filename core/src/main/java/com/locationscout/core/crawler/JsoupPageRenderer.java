package com.locationscout.core.crawler;

import com.locationscout.core.api.IPageRenderer;
import com.locationscout.core.api.IRenderSession;
import com.locationscout.core.api.RenderException;
import com.locationscout.core.api.RenderOptions;
import com.locationscout.core.model.RenderedPage;
import com.locationscout.core.model.ScoutConfig;
import com.locationscout.core.util.Sleeper;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 기본 JSoup 기반 렌더러: 정적 HTML 만 받는다(JS 실행 없음).
 * - 리다이렉트 추적, HTTP 오류도 상태 코드로 돌려줌(ignoreHttpErrors)
 * - a[href] → abs:href 수집(없으면 원문 href)
 * - settle 요청은 내용에 영향이 없다(JS/스크롤 엔진 없음). 대신 응답을 다 받은 뒤
 *   settleDelay + scrollDelay 만큼 쉬어, 첫 페이지와 인덱스 페이지 뒤의 요청 간격으로 쓴다
 */
public final class JsoupPageRenderer implements IPageRenderer {
    private final ScoutConfig.Crawl cfg;
    private final Sleeper sleeper;

    public JsoupPageRenderer(ScoutConfig.Crawl cfg) {
        this(cfg, Sleeper.SYSTEM);
    }

    public JsoupPageRenderer(ScoutConfig.Crawl cfg, Sleeper sleeper) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public IRenderSession openSession(String userAgent) {
        return new Session(userAgent == null || userAgent.isBlank() ? "LocationScout" : userAgent);
    }

    private final class Session implements IRenderSession {
        private final String userAgent;

        private Session(String userAgent) { this.userAgent = userAgent; }

        @Override
        public RenderedPage render(String url, RenderOptions options) throws RenderException {
            // jsoup timeout은 int 필요 → 안전 캐스팅
            long clamped = Math.max(0, Math.min(Integer.MAX_VALUE, options.timeout().toMillis()));
            try {
                Connection.Response res = Jsoup.connect(url)
                        .userAgent(userAgent)
                        .timeout((int) clamped)
                        .followRedirects(true)
                        .ignoreHttpErrors(true)
                        .header("Accept-Language", "en-US,en;q=0.9")
                        .execute();

                int status = res.statusCode();
                String finalUrl = res.url().toString();
                if (status >= 400) {
                    return new RenderedPage(status, finalUrl, "", "", List.of());
                }

                String html = res.body();
                Document doc = Jsoup.parse(html, finalUrl);

                List<String> links = new ArrayList<>();
                for (Element a : doc.select("a[href]")) {
                    String abs = a.attr("abs:href");
                    String href = (abs == null || abs.isBlank()) ? a.attr("href") : abs;
                    if (!href.isBlank()) links.add(href.trim());
                }
                if (options.settle()) pace();
                return new RenderedPage(status, finalUrl, html, doc.title(), links);

            } catch (SocketTimeoutException e) {
                throw new RenderException("timeout after " + clamped + "ms: " + url, e, true);
            } catch (IOException e) {
                throw new RenderException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new RenderException("bad url: " + url, e);
            }
        }

        /** 응답 처리 후 대기(호스트 부담 완화). 캡처된 HTML 은 이미 확정 */
        private void pace() throws RenderException {
            try {
                sleeper.sleep(cfg.getSettleDelay());
                sleeper.sleep(cfg.getScrollDelay());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RenderException("interrupted while pacing", ie);
            }
        }
    }
}
