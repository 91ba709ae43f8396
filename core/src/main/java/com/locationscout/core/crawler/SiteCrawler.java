package com.locationscout.core.crawler;

import com.locationscout.core.api.IPageRenderer;
import com.locationscout.core.api.IRenderSession;
import com.locationscout.core.api.RenderException;
import com.locationscout.core.api.RenderOptions;
import com.locationscout.core.model.*;
import com.locationscout.core.store.PageStore;
import com.locationscout.core.util.Sleeper;
import com.locationscout.core.util.StructuredLog;
import com.locationscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 사이트 1개 크롤 오케스트레이터.
 *
 * 흐름:
 *  - 프론티어 초기화: 루트 → 인덱스/문서 시드 → 기타 시드(우선 후보 먼저, 상한 maxOtherSeeds)
 *  - 시드와 링크 모두 admit() 하나로 거른다
 *  - 루프: 앞에서 꺼냄 → 렌더 → 저장 → 새 링크를 우선순위 레인에 투입
 *  - 종료: 프론티어 소진 또는 처리 수(성공+실패)가 페이지 예산 도달
 *  - 사이트 내 방문은 순차(동시 요청 1개). 페이지 간 지연은 requestDelay
 *
 * 페이지 단위 예외(RenderException/RuntimeException)는 여기서 잡아 실패 처리하고 계속 진행한다.
 * 세션 열기 실패처럼 페이지 경계 밖의 예외는 호출자(사이트 경계)로 전파된다.
 */
public final class SiteCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(SiteCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(SiteCrawler.class);

    private final ScoutConfig.Crawl cfg;
    private final List<String> denylist;
    private final FrontierRules rules;
    private final Sleeper sleeper;

    public SiteCrawler(ScoutConfig.Crawl cfg, List<String> denylist) {
        this(cfg, denylist, Sleeper.SYSTEM);
    }

    public SiteCrawler(ScoutConfig.Crawl cfg, List<String> denylist, Sleeper sleeper) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.denylist = denylist == null ? List.of() : List.copyOf(denylist);
        this.rules = new FrontierRules(cfg);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public FrontierRules rules() { return rules; }

    /**
     * @param carrierName 요약 파일에 남길 이름
     * @param baseUrl     사이트 루트(정규화 전이어도 됨)
     * @param seeds       URL 발견 결과(null 이면 루트만)
     * @param renderer    사이트 전용 세션을 열 렌더러
     * @param store       이 사이트의 페이지 저장소(시작 시 비움)
     */
    public SiteCrawlState crawl(String carrierName, String baseUrl, DiscoveryResult seeds,
                                IPageRenderer renderer, PageStore store) throws RenderException, IOException {
        String root = UrlUtils.normalize(baseUrl, null);
        if (root == null) throw new IllegalArgumentException("not an http(s) site root: " + baseUrl);
        String domain = UrlUtils.extractDomain(root);

        SiteCrawlState state = new SiteCrawlState(root, domain);
        seedFrontier(state, root, seeds == null ? DiscoveryResult.rootOnly(root) : seeds);
        store.reset();

        LOG.info("Crawl start: site={}, root={}, seeds={}", carrierName, root, state.frontier().size());
        String ua = pickUserAgent();
        StructuredLog slog = SLOG.with("site", carrierName);

        try (IRenderSession session = renderer.openSession(ua)) {
            while (!state.frontier().isEmpty() && state.attempted() < cfg.getMaxPagesPerSite()) {
                if (Thread.currentThread().isInterrupted()) break;

                FrontierUrl next = state.frontier().poll().orElseThrow();
                String url = next.url();
                if (state.isDone(url)) continue;

                boolean settle = state.attempted() == 0 || rules.isIndexPage(url);
                PageOutcome outcome = visit(session, url, settle, state, store);
                if (outcome.isSuccess()) {
                    state.markVisited(outcome.record().orElseThrow());
                } else {
                    state.markFailed(url);
                    LOG.warn("Page failed: {} ({})", url, outcome.failure().orElse(""));
                    slog.warn("page-failed", "url", url, "reason", outcome.failure().orElse(""));
                }

                if (!cfg.getRequestDelay().isZero()) {
                    try {
                        sleeper.sleep(cfg.getRequestDelay());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            state.finish();
        }

        CrawlSummary summary = state.toSummary(carrierName);
        try {
            store.writeSummary(summary);
        } catch (IOException e) {
            LOG.warn("Summary write failed: {} ({})", store.dir(), e.toString());
            slog.warn("summary-write-failed", "dir", store.dir());
        }
        LOG.info("Crawl done: site={}, visited={}, failed={}, queued={}",
                carrierName, state.visited().size(), state.failed().size(), state.frontier().size());
        return state;
    }

    /** 페이지 1건: 예외는 실패 값으로 바꿔 돌려준다 */
    PageOutcome visit(IRenderSession session, String url, boolean settle, SiteCrawlState state, PageStore store) {
        RenderedPage page;
        try {
            page = session.render(url, new RenderOptions(cfg.getPageTimeout(), settle));
        } catch (RenderException e) {
            return PageOutcome.failed(url, e.isTimeout() ? "timeout" : e.getMessage(), e);
        } catch (RuntimeException e) {
            return PageOutcome.failed(url, e.toString(), e);
        }

        if (page == null) return PageOutcome.failed(url, "no response", null);
        if (page.status() >= 400) return PageOutcome.failed(url, "http " + page.status(), null);

        String finalUrl = page.finalUrl() == null ? url : page.finalUrl();
        try {
            store.save(url, finalUrl, page.html());
        } catch (IOException e) {
            LOG.warn("Page save failed: {} ({})", url, e.toString());
        }

        Set<String> links = new LinkedHashSet<>();
        int added = 0;
        for (String raw : page.links()) {
            String n = admit(raw, finalUrl, state.domain());
            if (n == null) continue;
            links.add(n);
            if (state.frontier().offer(new FrontierUrl(n, rules.priorityOf(n)))) added++;
        }
        LOG.debug("Visited: {} status={} links={} (+{})", url, page.status(), links.size(), added);

        PageRecord record = new PageRecord(url, finalUrl, page.status(), page.title(),
                page.html().getBytes(StandardCharsets.UTF_8).length, links, Instant.now());
        return PageOutcome.visited(record);
    }

    /** 루트 맨 앞 → 인덱스/문서 시드(입력 순) → 기타 시드(우선 후보 먼저, 상한) */
    void seedFrontier(SiteCrawlState state, String root, DiscoveryResult seeds) {
        Frontier f = state.frontier();
        f.offerFirst(new FrontierUrl(root, rules.priorityOf(root)));

        List<String> indexSeeds = new ArrayList<>();
        List<String> prioritized = new ArrayList<>();
        List<String> rest = new ArrayList<>();
        for (String s : seeds.urls()) {
            String n = admit(s, root, state.domain());
            if (n == null || n.equals(root)) continue;
            if (rules.isIndexOrDocument(n)) indexSeeds.add(n);
            else if (seeds.priority().contains(s)) prioritized.add(n);
            else rest.add(n);
        }

        for (String s : indexSeeds) f.offerSeed(new FrontierUrl(s, rules.priorityOf(s)));

        List<String> others = new ArrayList<>(prioritized);
        others.addAll(rest);
        int cap = cfg.getMaxOtherSeeds();
        int taken = 0;
        for (String s : others) {
            if (taken >= cap) break;
            if (f.offerSeed(new FrontierUrl(s, FrontierPriority.ORDINARY))) taken++;
        }
    }

    /**
     * 프론티어 입장 판정. 같은 도메인만 받고 차단 목록을 적용한다.
     * 인덱스 페이지와 위치 문서(servicemap.pdf 등)는 차단 목록(.pdf 포함)을 건너뛴다.
     *
     * @return 정규화된 URL, 거부되면 null
     */
    String admit(String raw, String base, String domain) {
        String n = UrlUtils.normalize(raw, base);
        if (n == null || !UrlUtils.sameDomain(n, domain)) return null;
        if (rules.isIndexOrDocument(n)) return n;
        return UrlUtils.isDenied(n, denylist) ? null : n;
    }

    private String pickUserAgent() {
        List<String> uas = cfg.getUserAgents();
        if (uas.isEmpty()) return "LocationScout";
        return uas.get(ThreadLocalRandom.current().nextInt(uas.size()));
    }
}
