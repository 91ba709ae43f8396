package com.locationscout.core.crawler;

import com.locationscout.core.FakeRenderer;
import com.locationscout.core.discovery.TextFetcher;
import com.locationscout.core.discovery.UrlDiscovery;
import com.locationscout.core.model.CrawlSummary;
import com.locationscout.core.model.DiscoveryResult;
import com.locationscout.core.model.FrontierPriority;
import com.locationscout.core.model.FrontierUrl;
import com.locationscout.core.model.ScoutConfig;
import com.locationscout.core.store.PageStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SiteCrawler: 우선순위 순회, 예산, 실패 격리")
class SiteCrawlerTest {

    private static final String ROOT = "https://acme.com/";

    @TempDir
    Path tmp;

    private static SiteCrawler crawler(ScoutConfig.Crawl cfg) {
        return new SiteCrawler(cfg, ScoutConfig.DEFAULT_URL_DENYLIST, d -> {});
    }

    private static FakeRenderer graph() {
        return new FakeRenderer()
                .page(ROOT, "<html><head><title>Acme</title></head><body>home</body></html>",
                        "/about", "/locations", "https://other.com/x", "/about#team",
                        "/blog/post-1", "/broken", "mailto:ops@acme.com")
                .page("https://acme.com/locations", "<html><body>list</body></html>",
                        "https://acme.com/terminal/dallas", "/")
                .page("https://acme.com/about", "<html><body>about</body></html>")
                .page("https://acme.com/terminal/dallas", "<html><body>dallas</body></html>")
                .fail("https://acme.com/broken");
    }

    @Test
    @DisplayName("루트 → 인덱스 우선 → 일반 링크 FIFO, 타 도메인/차단 링크 제외, 실패는 건너뛰고 계속")
    void crawl_order_and_failures() throws Exception {
        FakeRenderer r = graph();
        PageStore store = new PageStore(tmp.resolve("acme_com"));

        SiteCrawlState st = crawler(new ScoutConfig.Crawl()).crawl("Acme", "https://acme.com", null, r, store);

        assertThat(r.requested()).containsExactly(
                ROOT,
                "https://acme.com/locations",
                "https://acme.com/about",
                "https://acme.com/broken",
                "https://acme.com/terminal/dallas");
        assertThat(st.visited()).containsExactly(
                ROOT, "https://acme.com/locations", "https://acme.com/about", "https://acme.com/terminal/dallas");
        assertThat(st.failed()).containsExactly("https://acme.com/broken");
        assertThat(st.frontier().isEmpty()).isTrue();
        assertThat(store.pageFiles()).hasSize(4);
    }

    @Test
    @DisplayName("settle 은 첫 페이지와 인덱스 페이지에만")
    void settle_only_root_and_index() throws Exception {
        FakeRenderer r = graph();
        crawler(new ScoutConfig.Crawl()).crawl("Acme", ROOT, null, r, new PageStore(tmp.resolve("s")));

        assertThat(r.settled()).containsExactlyInAnyOrder(ROOT, "https://acme.com/locations");
    }

    @Test
    @DisplayName("페이지 예산은 성공+실패 수 기준")
    void budget_counts_attempts() throws Exception {
        FakeRenderer r = new FakeRenderer()
                .page(ROOT, "<html><body>home</body></html>", "/a", "/b", "/c")
                .fail("https://acme.com/a")
                .page("https://acme.com/b", "<html><body>b</body></html>");

        SiteCrawlState st = crawler(new ScoutConfig.Crawl().setMaxPagesPerSite(2))
                .crawl("Acme", ROOT, null, r, new PageStore(tmp.resolve("b")));

        assertThat(st.attempted()).isEqualTo(2);
        assertThat(r.requested()).containsExactly(ROOT, "https://acme.com/a");
        assertThat(st.frontier().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("HTTP 4xx/5xx 는 실패로 기록되고 저장하지 않는다")
    void http_error_is_failure() throws Exception {
        FakeRenderer r = new FakeRenderer()
                .page(ROOT, "<html><body>home</body></html>", "/gone")
                .status("https://acme.com/gone", 404);
        PageStore store = new PageStore(tmp.resolve("e"));

        SiteCrawlState st = crawler(new ScoutConfig.Crawl()).crawl("Acme", ROOT, null, r, store);

        assertThat(st.failed()).containsExactly("https://acme.com/gone");
        assertThat(store.pageFiles()).hasSize(1);
    }

    @Test
    @DisplayName("시드 분할: 인덱스 시드 먼저, 그다음 우선 후보, 기타 시드는 상한까지")
    void seeds_are_split_and_capped() throws Exception {
        String terminals = "https://acme.com/terminals";
        String contact = "https://acme.com/contact";
        String x = "https://acme.com/x";
        String y = "https://acme.com/y";
        DiscoveryResult seeds = new DiscoveryResult(
                new LinkedHashSet<>(List.of(ROOT, x, contact, y, terminals)),
                Set.of(contact));

        FakeRenderer r = new FakeRenderer()
                .page(ROOT, "<html><body>home</body></html>")
                .page(terminals, "<html><body>t</body></html>")
                .page(contact, "<html><body>c</body></html>")
                .page(x, "<html><body>x</body></html>")
                .page(y, "<html><body>y</body></html>");

        crawler(new ScoutConfig.Crawl().setMaxOtherSeeds(2))
                .crawl("Acme", ROOT, seeds, r, new PageStore(tmp.resolve("seeds")));

        assertThat(r.requested()).containsExactly(ROOT, terminals, contact, x);
    }

    @Test
    @DisplayName("기본 설정으로 발견 → 시드: 루트, 인덱스/위치 PDF, 상한 내 기타 시드 순. 차단 목록은 기타 시드에만")
    void discovered_location_pdfs_are_seeded_after_root() {
        ScoutConfig cfg = new ScoutConfig();
        cfg.crawl().setMaxOtherSeeds(2);
        Map<String, String> bodies = Map.of("https://acme.com/sitemap.xml", """
                <?xml version="1.0"?>
                <urlset>
                  <url><loc>https://acme.com/news/2024-rates</loc></url>
                  <url><loc>https://acme.com/about</loc></url>
                  <url><loc>https://acme.com/docs/servicemap.pdf</loc></url>
                  <url><loc>https://acme.com/contact</loc></url>
                  <url><loc>https://acme.com/brochure.pdf</loc></url>
                  <url><loc>https://acme.com/terminals</loc></url>
                  <url><loc>https://acme.com/careers</loc></url>
                  <url><loc>https://acme.com/pricing</loc></url>
                </urlset>
                """);
        TextFetcher fetcher = uri -> {
            String body = bodies.get(uri.toString());
            return body == null ? TextFetcher.Response.ok(404, "", uri) : TextFetcher.Response.ok(200, body, uri);
        };

        DiscoveryResult seeds = new UrlDiscovery(fetcher, cfg.discovery()).discover(ROOT);
        SiteCrawler c = new SiteCrawler(cfg.crawl(), cfg.getUrlDenylist(), d -> {});
        SiteCrawlState st = new SiteCrawlState(ROOT, "acme.com");
        c.seedFrontier(st, ROOT, seeds);

        assertThat(st.frontier().snapshot()).extracting(FrontierUrl::url).containsExactly(
                ROOT,
                "https://acme.com/docs/servicemap.pdf",
                "https://acme.com/terminals",
                "https://acme.com/about",
                "https://acme.com/contact");
        assertThat(st.frontier().snapshot().get(1).priority()).isEqualTo(FrontierPriority.INDEX);
    }

    @Test
    @DisplayName("페이지의 위치 PDF 링크는 .pdf 차단과 무관하게 앞 레인으로, 일반 PDF 는 제외")
    void location_pdf_links_jump_the_queue() throws Exception {
        String coverage = "https://acme.com/files/coverage-map.pdf";
        FakeRenderer r = new FakeRenderer()
                .page(ROOT, "<html><body>home</body></html>", "/about", "/files/coverage-map.pdf", "/files/menu.pdf")
                .page("https://acme.com/about", "<html><body>about</body></html>")
                .fail(coverage);

        SiteCrawlState st = crawler(new ScoutConfig.Crawl()).crawl("Acme", ROOT, null, r, new PageStore(tmp.resolve("pdf")));

        assertThat(r.requested()).containsExactly(ROOT, coverage, "https://acme.com/about");
        assertThat(st.failed()).containsExactly(coverage);
    }

    @Test
    @DisplayName("요약 파일 기록 + 이전 실행 파일은 시작 시 삭제")
    void summary_written_and_store_reset() throws Exception {
        PageStore store = new PageStore(tmp.resolve("acme_com"));
        Files.createDirectories(store.dir());
        Files.writeString(store.dir().resolve("stale0000000.html"), "old");

        SiteCrawlState st = crawler(new ScoutConfig.Crawl()).crawl("Acme", ROOT, null, graph(), store);

        assertThat(store.dir().resolve("stale0000000.html")).doesNotExist();
        CrawlSummary s = store.readSummary().orElseThrow();
        assertThat(s.carrierName).isEqualTo("Acme");
        assertThat(s.domain).isEqualTo("acme.com");
        assertThat(s.crawlStats.pagesCrawled).isEqualTo(4);
        assertThat(s.crawlStats.pagesFailed).isEqualTo(1);
        assertThat(st.finishedAt()).isPresent();
    }

    @Test
    @DisplayName("requestDelay 는 페이지마다 Sleeper 로 대기")
    void request_delay_uses_sleeper() throws Exception {
        List<Duration> sleeps = new ArrayList<>();
        ScoutConfig.Crawl cfg = new ScoutConfig.Crawl().setRequestDelay(Duration.ofMillis(300));
        SiteCrawler c = new SiteCrawler(cfg, List.of(), sleeps::add);

        c.crawl("Acme", ROOT, null,
                new FakeRenderer().page(ROOT, "<html><body>home</body></html>", "/a")
                        .page("https://acme.com/a", "<html><body>a</body></html>"),
                new PageStore(tmp.resolve("d")));

        assertThat(sleeps).containsExactly(Duration.ofMillis(300), Duration.ofMillis(300));
    }
}
