package com.locationscout.core.discovery;

import com.locationscout.core.model.DiscoveryResult;
import com.locationscout.core.model.ScoutConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("UrlDiscovery: sitemap/robots 기반 후보 수집")
class UrlDiscoveryTest {

    private static String urlset(String... locs) {
        StringBuilder sb = new StringBuilder("<?xml version=\"1.0\"?><urlset>");
        for (String l : locs) sb.append("<url><loc>").append(l).append("</loc></url>");
        return sb.append("</urlset>").toString();
    }

    private static UrlDiscovery discovery(FakeTextFetcher f, ScoutConfig.Discovery cfg) {
        return new UrlDiscovery(f, cfg);
    }

    @Test
    @DisplayName("첫 성공 관례 경로만 쓰고, index 는 하위 sitemap 까지, robots 의 Sitemap 도 병합. 타 도메인만 제외")
    void index_children_and_robots_are_merged() {
        FakeTextFetcher f = new FakeTextFetcher()
                .status("https://acme.com/sitemap.xml", 404)
                .ok("https://acme.com/sitemap_index.xml", """
                        <?xml version="1.0"?>
                        <sitemapindex>
                          <sitemap><loc>https://acme.com/sm-1.xml</loc></sitemap>
                          <sitemap><loc>https://acme.com/sm-2.xml</loc></sitemap>
                        </sitemapindex>
                        """)
                .ok("https://acme.com/sm-1.xml", urlset(
                        "https://www.acme.com/terminals",
                        "https://other.com/x",
                        "https://acme.com/blog/post-1"))
                .ok("https://acme.com/sm-2.xml", urlset("https://acme.com/about/"))
                .ok("https://acme.com/robots.txt", "User-agent: *\nSitemap: https://acme.com/extra.xml\n")
                .ok("https://acme.com/extra.xml", urlset("https://acme.com/services/freight"));

        DiscoveryResult r = discovery(f, new ScoutConfig.Discovery()).discover("https://acme.com");

        assertThat(r.urls()).containsExactlyInAnyOrder(
                "https://www.acme.com/terminals",
                "https://acme.com/blog/post-1",
                "https://acme.com/about",
                "https://acme.com/services/freight",
                "https://acme.com/");
        assertThat(r.priority()).contains("https://www.acme.com/terminals", "https://acme.com/about")
                .doesNotContain("https://acme.com/");
        assertThat(f.requested).doesNotContain("https://acme.com/sitemap/sitemap.xml");
    }

    @Test
    @DisplayName("sitemap 의 위치 PDF 는 기본 설정에서도 후보로 남는다")
    void location_pdfs_survive_default_config() {
        FakeTextFetcher f = new FakeTextFetcher()
                .ok("https://acme.com/sitemap.xml", urlset(
                        "https://acme.com/docs/servicemap.pdf",
                        "https://acme.com/files/Terminal-Directory.pdf",
                        "https://acme.com/terminals"));

        DiscoveryResult r = discovery(f, new ScoutConfig().discovery()).discover("https://acme.com");

        assertThat(r.urls()).containsExactly(
                "https://acme.com/docs/servicemap.pdf",
                "https://acme.com/files/Terminal-Directory.pdf",
                "https://acme.com/terminals",
                "https://acme.com/");
        assertThat(r.priority()).contains("https://acme.com/files/Terminal-Directory.pdf", "https://acme.com/terminals");
    }

    @Test
    @DisplayName("하위 sitemap 은 상한까지만")
    void child_sitemaps_are_capped() {
        FakeTextFetcher f = new FakeTextFetcher()
                .ok("https://acme.com/sitemap.xml", """
                        <sitemapindex>
                          <sitemap><loc>https://acme.com/a.xml</loc></sitemap>
                          <sitemap><loc>https://acme.com/b.xml</loc></sitemap>
                        </sitemapindex>
                        """)
                .ok("https://acme.com/a.xml", urlset("https://acme.com/a"))
                .ok("https://acme.com/b.xml", urlset("https://acme.com/b"));

        DiscoveryResult r = discovery(f, new ScoutConfig.Discovery().setMaxChildSitemaps(1))
                .discover("https://acme.com/");

        assertThat(r.urls()).containsExactlyInAnyOrder("https://acme.com/a", "https://acme.com/");
        assertThat(f.requested).doesNotContain("https://acme.com/b.xml");
    }

    @Test
    @DisplayName("sitemap 이 없거나 깨져도 실패 아님: 루트만 남는다")
    void missing_or_broken_sitemaps_leave_root_only() {
        FakeTextFetcher f = new FakeTextFetcher()
                .ok("https://acme.com/sitemap.xml", "<html><body>Oops</body></html>")
                .fail("https://acme.com/sitemap_index.xml", "connect timed out")
                .fail("https://acme.com/robots.txt", "connect timed out");

        DiscoveryResult r = discovery(f, new ScoutConfig.Discovery()).discover("https://acme.com");

        assertThat(r.urls()).containsExactly("https://acme.com/");
        assertThat(r.priority()).isEmpty();
    }

    @Test
    void non_http_root_is_rejected() {
        UrlDiscovery d = discovery(new FakeTextFetcher(), new ScoutConfig.Discovery());
        assertThatThrownBy(() -> d.discover("ftp://acme.com")).isInstanceOf(IllegalArgumentException.class);
    }
}
