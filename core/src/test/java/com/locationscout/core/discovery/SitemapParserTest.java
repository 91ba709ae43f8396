package com.locationscout.core.discovery;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapParserTest {

    @Test
    void urlset_locations_in_order() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <url><loc>https://acme.com/</loc></url>
                  <url><loc> https://acme.com/terminals </loc><lastmod>2024-01-01</lastmod></url>
                  <url><lastmod>2024-01-01</lastmod></url>
                </urlset>
                """;
        SitemapParser.Sitemap sm = SitemapParser.parse(xml);
        assertThat(sm.index()).isFalse();
        assertThat(sm.locations()).containsExactly("https://acme.com/", "https://acme.com/terminals");
    }

    @Test
    void sitemap_index_lists_children() {
        String xml = """
                <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <sitemap><loc>https://acme.com/sitemap-pages.xml</loc></sitemap>
                  <sitemap><loc>https://acme.com/sitemap-posts.xml</loc></sitemap>
                </sitemapindex>
                """;
        SitemapParser.Sitemap sm = SitemapParser.parse(xml);
        assertThat(sm.index()).isTrue();
        assertThat(sm.locations()).hasSize(2);
    }

    @Test
    void html_error_page_is_not_a_sitemap() {
        assertThat(SitemapParser.looksLikeXml("<html><body>Not found</body></html>")).isFalse();
        assertThat(SitemapParser.parse("<html><body>Not found</body></html>")).isEqualTo(SitemapParser.Sitemap.EMPTY);
        assertThat(SitemapParser.parse(null).locations()).isEmpty();
    }
}
