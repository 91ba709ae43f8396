package com.locationscout.core.discovery;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsSitemapParserTest {

    @Test
    void sitemap_directives_case_insensitive_and_deduplicated() {
        String robots = """
                # robots for acme
                User-agent: *
                Disallow: /admin
                Sitemap: https://acme.com/sitemap.xml
                sitemap: https://acme.com/extra.xml   # extra
                SITEMAP: https://acme.com/sitemap.xml
                """;
        assertThat(RobotsSitemapParser.parse(robots))
                .containsExactly("https://acme.com/sitemap.xml", "https://acme.com/extra.xml");
    }

    @Test
    void empty_or_missing_gives_nothing() {
        assertThat(RobotsSitemapParser.parse("")).isEmpty();
        assertThat(RobotsSitemapParser.parse(null)).isEmpty();
        assertThat(RobotsSitemapParser.parse("User-agent: *\nDisallow:\n")).isEmpty();
    }
}
