package com.locationscout.core.crawler;

import com.locationscout.core.model.FrontierPriority;
import com.locationscout.core.model.ScoutConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrontierRulesTest {

    private final FrontierRules rules = new FrontierRules(new ScoutConfig.Crawl());

    @Test
    void index_suffixes_win() {
        assertThat(rules.priorityOf("https://acme.com/locations")).isEqualTo(FrontierPriority.INDEX);
        assertThat(rules.priorityOf("https://acme.com/about/terminals/")).isEqualTo(FrontierPriority.INDEX);
        assertThat(rules.priorityOf("https://acme.com/docs/ServiceMap.pdf")).isEqualTo(FrontierPriority.INDEX);
        assertThat(rules.isIndexPage("https://acme.com/locations/dallas")).isFalse();
    }

    @Test
    void keyword_pdf_is_document_lane() {
        assertThat(rules.priorityOf("https://acme.com/files/coverage-area.pdf")).isEqualTo(FrontierPriority.PDF_OR_MAP);
        assertThat(rules.priorityOf("https://acme.com/files/brochure.pdf")).isEqualTo(FrontierPriority.ORDINARY);
        assertThat(rules.isIndexOrDocument("https://acme.com/files/coverage-area.pdf")).isTrue();
    }

    @Test
    void tool_subdomain_matches_host_labels_only() {
        assertThat(rules.priorityOf("https://tools.acme.com/")).isEqualTo(FrontierPriority.TOOL_SUBDOMAIN);
        assertThat(rules.priorityOf("https://www.portal.acme.com/x")).isEqualTo(FrontierPriority.TOOL_SUBDOMAIN);
        assertThat(rules.priorityOf("https://acme.com/tools.html")).isEqualTo(FrontierPriority.ORDINARY);
        assertThat(rules.priorityOf("https://mytools.acme.com/")).isEqualTo(FrontierPriority.ORDINARY);
    }
}
