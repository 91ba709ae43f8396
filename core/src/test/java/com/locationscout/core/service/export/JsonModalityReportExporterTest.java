package com.locationscout.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.locationscout.core.model.SiteReport;
import com.locationscout.core.util.JsonSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonModalityReportExporterTest {

    @TempDir
    Path tmp;

    @Test
    void written_report_reads_back_into_site_reports() throws Exception {
        Path f = tmp.resolve("reports/modality.json");
        List<SiteReport> reports = List.of(Reports.acme(), Reports.empty());

        new JsonModalityReportExporter(3).write(f, reports);

        assertThat(JsonModalityReportExporter.readJson(f)).isEqualTo(reports);
    }

    @Test
    void document_layout() throws Exception {
        Path f = new JsonModalityReportExporter(3).export(tmp, Reports.result());
        JsonNode root = JsonSupport.mapper().readTree(f.toFile());

        assertThat(f.getFileName().toString()).endsWith(".json");
        assertThat(root.path("score_threshold").asInt()).isEqualTo(3);
        assertThat(root.path("total_sites").asInt()).isEqualTo(2);
        assertThat(root.path("sites_with_locations").asInt()).isEqualTo(1);

        JsonNode acme = root.path("sites").get(0);
        assertThat(acme.path("carrier_name").asText()).isEqualTo("Acme Freight");
        assertThat(acme.path("modalities_found").path("ADDRESS_LIST").asInt()).isEqualTo(1);
        assertThat(acme.path("top_pages").get(0).path("signals").get(0).path("signal_type").asText())
                .isEqualTo("INDEX_PAGE");
    }
}
