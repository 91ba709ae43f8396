package com.locationscout.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationscout.core.model.SiteReport;
import com.locationscout.core.service.RunResult;
import com.locationscout.core.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** 모달리티 보고서(JSON, pretty). 모든 SiteReport 필드를 담아 다시 읽을 수 있다. */
public final class JsonModalityReportExporter implements ReportExporter {

    private final int threshold;
    private final ObjectMapper om = JsonSupport.mapper();

    public JsonModalityReportExporter(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public Path export(Path outputDir, RunResult result) throws IOException {
        Path out = ReportNaming.modalityJsonPath(outputDir, result.startedAt());
        write(out, result.reports());
        return out;
    }

    public void write(Path file, List<SiteReport> reports) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), ModalityReportDocument.of(reports, threshold));
    }

    public static List<SiteReport> readJson(Path file) throws IOException {
        ModalityReportDocument d = JsonSupport.mapper().readValue(file.toFile(), ModalityReportDocument.class);
        return d.toReports();
    }
}
