package com.locationscout.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationscout.core.service.RunResult;
import com.locationscout.core.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** 사이트별 결과 행 목록(crawl_results_&lt;ts&gt;.json) */
public final class RunResultsExporter implements ReportExporter {

    private final ObjectMapper om = JsonSupport.mapper();

    @Override
    public Path export(Path outputDir, RunResult result) throws IOException {
        Path out = ReportNaming.resultsPath(outputDir, result.startedAt());
        Files.createDirectories(out.toAbsolutePath().getParent());
        om.writerWithDefaultPrettyPrinter().writeValue(out.toFile(), result.summary().outcomes());
        return out;
    }
}
