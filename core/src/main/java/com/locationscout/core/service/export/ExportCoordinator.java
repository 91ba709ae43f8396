package com.locationscout.core.service.export;

import com.locationscout.core.service.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 실행 종료 후 보고서 일괄 생성: 결과 목록 JSON, 모달리티 보고서(txt + json).
 * 한 형식이 실패해도 나머지는 계속 쓴다.
 */
public final class ExportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ExportCoordinator.class);

    private final List<ReportExporter> exporters;

    public ExportCoordinator(int threshold) {
        this(List.of(new RunResultsExporter(),
                new TextModalityReportExporter(threshold),
                new JsonModalityReportExporter(threshold)));
    }

    public ExportCoordinator(List<ReportExporter> exporters) {
        this.exporters = List.copyOf(Objects.requireNonNull(exporters, "exporters"));
    }

    /** @return 실제로 생성된 파일들 */
    public List<Path> exportAll(Path outputDir, RunResult result) {
        List<Path> written = new ArrayList<>();
        for (ReportExporter ex : exporters) {
            try {
                Path p = ex.export(outputDir, result);
                written.add(p);
                LOG.info("Report written: {}", p);
            } catch (IOException e) {
                LOG.warn("Report export failed ({}): {}", ex.getClass().getSimpleName(), e.toString());
            }
        }
        return written;
    }
}
