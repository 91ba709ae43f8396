package com.locationscout.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** 출력 디렉터리 배치와 파일 이름 규칙 (모두 outputDir 기준) */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    public static final String CHECKPOINT_FILE = "crawl_checkpoint.json";

    public static Path base(Path outputDir) { return outputDir == null ? Paths.get("data") : outputDir; }

    public static Path crawledPagesDir(Path outputDir) { return base(outputDir).resolve("crawled_pages"); }
    public static Path reportsDir(Path outputDir) { return base(outputDir).resolve("reports"); }
    public static Path checkpointPath(Path outputDir) { return base(outputDir).resolve(CHECKPOINT_FILE); }

    public static String timestamp(Instant at) { return TS_FMT.format(at == null ? Instant.now() : at); }

    public static Path modalityTextPath(Path outputDir, Instant at) {
        return reportsDir(outputDir).resolve("modality_report_" + timestamp(at) + ".txt");
    }

    public static Path modalityJsonPath(Path outputDir, Instant at) {
        return reportsDir(outputDir).resolve("modality_report_" + timestamp(at) + ".json");
    }

    public static Path resultsPath(Path outputDir, Instant at) {
        return base(outputDir).resolve("crawl_results_" + timestamp(at) + ".json");
    }
}
