package com.locationscout.core.service.export;

import com.locationscout.core.model.PageClassification;
import com.locationscout.core.model.Signal;
import com.locationscout.core.model.SignalKind;
import com.locationscout.core.model.SiteReport;
import com.locationscout.core.service.RunResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.stream.Collectors;

/** 사람이 읽는 모달리티 보고서(.txt) */
public final class TextModalityReportExporter implements ReportExporter {

    private static final String RULE = "=".repeat(80);
    private static final int TOP_PAGES_SHOWN = 5;

    private final int threshold;

    public TextModalityReportExporter(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public Path export(Path outputDir, RunResult result) throws IOException {
        Path out = ReportNaming.modalityTextPath(outputDir, result.startedAt());
        Files.createDirectories(out.toAbsolutePath().getParent());
        Files.writeString(out, render(result.reports()), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    String render(List<SiteReport> reports) {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("LOCATION DATA MODALITY REPORT");
        lines.add("Score threshold: " + threshold + "+ points");
        lines.add(RULE);
        lines.add("");
        lines.add("Total Sites Analyzed: " + reports.size());
        lines.add("Sites with Location Pages: " + reports.stream().filter(SiteReport::hasLocations).count());
        lines.add("");
        lines.add("MODALITY SUMMARY (sites using each type):");
        lines.add("-".repeat(40));

        Map<SignalKind, Integer> sitesPerKind = new EnumMap<>(SignalKind.class);
        for (SiteReport r : reports) {
            for (SignalKind k : r.modalityCounts().keySet()) sitesPerKind.merge(k, 1, Integer::sum);
        }
        sitesPerKind.entrySet().stream()
                .sorted(Map.Entry.<SignalKind, Integer>comparingByValue().reversed())
                .forEach(e -> lines.add("  " + e.getKey().name() + ": " + e.getValue() + " sites"));

        lines.add("");
        lines.add(RULE);
        lines.add("SITE DETAILS");
        lines.add(RULE);

        List<SiteReport> sorted = new ArrayList<>(reports);
        sorted.sort(Comparator.comparing(SiteReport::siteId));
        for (SiteReport r : sorted) {
            lines.add("");
            lines.add("### " + r.siteId() + " (" + r.domain() + ")");
            lines.add("Total pages: " + r.totalPagesSeen());
            lines.add("Location pages (score >= " + threshold + "): " + r.acceptedPages());
            lines.add("Modalities: " + (r.modalityCounts().isEmpty() ? "None detected" : modalities(r.modalityCounts())));
            lines.add("Approach: " + r.recommendedApproach());
            if (!r.topPages().isEmpty()) {
                lines.add("Top location pages:");
                for (PageClassification p : r.topPages().subList(0, Math.min(TOP_PAGES_SHOWN, r.topPages().size()))) {
                    String label = p.title().isEmpty() ? Signal.clip(p.url(), 40)
                            : (p.title().length() > 40 ? p.title().substring(0, 40) + "..." : p.title());
                    lines.add("  - [" + p.totalScore() + "pts] " + label);
                    lines.add("    " + p.url());
                    lines.add("    Signals: " + p.positiveSignals().stream()
                            .map(s -> s.kind().name() + "(" + s.points() + ")")
                            .collect(Collectors.joining(", ")));
                }
            }
        }
        return String.join("\n", lines) + "\n";
    }

    private static String modalities(Map<SignalKind, Integer> m) {
        return m.entrySet().stream()
                .map(e -> e.getKey().name() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
