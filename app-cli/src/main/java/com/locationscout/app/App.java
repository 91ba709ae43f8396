package com.locationscout.app;

import com.locationscout.app.logging.LogSetup;
import com.locationscout.core.classifier.LocationClassifier;
import com.locationscout.core.classifier.SiteClassifier;
import com.locationscout.core.crawler.JsoupPageRenderer;
import com.locationscout.core.crawler.SiteCrawler;
import com.locationscout.core.discovery.HttpTextFetcher;
import com.locationscout.core.discovery.UrlDiscovery;
import com.locationscout.core.model.Carrier;
import com.locationscout.core.model.ScoutConfig;
import com.locationscout.core.service.CheckpointStore;
import com.locationscout.core.service.RunCoordinator;
import com.locationscout.core.service.RunResult;
import com.locationscout.core.service.SitePipeline;
import com.locationscout.core.service.export.ExportCoordinator;
import com.locationscout.core.service.export.ReportNaming;
import com.locationscout.core.source.FlatFileCarrierSource;
import com.locationscout.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 명령행 진입점.
 * 사용법: --carriers &lt;tsv&gt; [--config &lt;yml&gt;] [--workers N] [--start N] [--resume] [--out &lt;dir&gt;]
 * 종료 코드: 0 완료, 2 사용법/입력 오류
 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: location-scout --carriers <file.tsv> [options]",
            "  --config <yml>   config file (default: ./locations.yml if present)",
            "  --workers N      concurrent site crawls (run.concurrency)",
            "  --start N        first carrier index (0-based)",
            "  --resume         continue from the last checkpoint",
            "  --out <dir>      output directory (run.outputDir)",
            "  --help           show this help");

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options opts;
        try {
            opts = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (opts.help()) {
            out.println(USAGE);
            return EXIT_OK;
        }

        ScoutConfig cfg;
        List<Carrier> carriers;
        try {
            cfg = loadConfig(opts);
            carriers = new FlatFileCarrierSource(opts.carriers()).load();
        } catch (IOException | RuntimeException e) {
            // 설정/목록 파일 문제(없음, YAML 문법, 값 검증)는 모두 입력 오류
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        Path outDir = cfg.run().getOutputDir();
        LogSetup.init(outDir.resolve("logs"));
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));
        LOG.info("LocationScout start: carriers={}, {}", carriers.size(), cfg);

        RunCoordinator coordinator = wire(cfg);
        RunResult result = coordinator.run(carriers, opts.start(), opts.resume(), (p, phase, done, total) -> {
            if ("batch".equals(phase)) {
                out.printf(Locale.ROOT, "Progress: %d/%d (%.0f%%)%n", done, total, p * 100);
            }
        });

        new ExportCoordinator(cfg.classifier().getAcceptThreshold()).exportAll(outDir, result);

        out.println("=".repeat(80));
        out.println("CRAWL COMPLETE");
        out.println("=".repeat(80));
        result.summary().toLines().forEach(out::println);
        return EXIT_OK;
    }

    /** 설정 파일 → CLI 덮어쓰기 → 검증 */
    static ScoutConfig loadConfig(Options opts) throws IOException {
        ScoutConfig cfg;
        if (opts.config() != null) {
            cfg = YamlConfigLoader.load(opts.config());
        } else if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = ScoutConfig.defaults();
        }
        if (opts.workers() != null) cfg.run().setConcurrency(opts.workers());
        if (opts.out() != null) cfg.run().setOutputDir(opts.out());
        cfg.validate();
        return cfg;
    }

    static RunCoordinator wire(ScoutConfig cfg) {
        ScoutConfig.Crawl crawl = cfg.crawl();
        Path outDir = cfg.run().getOutputDir();

        HttpTextFetcher fetcher = new HttpTextFetcher(cfg.discovery().getFetchTimeout(), crawl.getUserAgents().get(0));
        UrlDiscovery discovery = new UrlDiscovery(fetcher, cfg.discovery());
        SiteCrawler crawler = new SiteCrawler(crawl, cfg.getUrlDenylist());
        SiteClassifier classifier = new SiteClassifier(
                new LocationClassifier(cfg.classifier()), cfg.classifier().getTopPagesLimit());

        SitePipeline pipeline = new SitePipeline(discovery, crawler,
                () -> new JsoupPageRenderer(crawl), classifier, ReportNaming.crawledPagesDir(outDir));
        return new RunCoordinator(cfg.run(), pipeline, new CheckpointStore(ReportNaming.checkpointPath(outDir)));
    }

    /** 파싱된 명령행 옵션 */
    record Options(Path config, Path carriers, Integer workers, int start, boolean resume, Path out, boolean help) {

        static Options parse(String[] args) {
            Path config = null, carriers = null, out = null;
            Integer workers = null;
            int start = 0;
            boolean resume = false, help = false;

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                switch (a) {
                    case "--config" -> config = Path.of(value(args, ++i, a));
                    case "--carriers" -> carriers = Path.of(value(args, ++i, a));
                    case "--out" -> out = Path.of(value(args, ++i, a));
                    case "--workers" -> workers = positive(value(args, ++i, a), a, 1);
                    case "--start" -> start = positive(value(args, ++i, a), a, 0);
                    case "--resume" -> resume = true;
                    case "--help", "-h" -> help = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + a);
                }
            }
            if (!help && carriers == null) throw new IllegalArgumentException("Missing required option: --carriers");
            return new Options(config, carriers, workers, start, resume, out, help);
        }

        private static String value(String[] args, int i, String opt) {
            if (i >= args.length || args[i].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + opt);
            }
            return args[i];
        }

        private static int positive(String v, String opt, int min) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < min) throw new IllegalArgumentException(opt + " must be >= " + min + ": " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(opt + " expects a number: " + v);
            }
        }
    }
}
