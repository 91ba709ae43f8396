package com.locationscout.core.service;

import com.locationscout.core.model.*;
import com.locationscout.core.util.ProgressListener;
import com.locationscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실행 오케스트레이터:
 *  - 사이트 목록을 batchSize 단위로 나눠 고정 스레드풀(동시성=concurrency)에서 처리
 *  - 배치가 끝날 때마다 체크포인트 저장(배치 경계가 유일한 동기화 지점)
 *  - resume 이면 체크포인트의 lastIndex + 1 부터, 기존 결과 목록을 이어서 사용
 *  - 사이트 실패는 error 결과 1건일 뿐 실행을 멈추지 않는다
 */
public final class RunCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(RunCoordinator.class);
    private static final StructuredLog SLOG = StructuredLog.get(RunCoordinator.class);

    private final ScoutConfig.Run cfg;
    private final SitePipeline pipeline;
    private final CheckpointStore checkpoints;

    public RunCoordinator(ScoutConfig.Run cfg, SitePipeline pipeline, CheckpointStore checkpoints) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints");
    }

    public RunResult run(List<Carrier> carriers, int startIndex, boolean resume) {
        return run(carriers, startIndex, resume, ProgressListener.NONE);
    }

    /**
     * @param carriers   전체 사이트 목록(인덱스 = 목록 위치)
     * @param startIndex resume 이 아니거나 체크포인트가 없을 때의 시작 위치
     * @param resume     체크포인트에서 이어서 실행
     */
    public RunResult run(List<Carrier> carriers, int startIndex, boolean resume, ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant startedAt = Instant.now();
        final long t0 = System.nanoTime();

        int firstIndex = Math.max(0, startIndex);
        int from = firstIndex;
        List<SiteOutcome> results = new ArrayList<>();
        List<SiteOutcome> carried = List.of();

        if (resume) {
            Optional<RunCheckpoint> cp = loadCheckpoint();
            if (cp.isPresent()) {
                firstIndex = cp.get().startIndex;
                from = cp.get().resumeIndex();
                carried = new ArrayList<>(cp.get().results);
                results.addAll(carried);
                LOG.info("Resuming from checkpoint: index={}, completed={}", from, carried.size());
            } else {
                LOG.info("No checkpoint at {}; starting at {}", checkpoints.file(), from);
            }
        }

        final int cc = Math.max(1, cfg.getConcurrency());
        final int batchSize = Math.max(1, cfg.getBatchSize());
        final int total = Math.max(0, carriers.size() - from);

        LOG.info("Run start: sites={}, from={}, cc={}, batchSize={}", total, from, cc, batchSize);
        SLOG.info("run-start", "sites", total, "from", from, "cc", cc, "batchSize", batchSize);
        pl.onProgress(0.0, "site", 0, total);

        List<SiteReport> reports = new ArrayList<>();
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("site-worker"));
        final AtomicInteger done = new AtomicInteger(0);

        try {
            for (int batchStart = from; batchStart < carriers.size(); batchStart += batchSize) {
                int batchEnd = Math.min(carriers.size(), batchStart + batchSize);
                List<SiteResult> batch = runBatch(exec, carriers, batchStart, batchEnd, done, total, pl);

                for (SiteResult r : batch) {
                    results.add(r.outcome());
                    r.reportOpt().ifPresent(reports::add);
                }
                saveCheckpoint(RunCheckpoint.of(firstIndex, results));

                int batchNo = (batchStart - from) / batchSize + 1;
                LOG.info("Batch {} done: sites {}..{}, completed {}/{}", batchNo, batchStart, batchEnd - 1, done.get(), total);
                SLOG.info("batch-done", "batch", batchNo, "from", batchStart, "to", batchEnd - 1, "done", done.get(), "total", total);
                pl.onProgress(total == 0 ? 1.0 : (double) done.get() / total, "batch", done.get(), total);
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        // 이전 실행에서 끝난 성공 사이트는 저장소에서 다시 분류해 보고서에 포함
        reports.addAll(0, reclassify(carried));

        double elapsed = (System.nanoTime() - t0) / 1_000_000_000.0;
        RunSummary summary = new RunSummary(results, elapsed);
        LOG.info("Run done: sites={}, withLocations={}, noLocations={}, errors={}, skipped={}",
                summary.total(),
                summary.count(OutcomeStatus.SUCCESS_WITH_LOCATIONS),
                summary.count(OutcomeStatus.SUCCESS_NO_LOCATIONS),
                summary.count(OutcomeStatus.ERROR),
                summary.count(OutcomeStatus.SKIPPED_INVALID_URL));
        SLOG.info("run-done",
                "sites", summary.total(),
                "withLocations", summary.count(OutcomeStatus.SUCCESS_WITH_LOCATIONS),
                "noLocations", summary.count(OutcomeStatus.SUCCESS_NO_LOCATIONS),
                "errors", summary.count(OutcomeStatus.ERROR),
                "skipped", summary.count(OutcomeStatus.SKIPPED_INVALID_URL),
                "elapsedSec", elapsed);
        return new RunResult(startedAt, summary, reports);
    }

    /** 배치 1개: 제출 → 완료 순 수집 → 인덱스 순 정렬 */
    private List<SiteResult> runBatch(ExecutorService exec, List<Carrier> carriers, int from, int to,
                                      AtomicInteger done, int total, ProgressListener pl) {
        CompletionService<SiteResult> ecs = new ExecutorCompletionService<>(exec);
        Map<Future<SiteResult>, Integer> indexOf = new HashMap<>();
        for (int i = from; i < to; i++) {
            final int idx = i;
            final Carrier c = carriers.get(i);
            indexOf.put(ecs.submit(() -> pipeline.run(idx, c)), idx);
        }

        List<SiteResult> out = new ArrayList<>(to - from);
        for (int n = 0; n < to - from; n++) {
            Future<SiteResult> f;
            try {
                f = ecs.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for sites");
            }
            int idx = indexOf.get(f);
            try {
                out.add(f.get());
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                LOG.warn("Site task failed #{}: {}", idx, cause.toString());
                SLOG.with("index", idx).error("site-error", cause);
                out.add(SiteResult.of(SiteOutcome.error(idx, carriers.get(idx), null, cause, 0)));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while collecting results");
            }
            int d = done.incrementAndGet();
            try {
                pl.onProgress(total == 0 ? 1.0 : Math.min(1.0, (double) d / total), "site", d, total);
            } catch (RuntimeException e) {
                LOG.debug("progress listener failed: {}", e.toString());
            }
        }
        out.sort(Comparator.comparingInt(r -> r.outcome().index));
        return out;
    }

    private List<SiteReport> reclassify(List<SiteOutcome> previous) {
        List<SiteReport> out = new ArrayList<>();
        for (SiteOutcome o : previous) {
            if (o.status != OutcomeStatus.SUCCESS_WITH_LOCATIONS && o.status != OutcomeStatus.SUCCESS_NO_LOCATIONS) continue;
            if (o.domain == null || o.domain.isBlank()) continue;
            try {
                out.add(pipeline.classifier().classifySite(o.name, o.domain, pipeline.storeFor(o.domain)));
            } catch (IOException e) {
                LOG.warn("Re-classification skipped for {}: {}", o.domain, e.toString());
            }
        }
        return out;
    }

    private Optional<RunCheckpoint> loadCheckpoint() {
        try {
            return checkpoints.load();
        } catch (IOException e) {
            LOG.warn("Checkpoint unreadable, starting fresh: {} ({})", checkpoints.file(), e.toString());
            return Optional.empty();
        }
    }

    private void saveCheckpoint(RunCheckpoint cp) {
        try {
            checkpoints.save(cp);
            LOG.debug("Checkpoint saved: lastIndex={}, results={}", cp.lastIndex, cp.results.size());
        } catch (IOException e) {
            LOG.warn("Checkpoint write failed: {} ({})", checkpoints.file(), e.toString());
            SLOG.error("checkpoint-failed", e, "file", checkpoints.file());
        }
    }

    /* 스레드 이름 지정(로그 식별용) */
    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
