package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.application.common.error.DecodeException;
import com.socialinsights.tweetcatalog.application.common.error.ExtractionPolicyException;
import com.socialinsights.tweetcatalog.application.common.error.StoreFatalException;
import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadReport;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadStats;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadStatus;
import com.socialinsights.tweetcatalog.application.ingest.report.SkipReason;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.ArchiveLineReader;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.DecodedTweet;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.TweetDecoder;
import com.socialinsights.tweetcatalog.infrastructure.mapper.ExtractedTweet;
import com.socialinsights.tweetcatalog.infrastructure.mapper.TweetRowExtractor;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.RowBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 워커 하나가 맡은 파일을 읽어 DB에 적재하는 파이프라인 서비스입니다.
 * <p>
 * 흐름: 라인 읽기 → 디코딩 → row 추출 → 배치 누적 → 임계값마다 커밋
 * <p>
 * 레코드 단위 오류(디코딩 실패, 작성자 누락 정책)는 집계만 하고 계속 진행하며,
 * 배치 커밋이 치명적으로 실패하면 해당 파일만 중단합니다.
 * 이 서비스는 error 시그널을 내보내지 않고 결과를 항상 리포트로 돌려줍니다.
 */
@Service
public class TweetFileLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TweetFileLoader.class);

    /** 커밋 대기 중 미리 만들어 둘 배치 수 */
    private static final int BATCH_PREFETCH = 1;

    private final ArchiveLineReader reader;
    private final TweetDecoder decoder;
    private final TweetRowExtractor extractor;
    private final ConflictSafeBatchWriter writer;
    private final LoaderProperties props;

    public TweetFileLoader(
            ArchiveLineReader reader,
            TweetDecoder decoder,
            TweetRowExtractor extractor,
            ConflictSafeBatchWriter writer,
            LoaderProperties props
    ) {
        this.reader = reader;
        this.decoder = decoder;
        this.extractor = extractor;
        this.writer = writer;
        this.props = props;
    }

    /**
     * 파일 하나를 적재합니다.
     *
     * @param file 입력 파일
     * @return 파일 리포트
     */
    public Mono<FileLoadReport> load(Path file) {
        return loadGroup(List.of(file)).next();
    }

    /**
     * 파일 여러 개를 같은 워커에서 순서대로 적재합니다.
     * <p>
     * 한 파일을 다 읽고도 임계값에 못 미친 row는 다음 파일의 첫 배치에 합쳐지고,
     * 마지막 파일이 끝나면 남은 row를 모두 커밋합니다.
     * 리포트는 그룹 전체가 끝난 뒤 입력 순서대로 방출됩니다.
     *
     * @param files 같은 워커가 처리할 파일 목록
     * @return 파일별 리포트
     */
    public Flux<FileLoadReport> loadGroup(List<Path> files) {
        return Flux.defer(() -> {
            WorkerSession session = new WorkerSession(
                    () -> new RowBatchBuilder(props.batch().maxDocuments(), props.batch().maxRows()));
            List<FileLoadStats> all = new ArrayList<>();

            return Flux.fromIterable(files)
                    .concatMap(file -> {
                        FileLoadStats stats = new FileLoadStats(file);
                        all.add(stats);
                        return Mono.fromRunnable(session::startFile)
                                .then(Mono.defer(() -> loadFile(stats, session)))
                                .then(Mono.fromRunnable(session::endFile));
                    })
                    .then(Mono.defer(() -> commitRemainder(session)))
                    .onErrorResume(e -> {
                        LOG.error("Worker failed unexpectedly", e);
                        all.stream()
                                .filter(s -> s.status() == FileLoadStatus.SUCCEEDED)
                                .forEach(s -> s.readFailed(e.toString()));
                        for (Path notStarted : List.copyOf(files.subList(all.size(), files.size()))) {
                            FileLoadStats stats = new FileLoadStats(notStarted);
                            stats.readFailed("not started, worker failed: " + e);
                            all.add(stats);
                        }
                        return Mono.empty();
                    })
                    .thenMany(Flux.defer(() -> Flux.fromIterable(all)))
                    .map(FileLoadStats::toReport)
                    .doOnNext(TweetFileLoader::logReport);
        });
    }

    private Mono<Void> loadFile(FileLoadStats stats, WorkerSession session) {
        Path file = stats.file();
        LOG.info("Loading {}", file);

        Flux<PendingBatch> batches = reader.readLines(file)
                .onErrorResume(e -> {
                    LOG.error("Cannot read {}: {}", file, e.toString());
                    stats.readFailed("read failed: " + e.getMessage());
                    return Flux.empty();
                })
                .index()
                .filter(line -> !line.getT2().isBlank())
                .<PendingBatch>handle((line, sink) -> {
                    toDocument(line.getT1() + 1, line.getT2(), stats)
                            .flatMap(doc -> session.append(stats, doc))
                            .ifPresent(sink::next);
                });

        return batches
                .concatMap(pending -> commit(pending), BATCH_PREFETCH)
                .then()
                .onErrorResume(StoreFatalException.class, e -> {
                    LOG.error("Aborting {} after fatal batch failure: {}", file, e.getMessage());
                    session.discard("aborted with " + file + ": " + e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<BatchCommitResult> commit(PendingBatch pending) {
        return writer.commit(pending.batch())
                .doOnNext(pending::committed)
                .doOnError(StoreFatalException.class, pending::failed);
    }

    /** 그룹의 마지막 파일까지 끝난 뒤 남은 row 커밋 */
    private Mono<Void> commitRemainder(WorkerSession session) {
        PendingBatch rest = session.drain();
        if (rest == null) return Mono.empty();
        return commit(rest)
                .then()
                .onErrorResume(StoreFatalException.class, e -> {
                    LOG.error("Final batch failed: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    /** 라인 하나를 디코딩/추출. 건너뛸 레코드면 사유를 집계하고 empty. */
    private Optional<ExtractedTweet> toDocument(long lineNumber, String line, FileLoadStats stats) {
        long read = stats.documentRead();
        if (props.progressEvery() > 0 && read % props.progressEvery() == 0) {
            LOG.info("{}: {} documents read", stats.file(), read);
        }

        try {
            Optional<DecodedTweet> decoded = decoder.decode(line, lineNumber);
            if (decoded.isEmpty()) {
                stats.skipped(SkipReason.CONTROL_NOTICE);
                LOG.debug("{}:{} control notice skipped", stats.file(), lineNumber);
                return Optional.empty();
            }
            return Optional.of(extractor.extract(decoded.get()));
        } catch (DecodeException e) {
            stats.skipped(SkipReason.MALFORMED_RECORD);
            LOG.warn("{}:{} skipped malformed record: {}", stats.file(), e.lineNumber(), e.getMessage());
            return Optional.empty();
        } catch (ExtractionPolicyException e) {
            stats.skipped(SkipReason.MISSING_AUTHOR);
            LOG.warn("{}:{} skipped record: {}", stats.file(), lineNumber, e.getMessage());
            return Optional.empty();
        }
    }

    private static void logReport(FileLoadReport r) {
        LOG.info("Finished {}: status={}, read={}, loaded={}, skipped={}, batches={}, retried={} ({} retries), failed={}",
                r.file(), r.status(), r.documentsRead(), r.documentsLoaded(), r.skipped(),
                r.batchesCommitted(), r.batchesRetried(), r.retries(), r.batchesFailed());
    }

    /**
     * 워커 하나의 누적 상태. 파일마다 새 배치 빌더를 쓰고, 빌더에 쌓인 문서가 어느 파일에서 왔는지를 함께 관리한다.
     * <p>
     * 파일이 끝났을 때 임계값에 못 미친 row는 꺼내 두었다가 다음 파일의 빌더에 합친다.
     * 읽기 쪽(추가)과 커밋 쪽(실패 시 폐기)이 서로 다른 스레드에서 호출될 수 있어 동기화한다.
     */
    private static final class WorkerSession {

        private final Supplier<RowBatchBuilder> builders;
        private final Map<FileLoadStats, Integer> contributors = new LinkedHashMap<>();
        private RowBatchBuilder builder;

        /** 앞 파일에서 넘어온 미완성 배치 */
        private RowBatch carried;

        private WorkerSession(Supplier<RowBatchBuilder> builders) {
            this.builders = builders;
        }

        synchronized void startFile() {
            builder = builders.get();
            if (carried != null) {
                builder.absorb(carried);
                carried = null;
            }
        }

        /** 문서를 쌓고, 임계값에 도달했으면 배치를 확정해 돌려준다. 이미 중단된 파일의 문서는 버린다. */
        synchronized Optional<PendingBatch> append(FileLoadStats stats, ExtractedTweet doc) {
            if (stats.status() == FileLoadStatus.FATAL_WRITE_FAILURE) return Optional.empty();
            builder.append(doc);
            contributors.merge(stats, 1, Integer::sum);
            return builder.flushIfReady().map(this::pending);
        }

        synchronized void endFile() {
            if (!builder.isEmpty()) carried = builder.drain();
        }

        /** 그룹이 끝난 뒤 남은 row. 없으면 null. */
        synchronized PendingBatch drain() {
            if (carried == null) return null;
            PendingBatch rest = pending(carried);
            carried = null;
            return rest;
        }

        /** 치명적 실패 후 남은 row를 버린다. 그 row에 문서가 실린 파일도 실패로 처리한다. */
        synchronized void discard(String message) {
            contributors.keySet().forEach(s -> s.carriedBatchFailed(message));
            contributors.clear();
            carried = null;
            if (builder != null) builder.clear();
        }

        private PendingBatch pending(RowBatch batch) {
            PendingBatch pending = new PendingBatch(batch, new LinkedHashMap<>(contributors));
            contributors.clear();
            return pending;
        }
    }

    /**
     * 커밋 대기 중인 배치와 파일별 기여 문서 수.
     * 배치 단위 카운터(커밋/재시도/실패)는 배치를 마지막으로 채운 파일(owner)에 기록한다.
     */
    private record PendingBatch(RowBatch batch, Map<FileLoadStats, Integer> contributors) {

        FileLoadStats owner() {
            FileLoadStats last = null;
            for (FileLoadStats s : contributors.keySet()) last = s;
            return last;
        }

        void committed(BatchCommitResult result) {
            contributors.forEach((stats, docs) -> stats.documentsLoaded(docs));
            owner().batchCommitted(result.retries());
        }

        void failed(StoreFatalException e) {
            FileLoadStats owner = owner();
            owner.batchFailed(Math.max(0, e.attempts() - 1), e.getMessage());
            contributors.keySet().stream()
                    .filter(s -> s != owner)
                    .forEach(s -> s.carriedBatchFailed("batch shared with " + owner.file() + " failed: " + e.getMessage()));
        }
    }
}
