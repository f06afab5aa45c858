package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.application.common.error.RetryBudgetExhaustedException;
import com.socialinsights.tweetcatalog.application.common.error.StoreFatalException;
import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.RowBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 배치 하나를 공유 저장소에 커밋하는 서비스입니다.
 * <p>
 * 1) 종류별 row를 유니크 키 순으로 정렬해 워커 간 락 획득 순서를 맞추고<br>
 * 2) 시도 1회를 하나의 리액티브 트랜잭션({@link TransactionalOperator})으로 감싸며<br>
 * 3) 데드락/직렬화 실패 신호일 때만 무작위 backoff 후 같은 배치를 다시 제출합니다.
 * <p>
 * 재시도 한도 초과는 {@link RetryBudgetExhaustedException}, 그 밖의 오류와 배치 타임아웃은
 * 재시도 없이 {@link StoreFatalException}으로 끝납니다. 어느 경우에도 배치를 조용히 버리지 않습니다.
 *
 * @see BatchState
 */
@Service
public class ConflictSafeBatchWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ConflictSafeBatchWriter.class);

    private static final AtomicLong BATCH_SEQ = new AtomicLong();

    /** 배치를 실제 SQL로 쓰는 경계 */
    private final RowBatchSink sink;

    /** 리액티브 트랜잭션 적용을 위한 operator */
    private final TransactionalOperator tx;

    /** 데드락 신호 판별기 */
    private final StoreErrorClassifier classifier;

    private final LoaderProperties.RetrySettings retry;

    /** 시도 1회당 타임아웃 (null이면 무제한) */
    private final Duration batchTimeout;

    @Autowired
    public ConflictSafeBatchWriter(
            RowBatchSink sink,
            TransactionalOperator tx,
            StoreErrorClassifier classifier,
            LoaderProperties props
    ) {
        this(sink, tx, classifier, props.retry(), props.batchTimeout());
    }

    /**
     * @param sink         배치 쓰기 경계
     * @param tx           리액티브 트랜잭션 오퍼레이터
     * @param classifier   데드락 판별기
     * @param retry        재시도 설정
     * @param batchTimeout 시도 1회당 타임아웃 (nullable)
     */
    public ConflictSafeBatchWriter(
            RowBatchSink sink,
            TransactionalOperator tx,
            StoreErrorClassifier classifier,
            LoaderProperties.RetrySettings retry,
            Duration batchTimeout
    ) {
        this.sink = sink;
        this.tx = tx;
        this.classifier = classifier;
        this.retry = retry;
        this.batchTimeout = batchTimeout;
    }

    /**
     * 배치를 커밋합니다.
     * <p>
     * 빈 배치는 저장소에 제출하지 않습니다.
     *
     * @param batch 확정된 배치
     * @return 커밋 결과(시도/재시도 횟수, 상태 전이 포함)
     * @throws StoreFatalException 재시도 대상이 아닌 실패 또는 재시도 한도 초과 시 (error 시그널)
     */
    public Mono<BatchCommitResult> commit(RowBatch batch) {
        if (batch.isEmpty()) return Mono.just(BatchCommitResult.empty());

        RowBatch ordered = batch.sortedForWrite();

        return Mono.defer(() -> {
            BatchCommitTracker tracker = new BatchCommitTracker("batch-" + BATCH_SEQ.incrementAndGet());

            return Mono.defer(() -> attempt(ordered, tracker))
                    .retryWhen(deadlockRetry(tracker))
                    .map(rows -> tracker.committed(ordered.documents(), rows))
                    .doOnNext(r -> {
                        if (r.retries() > 0) {
                            LOG.info("Batch of {} documents committed after {} attempts", r.documents(), r.attempts());
                        }
                    });
        });
    }

    /** 제출 1회. 데드락은 그대로 올려 재시도 대상으로 두고, 나머지는 치명적 오류로 바꾼다. */
    private Mono<Long> attempt(RowBatch ordered, BatchCommitTracker tracker) {
        tracker.submitted();

        Mono<Long> work = tx.transactional(sink.write(ordered));
        if (batchTimeout != null) {
            work = work.timeout(batchTimeout);
        }

        return work
                .defaultIfEmpty(0L)
                .onErrorResume(e -> {
                    if (classifier.isDeadlock(e)) {
                        tracker.deadlockDetected();
                        return Mono.error(e);
                    }
                    tracker.fatal();
                    LOG.error("Batch of {} documents failed on attempt {} (not retryable): {}",
                            ordered.documents(), tracker.attempts(), e.toString());
                    return Mono.error(new StoreFatalException(
                            "batch write failed: " + e.getMessage(), tracker.attempts(), e));
                });
    }

    private Retry deadlockRetry(BatchCommitTracker tracker) {
        return Retry.backoff(retry.maxRetries(), retry.minBackoff())
                .maxBackoff(retry.maxBackoff())
                .jitter(retry.jitter())
                .filter(e -> !(e instanceof StoreFatalException) && classifier.isDeadlock(e))
                .doBeforeRetry(signal -> {
                    tracker.backoff();
                    LOG.warn("Deadlock on attempt {}, retry {}/{} after backoff: {}",
                            tracker.attempts(), signal.totalRetries() + 1, retry.maxRetries(),
                            signal.failure().toString());
                })
                .onRetryExhaustedThrow((spec, signal) -> {
                    tracker.fatal();
                    LOG.error("Retry budget exhausted after {} attempts", tracker.attempts());
                    return new RetryBudgetExhaustedException(tracker.attempts(), signal.failure());
                });
    }
}
