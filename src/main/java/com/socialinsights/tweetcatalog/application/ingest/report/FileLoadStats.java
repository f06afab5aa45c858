package com.socialinsights.tweetcatalog.application.ingest.report;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * 파일 하나를 처리하는 동안 쌓이는 가변 카운터.
 * <p>
 * 해당 파일을 맡은 워커만 갱신하지만, 읽기 스레드와 커밋 스레드가 함께 건드리므로 동기화한다.
 * 끝나면 {@link #toReport()}로 고정한다.
 */
public class FileLoadStats {

    private final Path file;
    private final Map<SkipReason, Long> skipped = new EnumMap<>(SkipReason.class);

    private long documentsRead;
    private long documentsLoaded;
    private long batchesCommitted;
    private long batchesRetried;
    private long retries;
    private long batchesFailed;

    private FileLoadStatus status = FileLoadStatus.SUCCEEDED;
    private String failure;

    public FileLoadStats(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /** @return 지금까지 읽은 레코드 수 */
    public synchronized long documentRead() {
        return ++documentsRead;
    }

    public synchronized void skipped(SkipReason reason) {
        skipped.merge(reason, 1L, Long::sum);
    }

    public synchronized void documentsLoaded(long n) {
        documentsLoaded += n;
    }

    /**
     * @param retriesNeeded 이 배치에 필요했던 재시도 횟수
     */
    public synchronized void batchCommitted(int retriesNeeded) {
        batchesCommitted++;
        if (retriesNeeded > 0) {
            batchesRetried++;
            retries += retriesNeeded;
        }
    }

    /**
     * @param retriesNeeded 실패 전까지의 재시도 횟수
     * @param message       실패 메시지
     */
    public synchronized void batchFailed(int retriesNeeded, String message) {
        batchesFailed++;
        if (retriesNeeded > 0) {
            batchesRetried++;
            retries += retriesNeeded;
        }
        fail(FileLoadStatus.FATAL_WRITE_FAILURE, message);
    }

    /** 이미 쓰기 실패로 끝난 파일은 상태를 바꾸지 않는다. */
    public synchronized void readFailed(String message) {
        fail(FileLoadStatus.READ_FAILURE, message);
    }

    /** 다른 파일의 배치에 실려 있던 문서가 그 배치와 함께 실패한 경우 */
    public synchronized void carriedBatchFailed(String message) {
        fail(FileLoadStatus.FATAL_WRITE_FAILURE, message);
    }

    private synchronized void fail(FileLoadStatus next, String message) {
        if (status == FileLoadStatus.FATAL_WRITE_FAILURE) return;
        status = next;
        failure = message;
    }

    public synchronized FileLoadStatus status() {
        return status;
    }

    public synchronized FileLoadReport toReport() {
        return new FileLoadReport(
                file.toString(),
                status,
                documentsRead,
                documentsLoaded,
                skipped,
                batchesCommitted,
                batchesRetried,
                retries,
                batchesFailed,
                failure
        );
    }
}
