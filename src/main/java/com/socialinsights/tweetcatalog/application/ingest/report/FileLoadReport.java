package com.socialinsights.tweetcatalog.application.ingest.report;

import java.util.Map;

/**
 * 파일 하나의 적재 리포트.
 *
 * @param file             파일 경로
 * @param status           최종 상태
 * @param documentsRead    읽은 레코드 수(빈 줄 제외)
 * @param documentsLoaded  커밋된 배치에 포함된 문서 수
 * @param skipped          사유별 skip 건수
 * @param batchesCommitted 커밋된 배치 수
 * @param batchesRetried   데드락 재시도가 한 번 이상 필요했던 배치 수
 * @param retries          재시도 총 횟수
 * @param batchesFailed    치명적으로 실패한 배치 수
 * @param failure          실패 메시지 (성공이면 null)
 */
public record FileLoadReport(
        String file,
        FileLoadStatus status,
        long documentsRead,
        long documentsLoaded,
        Map<SkipReason, Long> skipped,
        long batchesCommitted,
        long batchesRetried,
        long retries,
        long batchesFailed,
        String failure
) {
    public FileLoadReport {
        skipped = Map.copyOf(skipped);
    }

    public boolean succeeded() {
        return status == FileLoadStatus.SUCCEEDED;
    }

    public long skipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0L);
    }

    public long skippedTotal() {
        return skipped.values().stream().mapToLong(Long::longValue).sum();
    }
}
