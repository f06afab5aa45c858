package com.socialinsights.tweetcatalog.application.ingest;

import java.util.List;

/**
 * 커밋에 성공한 배치의 결과.
 *
 * @param state       최종 상태 (항상 COMMITTED)
 * @param attempts    제출 횟수(첫 시도 포함)
 * @param retries     데드락으로 인한 재제출 횟수
 * @param documents   배치에 포함된 문서 수
 * @param rowsWritten 저장소가 보고한 영향 행 수
 * @param transitions 거쳐 온 상태 순서
 */
public record BatchCommitResult(
        BatchState state,
        int attempts,
        int retries,
        int documents,
        long rowsWritten,
        List<BatchState> transitions
) {
    public BatchCommitResult {
        transitions = List.copyOf(transitions);
    }

    /** 빈 배치는 저장소에 제출하지 않고 바로 커밋된 것으로 본다. */
    public static BatchCommitResult empty() {
        return new BatchCommitResult(BatchState.COMMITTED, 0, 0, 0, 0L, List.of(BatchState.PENDING, BatchState.COMMITTED));
    }
}
