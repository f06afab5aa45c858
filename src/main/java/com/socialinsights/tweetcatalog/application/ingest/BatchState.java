package com.socialinsights.tweetcatalog.application.ingest;

import java.util.EnumSet;
import java.util.Set;

/**
 * 배치 커밋 한 건의 상태.
 *
 * <pre>
 * PENDING → SUBMITTED → COMMITTED
 *                     → DEADLOCK_DETECTED → BACKOFF → SUBMITTED
 *                     → FATAL_FAILURE
 * </pre>
 * COMMITTED, FATAL_FAILURE는 종료 상태다. 재시도 한도를 넘긴 데드락도 FATAL_FAILURE로 끝난다.
 */
public enum BatchState {
    PENDING,
    SUBMITTED,
    DEADLOCK_DETECTED,
    BACKOFF,
    COMMITTED,
    FATAL_FAILURE;

    public boolean isTerminal() {
        return this == COMMITTED || this == FATAL_FAILURE;
    }

    /**
     * @param next 다음 상태
     * @return 허용된 전이인지 여부
     */
    public boolean canTransitionTo(BatchState next) {
        return allowedNext().contains(next);
    }

    private Set<BatchState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(SUBMITTED);
            case SUBMITTED -> EnumSet.of(COMMITTED, DEADLOCK_DETECTED, FATAL_FAILURE);
            case DEADLOCK_DETECTED -> EnumSet.of(BACKOFF, FATAL_FAILURE);
            case BACKOFF -> EnumSet.of(SUBMITTED);
            case COMMITTED, FATAL_FAILURE -> EnumSet.noneOf(BatchState.class);
        };
    }
}
