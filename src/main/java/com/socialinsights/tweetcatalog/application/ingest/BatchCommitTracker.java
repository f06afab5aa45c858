package com.socialinsights.tweetcatalog.application.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 배치 커밋 한 건의 상태 전이를 기록하고 허용되지 않은 전이를 막는다.
 * <p>
 * 커밋 한 건의 리액티브 체인 안에서만 순차적으로 사용된다.
 */
class BatchCommitTracker {

    private static final Logger LOG = LoggerFactory.getLogger(BatchCommitTracker.class);

    private final String batchLabel;
    private final List<BatchState> transitions = new ArrayList<>();
    private BatchState state = BatchState.PENDING;
    private int attempts;

    BatchCommitTracker(String batchLabel) {
        this.batchLabel = batchLabel;
        transitions.add(state);
    }

    /** 제출 직전 호출. 제출 횟수를 올린다. */
    void submitted() {
        moveTo(BatchState.SUBMITTED);
        attempts++;
    }

    void deadlockDetected() {
        moveTo(BatchState.DEADLOCK_DETECTED);
    }

    void backoff() {
        moveTo(BatchState.BACKOFF);
    }

    void fatal() {
        moveTo(BatchState.FATAL_FAILURE);
    }

    BatchCommitResult committed(int documents, long rowsWritten) {
        moveTo(BatchState.COMMITTED);
        return new BatchCommitResult(state, attempts, retries(), documents, rowsWritten, transitions);
    }

    BatchState state() {
        return state;
    }

    int attempts() {
        return attempts;
    }

    int retries() {
        return Math.max(0, attempts - 1);
    }

    List<BatchState> transitions() {
        return List.copyOf(transitions);
    }

    private void moveTo(BatchState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException(batchLabel + " already finished as " + state + ", cannot move to " + next);
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("illegal batch transition " + state + " -> " + next);
        }
        LOG.debug("{}: {} -> {}", batchLabel, state, next);
        state = next;
        transitions.add(next);
    }
}
