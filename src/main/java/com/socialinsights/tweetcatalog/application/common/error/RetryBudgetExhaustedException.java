package com.socialinsights.tweetcatalog.application.common.error;

/**
 * 데드락 재시도 한도를 모두 소진한 경우의 예외입니다.
 * <p>
 * 조용히 버리지 않고 {@link StoreFatalException}으로 승격되어 보고됩니다.
 */
public class RetryBudgetExhaustedException extends StoreFatalException {

    public RetryBudgetExhaustedException(int attempts, Throwable lastDeadlock) {
        super("retry budget exhausted after " + attempts + " attempts", attempts, lastDeadlock);
    }
}
