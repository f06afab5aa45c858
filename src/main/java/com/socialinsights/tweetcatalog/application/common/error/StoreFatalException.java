package com.socialinsights.tweetcatalog.application.common.error;

/**
 * 재시도 대상이 아닌 저장소 오류로 배치 커밋이 최종 실패했음을 나타내는 예외입니다.
 * <p>
 * 연결 끊김, 예상하지 못한 제약 조건 위반, 배치 타임아웃 등이 여기에 해당하며
 * 해당 배치를 소유한 워커만 중단됩니다.
 */
public class StoreFatalException extends RuntimeException {

    /** 실패 시점까지 수행한 제출 횟수 */
    private final int attempts;

    public StoreFatalException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * 실패까지 수행한 제출 횟수를 반환한다.
     *
     * @return 제출 횟수(첫 시도 포함)
     */
    public int attempts() {
        return attempts;
    }
}
