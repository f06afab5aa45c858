package com.socialinsights.tweetcatalog.application.common.error;

/**
 * 구조적으로 올바르지 않은 레코드(JSON 파싱 실패, 필수 식별자 누락 등)를 나타내는 예외입니다.
 * <p>
 * 레코드 단위 오류이므로 파일 적재를 중단시키지 않고, 해당 레코드만 건너뛰고 집계합니다.
 */
public class DecodeException extends RuntimeException {

    /** 문제가 된 레코드의 라인 번호(1부터 시작, 알 수 없으면 0) */
    private final long lineNumber;

    public DecodeException(String message, long lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }

    public DecodeException(String message, long lineNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 실패한 레코드의 라인 번호를 반환한다.
     *
     * @return 라인 번호
     */
    public long lineNumber() {
        return lineNumber;
    }
}
