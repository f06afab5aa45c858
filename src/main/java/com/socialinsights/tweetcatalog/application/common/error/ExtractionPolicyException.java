package com.socialinsights.tweetcatalog.application.common.error;

/**
 * 디코딩은 성공했지만 추출 정책상 필수 필드(예: 작성자)가 없어 레코드를 적재하지 않을 때 발생하는 예외입니다.
 */
public class ExtractionPolicyException extends RuntimeException {

    /** 정책 위반이 발생한 트윗 id */
    private final Long tweetId;

    public ExtractionPolicyException(String message, Long tweetId) {
        super(message);
        this.tweetId = tweetId;
    }

    public Long tweetId() {
        return tweetId;
    }
}
