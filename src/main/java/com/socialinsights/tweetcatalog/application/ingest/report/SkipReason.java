package com.socialinsights.tweetcatalog.application.ingest.report;

/** 레코드를 적재하지 않고 건너뛴 사유 */
public enum SkipReason {
    /** JSON 구조 오류, 필수 식별자/시각 누락 */
    MALFORMED_RECORD,
    /** delete, status_withheld 등 트윗이 아닌 스트림 알림 */
    CONTROL_NOTICE,
    /** 작성자 없는 트윗 (SKIP 정책) */
    MISSING_AUTHOR
}
