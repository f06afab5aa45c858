package com.socialinsights.tweetcatalog.application.ingest.policy;

/**
 * 외부에서 프로비저닝된 스키마 종류. 엔티티별 기본 쓰기 방식을 결정한다.
 */
public enum SchemaVariant {

    /** 유니크 제약 + FK가 있는 정규화 스키마 */
    NORMALIZED(WriteMode.UNIQUE_UPSERT),

    /** 유니크 제약을 제거하고 url을 참조 row에 펼친 스키마 */
    DENORMALIZED(WriteMode.DENORMALIZED_APPEND);

    private final WriteMode defaultMode;

    SchemaVariant(WriteMode defaultMode) {
        this.defaultMode = defaultMode;
    }

    public WriteMode defaultMode() {
        return defaultMode;
    }
}
