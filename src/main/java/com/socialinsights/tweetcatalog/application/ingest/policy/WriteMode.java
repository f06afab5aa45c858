package com.socialinsights.tweetcatalog.application.ingest.policy;

/**
 * 엔티티 종류별 쓰기 방식.
 */
public enum WriteMode {

    /**
     * 유니크 제약이 있는 테이블에 "insert, 충돌 시 no-op/update"로 기록한다.
     * <p>동시 워커 간 락 경합으로 데드락 신호가 발생할 수 있으며, 이 경우 배치 단위로 재시도한다.</p>
     */
    UNIQUE_UPSERT,

    /**
     * 유니크 제약이 없는 테이블에 단순 append 한다.
     * <p>중복 제거를 포기하는 대신 충돌(데드락) 신호가 구조적으로 발생하지 않는다.
     * LINK에 적용하면 url을 intern 하지 않고 참조 row에 문자열 그대로 기록한다.</p>
     */
    DENORMALIZED_APPEND
}
