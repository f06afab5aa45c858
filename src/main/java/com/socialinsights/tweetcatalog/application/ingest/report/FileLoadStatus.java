package com.socialinsights.tweetcatalog.application.ingest.report;

/** 파일 하나의 최종 적재 결과 */
public enum FileLoadStatus {
    /** 모든 배치 커밋 성공 (레코드 단위 skip은 있을 수 있음) */
    SUCCEEDED,
    /** 배치 커밋이 치명적으로 실패해 파일 처리를 중단함 */
    FATAL_WRITE_FAILURE,
    /** 파일을 열거나 읽는 중 실패함 */
    READ_FAILURE
}
