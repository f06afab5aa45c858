package com.socialinsights.tweetcatalog.application.ingest.policy;

/**
 * 이미 존재하는 users row에 full hydration 데이터가 다시 들어왔을 때의 병합 규칙.
 * <p>
 * stub 쓰기는 정책과 무관하게 항상 insert-or-no-op 이며, hydrated 플래그는 true에서 false로 돌아가지 않는다.
 */
public enum AuthorMergePolicy {

    /** stub row만 덮어쓴다. 이미 hydrated 된 row는 먼저 커밋된 값을 유지한다. */
    UPGRADE_STUBS,

    /** 매번 모든 프로필 컬럼을 한 문장으로 덮어쓴다(컬럼이 섞이지 않음). */
    LAST_WRITER_WINS,

    /** null인 컬럼만 채운다. */
    FILL_NULLS
}
