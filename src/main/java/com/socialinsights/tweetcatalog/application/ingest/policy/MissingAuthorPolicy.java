package com.socialinsights.tweetcatalog.application.ingest.policy;

/**
 * 작성자(user)가 없는 트윗을 처리하는 방식.
 */
public enum MissingAuthorPolicy {

    /** 작성자 참조를 null로 둔 tweet row만 적재한다. */
    STUB_POST,

    /** 레코드를 건너뛴다. */
    SKIP
}
