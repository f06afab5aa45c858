package com.socialinsights.tweetcatalog.application.ingest.policy;

/**
 * 쓰기 정책을 개별 지정할 수 있는 엔티티 종류.
 */
public enum EntityKind {
    /** users 테이블 (hydrated + stub) */
    AUTHOR,
    /** tweets 테이블 */
    POST,
    /** urls 테이블 및 tweet_urls 관계 */
    LINK,
    /** tweet_mentions 관계 */
    MENTION,
    /** tweet_tags 관계 (hashtag, cashtag 공용) */
    TAG,
    /** tweet_media 관계 */
    MEDIA
}
