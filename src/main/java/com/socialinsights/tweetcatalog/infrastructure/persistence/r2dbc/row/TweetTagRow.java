package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

/**
 * 트윗-태그 관계 Row 객체입니다.
 * <p>
 * hashtag와 cashtag는 같은 테이블을 쓰며 접두 문자({@code #}, {@code $})로 구분합니다.
 *
 * @param idTweets 트윗 id
 * @param tag      접두 문자를 포함한 태그
 */
public record TweetTagRow(Long idTweets, String tag) {}
