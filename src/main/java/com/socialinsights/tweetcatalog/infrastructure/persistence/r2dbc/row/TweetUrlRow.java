package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

/**
 * 트윗 본문에 포함된 링크 관계 Row 객체입니다.
 *
 * @param idTweets 트윗 id
 * @param url      expanded url
 */
public record TweetUrlRow(Long idTweets, String url) {}
