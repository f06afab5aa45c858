package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

/**
 * 트윗-멘션 사용자 관계 Row 객체입니다.
 *
 * @param idTweets 트윗 id
 * @param idUsers  멘션된 사용자 id
 */
public record TweetMentionRow(Long idTweets, Long idUsers) {}
