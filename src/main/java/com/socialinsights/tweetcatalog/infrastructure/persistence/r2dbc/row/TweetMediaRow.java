package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

/**
 * 트윗 첨부 미디어 관계 Row 객체입니다.
 *
 * @param idTweets 트윗 id
 * @param url      media url
 * @param type     미디어 종류(photo, video, animated_gif)
 */
public record TweetMediaRow(Long idTweets, String url, String type) {}
