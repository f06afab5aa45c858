package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

import java.time.LocalDateTime;

/**
 * tweets 테이블의 한 행을 표현하는 Row 객체입니다.
 *
 * @param idTweets            트윗 id
 * @param idUsers             작성자 id (작성자 없는 stub 트윗이면 null)
 * @param createdAt           작성 시각(UTC)
 * @param inReplyToStatusId   답글 대상 트윗 id
 * @param inReplyToUserId     답글 대상 사용자 id
 * @param quotedStatusId      인용 트윗 id
 * @param retweetCount        리트윗 수
 * @param favoriteCount       좋아요 수
 * @param quoteCount          인용 수
 * @param withheldCopyright   저작권 사유 게시 제한 여부
 * @param withheldInCountries 게시 제한 국가 코드(쉼표 구분)
 * @param source              작성 클라이언트
 * @param text                본문(extended 본문 우선)
 * @param countryCode         국가 코드(소문자)
 * @param stateCode           미국 주 코드(소문자)
 * @param lang                언어 코드
 * @param placeName           장소 full name
 * @param geo                 위치 geometry (해석 불가면 {@link GeoValue#UNKNOWN})
 */
public record TweetRow(
        Long idTweets,
        Long idUsers,
        LocalDateTime createdAt,
        Long inReplyToStatusId,
        Long inReplyToUserId,
        Long quotedStatusId,
        Integer retweetCount,
        Integer favoriteCount,
        Integer quoteCount,
        Boolean withheldCopyright,
        String withheldInCountries,
        String source,
        String text,
        String countryCode,
        String stateCode,
        String lang,
        String placeName,
        GeoValue geo
) {}
