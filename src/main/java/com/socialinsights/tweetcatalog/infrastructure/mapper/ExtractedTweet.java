package com.socialinsights.tweetcatalog.infrastructure.mapper;

import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.*;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 트윗 하나에서 추출한 row 묶음.
 *
 * @param author      hydrated 작성자 (작성자 없는 stub 트윗이면 null)
 * @param stubAuthors 멘션/답글 대상 stub 사용자 (작성자 id 제외, id 기준 중복 제거)
 * @param tweet       트윗 row
 * @param urls        트윗-링크 row (문서 내 중복 제거)
 * @param mentions    트윗-멘션 row (문서 내 중복 제거)
 * @param tags        트윗-태그 row (문서 내 대소문자 무시 중복 제거)
 * @param media       트윗-미디어 row (문서 내 중복 제거)
 */
public record ExtractedTweet(
        UserRow author,
        List<UserRow> stubAuthors,
        TweetRow tweet,
        List<TweetUrlRow> urls,
        List<TweetMentionRow> mentions,
        List<TweetTagRow> tags,
        List<TweetMediaRow> media
) {
    public ExtractedTweet {
        Objects.requireNonNull(tweet, "tweet");
        stubAuthors = List.copyOf(stubAuthors);
        urls = List.copyOf(urls);
        mentions = List.copyOf(mentions);
        tags = List.copyOf(tags);
        media = List.copyOf(media);
    }

    /** 이 문서가 만든 row 수(모든 종류) */
    public int rowCount() {
        return (author == null ? 0 : 1) + stubAuthors.size() + 1
                + urls.size() + mentions.size() + tags.size() + media.size();
    }

    /**
     * 문서 하나짜리 배치로 변환한다.
     *
     * @return documents=1 인 배치
     */
    public RowBatch toBatch() {
        return new RowBatch(
                1,
                Stream.ofNullable(author).toList(),
                stubAuthors,
                List.of(tweet),
                urls,
                mentions,
                tags,
                media
        );
    }
}
