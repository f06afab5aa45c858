package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo.*;
import org.springframework.stereotype.Component;

/**
 * ingest 과정에서 사용하는 Repository들을 한 곳에 모아 제공하는 파사드(Facade) 컴포넌트입니다.
 * <p>
 * 서비스 레이어에서 다수의 Repo 의존성을 줄이고, 배치 적재 흐름을 읽기 쉽게 구성하기 위한 용도입니다.
 */
@Component
public class IngestFacade {

    /** urls 테이블 관련 작업 (정규화 스키마 전용) */
    public final UrlRepo url;

    /** users 테이블 관련 작업 */
    public final UserRepo user;

    /** tweets 테이블 관련 작업 */
    public final TweetRepo tweet;

    /** tweet_urls 관계 테이블 관련 작업 */
    public final TweetUrlRepo tweetUrl;

    /** tweet_mentions 관계 테이블 관련 작업 */
    public final TweetMentionRepo mention;

    /** tweet_tags 관계 테이블 관련 작업 */
    public final TweetTagRepo tag;

    /** tweet_media 관계 테이블 관련 작업 */
    public final TweetMediaRepo media;

    /**
     * ingest에 필요한 모든 Repository를 주입받아 초기화합니다.
     *
     * @param url url repo
     * @param user user repo
     * @param tweet tweet repo
     * @param tweetUrl tweet-url repo
     * @param mention tweet-mention repo
     * @param tag tweet-tag repo
     * @param media tweet-media repo
     */
    public IngestFacade(
            UrlRepo url,
            UserRepo user,
            TweetRepo tweet,
            TweetUrlRepo tweetUrl,
            TweetMentionRepo mention,
            TweetTagRepo tag,
            TweetMediaRepo media
    ) {
        this.url = url;
        this.user = user;
        this.tweet = tweet;

        this.tweetUrl = tweetUrl;
        this.mention = mention;
        this.tag = tag;
        this.media = media;
    }
}
