package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 한 번의 트랜잭션 시도로 제출되는 row 묶음입니다.
 * <p>
 * 엔티티 종류별 리스트로 나뉘며, 각 리스트는 FK 의존 순서(작성자 → 트윗 → 관계 row)로 제출됩니다.
 * 문서 간 중복은 제거하지 않습니다(저장소의 upsert/append 규칙이 처리).
 *
 * @param documents   이 배치에 포함된 문서 수
 * @param authors     hydrated 작성자
 * @param stubAuthors 참조로만 관측된 stub 사용자
 * @param tweets      트윗
 * @param tweetUrls   트윗-링크 관계
 * @param mentions    트윗-멘션 관계
 * @param tags        트윗-태그 관계
 * @param media       트윗-미디어 관계
 */
public record RowBatch(
        int documents,
        List<UserRow> authors,
        List<UserRow> stubAuthors,
        List<TweetRow> tweets,
        List<TweetUrlRow> tweetUrls,
        List<TweetMentionRow> mentions,
        List<TweetTagRow> tags,
        List<TweetMediaRow> media
) {

    private static final Comparator<Long> IDS = Comparator.nullsFirst(Comparator.naturalOrder());
    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.naturalOrder());

    public RowBatch {
        authors = List.copyOf(authors);
        stubAuthors = List.copyOf(stubAuthors);
        tweets = List.copyOf(tweets);
        tweetUrls = List.copyOf(tweetUrls);
        mentions = List.copyOf(mentions);
        tags = List.copyOf(tags);
        media = List.copyOf(media);
    }

    public boolean isEmpty() {
        return documents == 0 && rowCount() == 0;
    }

    /** 모든 종류의 row 수 합계 */
    public int rowCount() {
        return authors.size() + stubAuthors.size() + tweets.size()
                + tweetUrls.size() + mentions.size() + tags.size() + media.size();
    }

    /**
     * 종류별 row를 유니크 키(자연키) 순으로 정렬한 배치를 반환한다.
     * <p>
     * 모든 워커가 같은 순서로 키에 접근하도록 해 인덱스 락 순서 역전(데드락) 빈도를 줄인다.
     * 정렬은 stable 하므로 같은 키의 row는 문서 순서를 유지한다.
     *
     * @return 정렬된 배치
     */
    public RowBatch sortedForWrite() {
        return new RowBatch(
                documents,
                sorted(authors, Comparator.comparing(UserRow::idUsers, IDS)),
                sorted(stubAuthors, Comparator.comparing(UserRow::idUsers, IDS)),
                sorted(tweets, Comparator.comparing(TweetRow::idTweets, IDS)),
                sorted(tweetUrls, Comparator.comparing(TweetUrlRow::idTweets, IDS)
                        .thenComparing(TweetUrlRow::url, TEXT)),
                sorted(mentions, Comparator.comparing(TweetMentionRow::idTweets, IDS)
                        .thenComparing(TweetMentionRow::idUsers, IDS)),
                sorted(tags, Comparator.comparing(TweetTagRow::idTweets, IDS)
                        .thenComparing(TweetTagRow::tag, TEXT)),
                sorted(media, Comparator.comparing(TweetMediaRow::idTweets, IDS)
                        .thenComparing(TweetMediaRow::url, TEXT))
        );
    }

    /**
     * 배치가 참조하는 모든 url(작성자 프로필, 본문 링크, 미디어)을 중복 없이 반환한다.
     *
     * @return distinct url 목록
     */
    public List<String> linkValues() {
        return Stream.of(
                        authors.stream().map(UserRow::url),
                        tweetUrls.stream().map(TweetUrlRow::url),
                        media.stream().map(TweetMediaRow::url)
                )
                .flatMap(s -> s)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    private static <T> List<T> sorted(List<T> rows, Comparator<T> order) {
        List<T> out = new ArrayList<>(rows);
        out.sort(order);
        return out;
    }
}
