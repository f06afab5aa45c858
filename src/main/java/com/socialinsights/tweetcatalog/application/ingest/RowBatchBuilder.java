package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.infrastructure.mapper.ExtractedTweet;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 여러 문서에서 추출한 row를 엔티티 종류별로 모아 배치로 만든다.
 *
 * <p>문서 하나를 추가할 때 작성자/stub → 트윗 → 관계 row 순으로 쌓으므로,
 * 어떤 관계 row도 그 소유 트윗/사용자 row보다 먼저 들어가지 않는다.
 * 문서 간 중복은 제거하지 않는다.</p>
 *
 * <p>워커 하나가 독점해서 쓰는 객체이며 thread-safe 하지 않다.</p>
 */
public class RowBatchBuilder {

    private final int maxDocuments;
    private final int maxRows;

    private int documents;
    private final List<UserRow> authors = new ArrayList<>();
    private final List<UserRow> stubAuthors = new ArrayList<>();
    private final List<TweetRow> tweets = new ArrayList<>();
    private final List<TweetUrlRow> tweetUrls = new ArrayList<>();
    private final List<TweetMentionRow> mentions = new ArrayList<>();
    private final List<TweetTagRow> tags = new ArrayList<>();
    private final List<TweetMediaRow> media = new ArrayList<>();

    /**
     * @param maxDocuments 배치당 최대 문서 수
     * @param maxRows      배치당 최대 row 수(모든 종류 합계)
     */
    public RowBatchBuilder(int maxDocuments, int maxRows) {
        if (maxDocuments < 1 || maxRows < 1) {
            throw new IllegalArgumentException("batch thresholds must be >= 1");
        }
        this.maxDocuments = maxDocuments;
        this.maxRows = maxRows;
    }

    /**
     * 문서 하나의 row를 추가한다.
     *
     * @param doc 추출 결과
     */
    public void append(ExtractedTweet doc) {
        documents++;
        if (doc.author() != null) authors.add(doc.author());
        stubAuthors.addAll(doc.stubAuthors());
        tweets.add(doc.tweet());
        tweetUrls.addAll(doc.urls());
        mentions.addAll(doc.mentions());
        tags.addAll(doc.tags());
        media.addAll(doc.media());
    }

    /**
     * 이전 단계에서 넘겨받은 미완성 배치를 합친다.
     * <p>
     * 작은 파일 여러 개를 큰 배치로 이어 적재할 때, 앞 파일의 남은 row를 다음 파일의 배치에 싣는 용도.
     * 합쳐진 row는 이미 쌓여 있던 row 뒤에 붙는다.
     *
     * @param partial 아직 임계값에 도달하지 않은 배치
     */
    public void absorb(RowBatch partial) {
        documents += partial.documents();
        authors.addAll(partial.authors());
        stubAuthors.addAll(partial.stubAuthors());
        tweets.addAll(partial.tweets());
        tweetUrls.addAll(partial.tweetUrls());
        mentions.addAll(partial.mentions());
        tags.addAll(partial.tags());
        media.addAll(partial.media());
    }

    /** 문서 수 또는 row 수 임계값에 도달했는지 */
    public boolean isReady() {
        return documents >= maxDocuments || rowCount() >= maxRows;
    }

    public boolean isEmpty() {
        return documents == 0 && rowCount() == 0;
    }

    public int documents() {
        return documents;
    }

    public int rowCount() {
        return authors.size() + stubAuthors.size() + tweets.size()
                + tweetUrls.size() + mentions.size() + tags.size() + media.size();
    }

    /**
     * 임계값에 도달했으면 지금까지 쌓인 row를 배치로 확정해 꺼낸다.
     *
     * @return 확정된 배치, 아직 임계값 전이면 empty
     */
    public Optional<RowBatch> flushIfReady() {
        return isReady() ? Optional.of(drain()) : Optional.empty();
    }

    /**
     * 임계값과 관계없이 쌓인 row를 모두 꺼내고 비운다.
     *
     * @return 쌓여 있던 row의 배치(비어 있을 수 있음)
     */
    public RowBatch drain() {
        RowBatch batch = new RowBatch(documents, authors, stubAuthors, tweets, tweetUrls, mentions, tags, media);
        clear();
        return batch;
    }

    /** 쌓인 row를 버린다. */
    public void clear() {
        documents = 0;
        authors.clear();
        stubAuthors.clear();
        tweets.clear();
        tweetUrls.clear();
        mentions.clear();
        tags.clear();
        media.clear();
    }
}
