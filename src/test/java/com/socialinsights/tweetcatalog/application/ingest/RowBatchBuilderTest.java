package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.infrastructure.mapper.ExtractedTweet;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link RowBatchBuilder} 단위 테스트.
 *
 * <p>문서 수/row 수 임계값에서 배치가 확정되는지, 꺼낸 뒤 빌더가 비워지는지,
 * 문서 간 중복은 제거하지 않는지 검증한다.</p>
 */
@DisplayName("row 배치 빌더 테스트")
class RowBatchBuilderTest {

    @DisplayName("문서 수 임계값에 도달하면 배치 확정")
    @Test
    void flushIfReady_documentThreshold() {
        RowBatchBuilder builder = new RowBatchBuilder(2, 1000);

        builder.append(doc(1L, 10L));
        assertEquals(Optional.empty(), builder.flushIfReady());

        builder.append(doc(2L, 10L));
        RowBatch batch = builder.flushIfReady().orElseThrow();

        assertEquals(2, batch.documents());
        assertTrue(builder.isEmpty());
        assertEquals(0, builder.documents());
    }

    /**
     * row 수 임계값은 모든 종류의 row 합계로 판정한다.
     */
    @DisplayName("row 수 임계값에 도달하면 배치 확정")
    @Test
    void isReady_rowThreshold() {
        RowBatchBuilder builder = new RowBatchBuilder(100, 3);

        builder.append(doc(1L, 10L)); // author + tweet + tag = 3
        assertTrue(builder.isReady());
        assertEquals(3, builder.rowCount());
    }

    /**
     * 두 문서가 같은 작성자를 가지면 작성자 row가 두 번 들어간다(중복 해소는 저장소 몫).
     */
    @DisplayName("문서 간 중복은 제거하지 않음")
    @Test
    void append_keepsCrossDocumentDuplicates() {
        RowBatchBuilder builder = new RowBatchBuilder(10, 1000);
        builder.append(doc(1L, 10L));
        builder.append(doc(2L, 10L));

        RowBatch batch = builder.drain();

        assertEquals(2, batch.authors().size());
        assertEquals(List.of(1L, 2L), batch.tweets().stream().map(TweetRow::idTweets).toList());
    }

    @DisplayName("absorb는 남은 배치를 뒤에 합침")
    @Test
    void absorb_appendsPartialBatch() {
        RowBatchBuilder builder = new RowBatchBuilder(10, 1000);
        builder.append(doc(1L, 10L));
        builder.absorb(doc(2L, 11L).toBatch());

        assertEquals(2, builder.documents());
        assertEquals(List.of(1L, 2L), builder.drain().tweets().stream().map(TweetRow::idTweets).toList());
    }

    @DisplayName("임계값이 1 미만이면 생성 실패")
    @Test
    void constructor_rejectsInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new RowBatchBuilder(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new RowBatchBuilder(10, 0));
    }

    @DisplayName("clear는 쌓인 row를 버림")
    @Test
    void clear_discards() {
        RowBatchBuilder builder = new RowBatchBuilder(10, 1000);
        builder.append(doc(1L, 10L));
        builder.clear();

        assertTrue(builder.isEmpty());
        assertTrue(builder.drain().isEmpty());
    }

    static ExtractedTweet doc(long tweetId, long authorId) {
        UserRow author = new UserRow(authorId, true, null, LocalDateTime.of(2020, 1, 1, 0, 0), null,
                null, null, null, null, null, null, "u" + authorId, null, null, null, null);
        TweetRow tweet = new TweetRow(tweetId, authorId, LocalDateTime.of(2020, 1, 1, 0, 0), null, null, null,
                null, null, null, null, null, null, "t", null, null, null, null, GeoValue.UNKNOWN);
        return new ExtractedTweet(author, List.of(), tweet, List.of(), List.of(),
                List.of(new TweetTagRow(tweetId, "#tag")), List.of());
    }
}
