package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.application.ingest.policy.AuthorMergePolicy;
import com.socialinsights.tweetcatalog.application.ingest.policy.EntityKind;
import com.socialinsights.tweetcatalog.application.ingest.policy.SchemaVariant;
import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.application.ingest.policy.WritePolicy;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.LinkRefs;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo.*;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * {@link TweetIngestService} 단위 테스트.
 *
 * <p>배치 저장 오케스트레이션(url intern → users → stub → tweets → 관계 row)이
 * FK 의존 순서대로 수행되고, 쓰기 정책에 맞는 모드와 링크 참조 방식이 전달되는지 검증한다.</p>
 *
 * <p>중간 단계에서 에러가 발생할 경우 에러가 전파되고,
 * 이후 단계가 호출되지 않는지(중단)도 검증한다.</p>
 */
@DisplayName("배치 저장 오케스트레이션 테스트")
class TweetIngestServiceTest {

    private UrlRepo urlRepo;
    private UserRepo userRepo;
    private TweetRepo tweetRepo;
    private TweetUrlRepo tweetUrlRepo;
    private TweetMentionRepo mentionRepo;
    private TweetTagRepo tagRepo;
    private TweetMediaRepo mediaRepo;
    private IngestFacade ingestDb;

    private RowBatch batch;

    @BeforeEach
    void setUp() {
        urlRepo = mock(UrlRepo.class);
        userRepo = mock(UserRepo.class);
        tweetRepo = mock(TweetRepo.class);
        tweetUrlRepo = mock(TweetUrlRepo.class);
        mentionRepo = mock(TweetMentionRepo.class);
        tagRepo = mock(TweetTagRepo.class);
        mediaRepo = mock(TweetMediaRepo.class);

        ingestDb = new IngestFacade(urlRepo, userRepo, tweetRepo, tweetUrlRepo, mentionRepo, tagRepo, mediaRepo);

        UserRow author = new UserRow(10L, true, null, LocalDateTime.of(2020, 1, 1, 0, 0), "https://a",
                null, null, null, null, null, null, "alice", null, null, null, null);
        TweetRow tweet = new TweetRow(1L, 10L, LocalDateTime.of(2020, 1, 1, 0, 0), null, null, null,
                null, null, null, null, null, null, "t", null, null, null, null, GeoValue.UNKNOWN);

        batch = new RowBatch(
                1,
                List.of(author),
                List.of(UserRow.stub(20L, "bob", null)),
                List.of(tweet),
                List.of(new TweetUrlRow(1L, "https://b")),
                List.of(new TweetMentionRow(1L, 20L)),
                List.of(new TweetTagRow(1L, "#java")),
                List.of(new TweetMediaRow(1L, "https://m", "photo"))
        );
    }

    /**
     * 정규화 정책이면 url을 먼저 intern 하고, 모든 단계를 FK 순서대로 UNIQUE_UPSERT로 호출한다.
     */
    @DisplayName("정규화: url intern 후 FK 순서대로 저장, 결과 합산")
    @Test
    void write_normalized_internsLinks_andWritesInFkOrder() {
        // given
        TweetIngestService service = new TweetIngestService(ingestDb, WritePolicy.normalized());
        List<String> links = List.of("https://a", "https://b", "https://m");

        when(urlRepo.insertIgnore(links)).thenReturn(Mono.just(3L));
        when(urlRepo.fetchUrlIds(links)).thenReturn(Mono.just(Map.of("https://a", 1L, "https://b", 2L, "https://m", 3L)));
        stubAllWrites();

        // when / then
        StepVerifier.create(service.write(batch))
                .expectNext(7L)
                .verifyComplete();

        InOrder inOrder = inOrder(urlRepo, userRepo, tweetRepo, tweetUrlRepo, mentionRepo, tagRepo, mediaRepo);

        inOrder.verify(urlRepo).insertIgnore(links);
        inOrder.verify(urlRepo).fetchUrlIds(links);

        ArgumentCaptor<LinkRefs> refs = ArgumentCaptor.forClass(LinkRefs.class);
        inOrder.verify(userRepo).upsertHydrated(eq(batch.authors()), refs.capture(),
                eq(WriteMode.UNIQUE_UPSERT), eq(AuthorMergePolicy.UPGRADE_STUBS));
        inOrder.verify(userRepo).insertStubs(eq(batch.stubAuthors()), any(), eq(WriteMode.UNIQUE_UPSERT));
        inOrder.verify(tweetRepo).insert(batch.tweets(), WriteMode.UNIQUE_UPSERT);
        inOrder.verify(tweetUrlRepo).insert(eq(batch.tweetUrls()), any(), eq(WriteMode.UNIQUE_UPSERT));
        inOrder.verify(mentionRepo).insert(batch.mentions(), WriteMode.UNIQUE_UPSERT);
        inOrder.verify(tagRepo).insert(batch.tags(), WriteMode.UNIQUE_UPSERT);
        inOrder.verify(mediaRepo).insert(eq(batch.media()), any(), eq(WriteMode.UNIQUE_UPSERT));

        assertTrue(refs.getValue().isInterned());
        assertEquals("id_urls", refs.getValue().column());
    }

    /**
     * 비정규화 정책이면 urls 테이블을 쓰지 않고 url 문자열을 그대로 저장하며 모두 append 한다.
     */
    @DisplayName("비정규화: urls 테이블 없이 inline 링크로 append")
    @Test
    void write_denormalized_inlineLinks_andAppends() {
        // given
        TweetIngestService service = new TweetIngestService(ingestDb, WritePolicy.denormalized());
        stubAllWrites();

        // when / then
        StepVerifier.create(service.write(batch))
                .expectNext(7L)
                .verifyComplete();

        verifyNoInteractions(urlRepo);

        ArgumentCaptor<LinkRefs> refs = ArgumentCaptor.forClass(LinkRefs.class);
        verify(tweetUrlRepo).insert(eq(batch.tweetUrls()), refs.capture(), eq(WriteMode.DENORMALIZED_APPEND));
        assertFalse(refs.getValue().isInterned());
        assertEquals("url", refs.getValue().column());
        verify(tweetRepo).insert(batch.tweets(), WriteMode.DENORMALIZED_APPEND);
    }

    /**
     * append 모드에서는 같은 배치에서 hydrated로 저장되는 사용자의 stub을 쓰지 않는다.
     * 작성자의 마지막 row가 stub이 되어 프로필이 사라지는 일을 막는다.
     */
    @DisplayName("비정규화: 같은 배치의 hydrated 작성자 stub은 append 하지 않음")
    @Test
    void write_denormalized_dropsStubsOfHydratedAuthors() {
        // given
        UserRow author = batch.authors().get(0);
        UserRow selfStub = UserRow.stub(author.idUsers(), "alice", null);
        UserRow otherStub = UserRow.stub(20L, "bob", null);
        RowBatch mentionsAuthor = new RowBatch(2, batch.authors(), List.of(selfStub, otherStub),
                batch.tweets(), batch.tweetUrls(), batch.mentions(), batch.tags(), batch.media());
        TweetIngestService service = new TweetIngestService(ingestDb, WritePolicy.denormalized());
        stubAllWrites();

        // when
        StepVerifier.create(service.write(mentionsAuthor)).expectNextCount(1).verifyComplete();

        // then
        verify(userRepo).insertStubs(eq(List.of(otherStub)), any(), eq(WriteMode.DENORMALIZED_APPEND));
    }

    /**
     * upsert 모드의 stub은 기존 row를 건드리지 않으므로 걸러내지 않고 그대로 넘긴다.
     */
    @DisplayName("정규화: stub은 hydrated 작성자와 겹쳐도 그대로 전달")
    @Test
    void write_normalized_keepsStubsOfHydratedAuthors() {
        // given
        UserRow selfStub = UserRow.stub(10L, "alice", null);
        RowBatch mentionsAuthor = new RowBatch(1, batch.authors(), List.of(selfStub),
                batch.tweets(), List.of(), List.of(), List.of(), List.of());
        WritePolicy policy = WritePolicy.of(SchemaVariant.NORMALIZED,
                Map.of(EntityKind.LINK, WriteMode.DENORMALIZED_APPEND), AuthorMergePolicy.UPGRADE_STUBS);
        TweetIngestService service = new TweetIngestService(ingestDb, policy);
        stubAllWrites();

        // when
        StepVerifier.create(service.write(mentionsAuthor)).expectNextCount(1).verifyComplete();

        // then
        verify(userRepo).insertStubs(eq(List.of(selfStub)), any(), eq(WriteMode.UNIQUE_UPSERT));
    }

    /**
     * 엔티티별 override가 해당 Repo 호출에만 적용된다.
     */
    @DisplayName("엔티티별 override는 해당 종류에만 적용")
    @Test
    void write_perKindOverride() {
        // given
        WritePolicy policy = WritePolicy.of(SchemaVariant.DENORMALIZED,
                Map.of(EntityKind.AUTHOR, WriteMode.UNIQUE_UPSERT), AuthorMergePolicy.LAST_WRITER_WINS);
        TweetIngestService service = new TweetIngestService(ingestDb, policy);
        stubAllWrites();

        // when
        StepVerifier.create(service.write(batch)).expectNextCount(1).verifyComplete();

        // then
        verify(userRepo).upsertHydrated(eq(batch.authors()), any(),
                eq(WriteMode.UNIQUE_UPSERT), eq(AuthorMergePolicy.LAST_WRITER_WINS));
        verify(tagRepo).insert(batch.tags(), WriteMode.DENORMALIZED_APPEND);
    }

    /**
     * 트윗 저장이 실패하면 에러가 그대로 전파되고, 관계 row 저장은 호출되지 않는다.
     */
    @DisplayName("중간 단계에서 에러가 발생하면 이후 단계가 호출되지 않는지 검증")
    @Test
    void write_propagatesError_andStopsDownstream() {
        // given
        TweetIngestService service = new TweetIngestService(ingestDb, WritePolicy.denormalized());
        when(userRepo.upsertHydrated(any(), any(), any(), any())).thenReturn(Mono.just(1L));
        when(userRepo.insertStubs(any(), any(), any())).thenReturn(Mono.just(1L));
        when(tweetRepo.insert(any(), any())).thenReturn(Mono.error(new RuntimeException("fail")));

        // when / then
        StepVerifier.create(service.write(batch))
                .expectErrorMessage("fail")
                .verify();

        verifyNoInteractions(tweetUrlRepo, mentionRepo, tagRepo, mediaRepo);
    }

    private void stubAllWrites() {
        when(userRepo.upsertHydrated(any(), any(), any(), any())).thenReturn(Mono.just(1L));
        when(userRepo.insertStubs(any(), any(), any())).thenReturn(Mono.just(1L));
        when(tweetRepo.insert(any(), any())).thenReturn(Mono.just(1L));
        when(tweetUrlRepo.insert(any(), any(), any())).thenReturn(Mono.just(1L));
        when(mentionRepo.insert(any(), any())).thenReturn(Mono.just(1L));
        when(tagRepo.insert(any(), any())).thenReturn(Mono.just(1L));
        when(mediaRepo.insert(any(), any(), any())).thenReturn(Mono.just(1L));
    }
}
