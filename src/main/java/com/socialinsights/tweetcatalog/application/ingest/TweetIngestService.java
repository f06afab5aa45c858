package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.application.ingest.policy.EntityKind;
import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.application.ingest.policy.WritePolicy;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.LinkRefs;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.RowBatch;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.UserRow;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 정렬된 {@link RowBatch}를 스키마에 맞는 SQL로 저장하는 서비스입니다.
 * <p>
 * 한 배치 단위로 다음 순서로 저장합니다:
 * urls → users(hydrated) → users(stub) → tweets → (tweet_urls, tweet_mentions, tweet_tags, tweet_media)
 * <p>
 * 트랜잭션 경계는 호출하는 {@link ConflictSafeBatchWriter}가 시도 단위로 잡습니다.
 * 이 서비스는 같은 트랜잭션 안에서 순차 실행만 보장합니다.
 */
@Service
public class TweetIngestService implements RowBatchSink {

    /** 배치 적재에 필요한 Repo들을 묶은 파사드 */
    private final IngestFacade ingestDb;

    /** 엔티티 종류별 쓰기 방식 */
    private final WritePolicy policy;

    /**
     * 의존성을 주입받아 서비스를 초기화합니다.
     *
     * @param ingestDb Repo 파사드
     * @param policy 쓰기 정책
     */
    public TweetIngestService(IngestFacade ingestDb, WritePolicy policy) {
        this.ingestDb = ingestDb;
        this.policy = policy;
    }

    /**
     * 배치를 저장합니다.
     * <p>
     * 링크를 intern 하는 정책이면 url을 먼저 저장하고 id 매핑을 확보한 뒤 나머지를 저장합니다.
     *
     * @param batch 저장할 배치
     * @return 영향을 받은 행 수 합계
     */
    @Override
    public Mono<Long> write(RowBatch batch) {
        return linkRefs(batch).flatMap(links -> writeRows(batch, links));
    }

    private Mono<LinkRefs> linkRefs(RowBatch batch) {
        if (!policy.internsLinks()) return Mono.just(LinkRefs.inline());

        List<String> urls = batch.linkValues();
        return ingestDb.url.insertIgnore(urls)
                .then(ingestDb.url.fetchUrlIds(urls))
                .map(LinkRefs::interned);
    }

    /**
     * FK 의존 순서대로 저장하고 결과를 합산합니다.
     * <p>
     * 각 단계는 앞 단계가 끝난 뒤에 만들어지므로, 중간에 실패하면 이후 단계는 호출되지 않습니다.
     *
     * @param batch 저장할 배치
     * @param links 링크 참조 방식
     * @return 영향을 받은 행 수 합계
     */
    private Mono<Long> writeRows(RowBatch batch, LinkRefs links) {
        List<Mono<Long>> steps = List.of(
                Mono.defer(() -> ingestDb.user.upsertHydrated(batch.authors(), links,
                        policy.modeOf(EntityKind.AUTHOR), policy.authorMergePolicy())),
                Mono.defer(() -> ingestDb.user.insertStubs(stubsToWrite(batch), links, policy.modeOf(EntityKind.AUTHOR))),
                Mono.defer(() -> ingestDb.tweet.insert(batch.tweets(), policy.modeOf(EntityKind.POST))),
                Mono.defer(() -> ingestDb.tweetUrl.insert(batch.tweetUrls(), links, policy.modeOf(EntityKind.LINK))),
                Mono.defer(() -> ingestDb.mention.insert(batch.mentions(), policy.modeOf(EntityKind.MENTION))),
                Mono.defer(() -> ingestDb.tag.insert(batch.tags(), policy.modeOf(EntityKind.TAG))),
                Mono.defer(() -> ingestDb.media.insert(batch.media(), links, policy.modeOf(EntityKind.MEDIA)))
        );

        return Flux.concat(steps).reduce(0L, Long::sum);
    }

    /**
     * 저장할 stub 사용자를 고릅니다.
     * <p>
     * append 모드에서는 stub도 새 row로 추가되므로, 같은 배치에서 hydrated로 저장되는 사용자의 stub은 뺍니다.
     * 그래야 작성자의 최신 row가 stub으로 내려가지 않습니다.
     */
    private List<UserRow> stubsToWrite(RowBatch batch) {
        if (policy.modeOf(EntityKind.AUTHOR) != WriteMode.DENORMALIZED_APPEND) return batch.stubAuthors();

        Set<Long> hydrated = batch.authors().stream()
                .map(UserRow::idUsers)
                .collect(Collectors.toSet());
        return batch.stubAuthors().stream()
                .filter(stub -> !hydrated.contains(stub.idUsers()))
                .toList();
    }
}
