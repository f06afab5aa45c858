package com.socialinsights.tweetcatalog.application.ingest.config;

import com.socialinsights.tweetcatalog.application.ingest.policy.AuthorMergePolicy;
import com.socialinsights.tweetcatalog.application.ingest.policy.EntityKind;
import com.socialinsights.tweetcatalog.application.ingest.policy.MissingAuthorPolicy;
import com.socialinsights.tweetcatalog.application.ingest.policy.SchemaVariant;
import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.application.ingest.policy.WritePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * {@code loader.*} 설정 바인딩.
 *
 * <p>쓰기 정책(스키마 종류, 엔티티별 override), 배치 임계값, 데드락 재시도,
 * 동시성 관련 설정을 한 곳에 모은다.</p>
 *
 * @param schemaVariant       프로비저닝된 스키마 종류
 * @param writeModes          엔티티별 쓰기 방식 override
 * @param authorMergePolicy   hydrated 작성자 병합 규칙
 * @param missingAuthorPolicy 작성자 없는 트윗 처리 방식
 * @param batch               배치 flush 임계값
 * @param retry               데드락 재시도 설정
 * @param batchTimeout        커밋 시도 1회당 타임아웃(null이면 무제한)
 * @param concurrency         동시에 적재할 워커 수
 * @param filesPerWorker      워커 하나가 이어서 처리할 파일 수(2 이상이면 작은 파일을 큰 배치로 합친다)
 * @param reverseFileOrder    파일/아카이브 엔트리를 이름 역순으로 처리할지 여부
 * @param progressEvery       N건마다 진행 로그 출력
 */
@ConfigurationProperties(prefix = "loader")
public record LoaderProperties(
        @DefaultValue("NORMALIZED") SchemaVariant schemaVariant,
        Map<EntityKind, WriteMode> writeModes,
        @DefaultValue("UPGRADE_STUBS") AuthorMergePolicy authorMergePolicy,
        @DefaultValue("STUB_POST") MissingAuthorPolicy missingAuthorPolicy,
        @DefaultValue BatchSettings batch,
        @DefaultValue RetrySettings retry,
        Duration batchTimeout,
        @DefaultValue("4") int concurrency,
        @DefaultValue("1") int filesPerWorker,
        @DefaultValue("true") boolean reverseFileOrder,
        @DefaultValue("1000") int progressEvery
) {

    public LoaderProperties {
        writeModes = writeModes == null ? Map.of() : Map.copyOf(writeModes);
        if (concurrency < 1) throw new IllegalArgumentException("loader.concurrency must be >= 1");
        if (filesPerWorker < 1) throw new IllegalArgumentException("loader.files-per-worker must be >= 1");
    }

    /**
     * 배치 flush 임계값.
     *
     * @param maxDocuments 배치당 최대 문서 수
     * @param maxRows      배치당 최대 row 수(모든 종류 합계)
     */
    public record BatchSettings(
            @DefaultValue("1000") int maxDocuments,
            @DefaultValue("20000") int maxRows
    ) {}

    /**
     * 데드락 재시도 설정.
     *
     * @param maxRetries 최대 재시도 횟수(첫 시도 제외)
     * @param minBackoff 첫 backoff
     * @param maxBackoff backoff 상한
     * @param jitter     backoff 무작위화 비율(0~1)
     */
    public record RetrySettings(
            @DefaultValue("8") int maxRetries,
            @DefaultValue("50ms") Duration minBackoff,
            @DefaultValue("2s") Duration maxBackoff,
            @DefaultValue("0.5") double jitter
    ) {}

    /**
     * 스키마 기본값과 override를 합쳐 확정된 쓰기 정책을 만든다.
     *
     * @return 엔티티별 쓰기 정책
     */
    public WritePolicy writePolicy() {
        return WritePolicy.of(schemaVariant, writeModes, authorMergePolicy);
    }
}
