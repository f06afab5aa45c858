package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.RowBatch;
import reactor.core.publisher.Mono;

/**
 * 배치 하나를 저장소에 쓰는 쓰기 경계.
 * <p>
 * 구현은 트랜잭션을 직접 열지 않는다. 트랜잭션 경계와 재시도는 {@link ConflictSafeBatchWriter}가 담당한다.
 */
public interface RowBatchSink {

    /**
     * @param batch 정렬이 끝난 배치
     * @return 영향을 받은 행 수 합계
     */
    Mono<Long> write(RowBatch batch);
}
