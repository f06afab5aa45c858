package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc;

import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * R2DBC 기반 배치 SQL 처리를 위한 공통 유틸/베이스 클래스입니다.
 * <p>
 * 대량 입력을 chunk 단위로 나누어 순차 실행하고, 처리 결과(rowsUpdated)를 합산하는 기능과
 * null-safe 바인딩, multi-row VALUES 절과 충돌 처리 절 생성 편의 메서드를 제공합니다.
 */
public abstract class BatchSqlSupport {

    /** VALUES 템플릿에서 row 번호로 치환되는 자리 */
    protected static final String ROW_INDEX = "{i}";

    /** R2DBC SQL 실행을 위한 DatabaseClient */
    protected final DatabaseClient db;

    /**
     * {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    protected BatchSqlSupport(DatabaseClient db) {
        this.db = db;
    }

    /**
     * 주어진 아이템 목록을 chunk 단위로 분할하여 순차(concat) 처리하고,
     * 각 처리 결과를 합산하여 반환합니다.
     * <p>
     * 순차 실행이므로 한 트랜잭션 안에서 chunk 순서(= 정렬된 키 순서)대로 락을 잡습니다.
     *
     * @param items  처리할 전체 아이템 목록
     * @param chunk  한 번에 처리할 chunk 크기
     * @param onceFn chunk 단위로 실행할 함수(각 chunk에 대한 rowsUpdated 반환)
     * @param <T>    아이템 타입
     * @return 처리된 rowsUpdated 합계
     */
    protected <T> Mono<Long> chunkedSum(
            List<T> items,
            int chunk,
            Function<List<T>, Mono<Long>> onceFn
    ) {
        if (items == null || items.isEmpty()) return Mono.just(0L);
        return Flux.fromIterable(items)
                .buffer(chunk)
                .concatMap(onceFn)
                .reduce(0L, Long::sum);
    }

    /**
     * 값이 null인 경우 {@code bindNull}, 아니면 {@code bind}를 수행하는 null-safe 바인딩 헬퍼입니다.
     *
     * @param spec 바인딩 대상 {@link org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec}
     * @param name 파라미터 이름
     * @param value 바인딩할 값(Nullable)
     * @param type null 바인딩 시 사용할 타입
     * @param <V> 값 타입
     * @return 바인딩이 적용된 spec
     */
    protected <V> DatabaseClient.GenericExecuteSpec bindOrNull(
            DatabaseClient.GenericExecuteSpec spec, String name, V value, Class<V> type
    ) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    /**
     * multi-row VALUES 절을 만듭니다.
     * <p>
     * 템플릿의 {@value #ROW_INDEX}는 row 번호로 치환됩니다.
     * 예: {@code values(2, "(:a{i}, :b{i})")} → {@code (:a0, :b0),\n(:a1, :b1)}
     *
     * @param rows     row 수
     * @param template row 하나의 튜플 템플릿
     * @return 쉼표로 이어진 튜플 목록
     */
    protected static String values(int rows, String template) {
        StringJoiner joiner = new StringJoiner(",\n");
        for (int i = 0; i < rows; i++) {
            joiner.add(template.replace(ROW_INDEX, Integer.toString(i)));
        }
        return joiner.toString();
    }

    /**
     * 쓰기 방식에 맞는 충돌 처리 절을 만듭니다.
     * <p>
     * UNIQUE_UPSERT는 {@code ON DUPLICATE KEY UPDATE ...},
     * DENORMALIZED_APPEND는 유니크 키가 없는 스키마이므로 빈 문자열입니다.
     *
     * @param mode        쓰기 방식
     * @param assignments 충돌 시 적용할 대입 목록
     * @return 충돌 처리 절(앞에 줄바꿈 포함) 또는 빈 문자열
     */
    protected static String onConflict(WriteMode mode, String assignments) {
        if (mode == WriteMode.DENORMALIZED_APPEND) return "";
        return "\nON DUPLICATE KEY UPDATE\n  " + assignments;
    }
}
