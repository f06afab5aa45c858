package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.NormalizeUtils;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * urls 테이블(정규화 스키마)에 대한 intern/조회 기능을 제공하는 Repository입니다.
 * <p>
 * url은 길이 제한이 없으므로 SHA-256 해시(url_hash)를 유니크 키로 사용합니다.
 * 저장은 url_hash 순으로 정렬해 워커 간 유니크 인덱스 락 순서를 맞춥니다.
 */
@Component
public class UrlRepo extends BatchSqlSupport {

    /** url 배치 처리 시 한 번에 처리할 최대 건수 */
    private static final int CHUNK = 500;

    public UrlRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * url 목록을 저장합니다(이미 있으면 무시).
     *
     * @param urls 저장할 url 목록
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> insertIgnore(List<String> urls) {
        return chunkedSum(byHash(urls), CHUNK, this::insertOnce);
    }

    private Mono<Long> insertOnce(List<Map.Entry<String, String>> hashed) {
        if (hashed.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(insertSql(hashed.size()));
        for (int i = 0; i < hashed.size(); i++) {
            spec = spec.bind("h" + i, hashed.get(i).getKey())
                    .bind("u" + i, hashed.get(i).getValue());
        }
        return spec.fetch().rowsUpdated();
    }

    static String insertSql(int rows) {
        return "INSERT INTO urls (url_hash, url) VALUES\n"
                + values(rows, "(:h{i}, :u{i})")
                + "\nON DUPLICATE KEY UPDATE\n  url_hash = url_hash";
    }

    /**
     * url 목록으로 urls.id_urls를 조회하여 매핑을 반환합니다.
     *
     * @param urls 조회할 url 목록
     * @return url -> id_urls 매핑
     */
    public Mono<Map<String, Long>> fetchUrlIds(List<String> urls) {
        List<Map.Entry<String, String>> hashed = byHash(urls);
        if (hashed.isEmpty()) return Mono.just(Map.of());

        Map<String, String> urlByHash = new HashMap<>();
        hashed.forEach(e -> urlByHash.put(e.getKey(), e.getValue()));

        return Flux.fromIterable(hashed)
                .map(Map.Entry::getKey)
                .buffer(CHUNK)
                .concatMap(this::fetchOnce)
                .collectMap(e -> urlByHash.get(e.getKey()), Map.Entry::getValue);
    }

    private Flux<Map.Entry<String, Long>> fetchOnce(List<String> hashes) {
        StringBuilder sql = new StringBuilder("""
            SELECT id_urls, url_hash
            FROM urls
            WHERE url_hash IN (
        """);
        for (int i = 0; i < hashes.size(); i++) {
            if (i > 0) sql.append(",");
            sql.append(":h").append(i);
        }
        sql.append(")");

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql.toString());
        for (int i = 0; i < hashes.size(); i++) {
            spec = spec.bind("h" + i, hashes.get(i));
        }

        return spec
                .map((row, meta) -> Map.entry(
                        row.get("url_hash", String.class),
                        row.get("id_urls", Long.class)
                ))
                .all();
    }

    /** null/중복 제거 후 (hash, url)을 hash 순으로 정렬 */
    static List<Map.Entry<String, String>> byHash(List<String> urls) {
        if (urls == null || urls.isEmpty()) return List.of();
        Map<String, String> uniq = new LinkedHashMap<>();
        urls.stream()
                .filter(Objects::nonNull)
                .distinct()
                .forEach(u -> uniq.putIfAbsent(NormalizeUtils.sha256Hex(u), u));
        return uniq.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();
    }
}
