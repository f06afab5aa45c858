package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.application.ingest.policy.AuthorMergePolicy;
import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.LinkRefs;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.UserRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * users 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 * <p>
 * hydrated 작성자와 stub 사용자를 구분해 저장합니다.
 * <ul>
 *     <li>stub: 있으면 아무것도 바꾸지 않는다 (기존 row를 절대 덮어쓰지 않음)</li>
 *     <li>hydrated: {@link AuthorMergePolicy}에 따라 병합하며 hydrated 플래그는 true로만 바뀐다</li>
 * </ul>
 * DENORMALIZED_APPEND 모드에서는 유니크 키가 없으므로 두 경우 모두 행을 추가합니다.
 */
@Component
public class UserRepo extends BatchSqlSupport {

    /** 사용자 배치 처리 시 한 번에 처리할 최대 행 수 (row당 바인딩 16개) */
    private static final int CHUNK = 400;

    /** 프로필 컬럼 (id_users, hydrated, 링크 컬럼 제외) */
    private static final List<String> PROFILE_COLUMNS = List.of(
            "created_at", "updated_at",
            "friends_count", "listed_count", "favourites_count", "statuses_count",
            "protected", "verified",
            "screen_name", "name", "location", "description", "withheld_in_countries"
    );

    /** VALUES 튜플 하나 (컬럼 순서는 {@link #insertHead(LinkRefs)}와 같다) */
    private static final String TUPLE =
            "(:id{i}, :hy{i}, :ca{i}, :ua{i}, :ln{i}, :fc{i}, :lc{i}, :fv{i}, :sc{i}, "
                    + ":pr{i}, :vf{i}, :sn{i}, :nm{i}, :lo{i}, :de{i}, :wc{i})";

    public UserRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * hydrated 작성자를 배치로 저장합니다.
     *
     * @param rows   hydrated 작성자 (id 순 정렬 권장)
     * @param links  프로필 링크 참조 방식
     * @param mode   쓰기 방식
     * @param policy 기존 row와의 병합 규칙
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> upsertHydrated(List<UserRow> rows, LinkRefs links, WriteMode mode, AuthorMergePolicy policy) {
        return chunkedSum(rows, CHUNK, chunk -> writeOnce(chunk, links, hydratedSql(chunk.size(), links, mode, policy)));
    }

    /**
     * stub 사용자를 배치로 저장합니다. 이미 있는 사용자는 건드리지 않습니다.
     * <p>
     * stub은 프로필 링크가 없으므로 링크 컬럼은 null로 들어갑니다.
     *
     * @param rows  stub 사용자
     * @param links 링크 참조 방식(컬럼 이름 결정용)
     * @param mode  쓰기 방식
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> insertStubs(List<UserRow> rows, LinkRefs links, WriteMode mode) {
        return chunkedSum(rows, CHUNK, chunk -> writeOnce(chunk, links, stubSql(chunk.size(), links, mode)));
    }

    private Mono<Long> writeOnce(List<UserRow> rows, LinkRefs links, String sql) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
        for (int i = 0; i < rows.size(); i++) {
            UserRow r = rows.get(i);
            spec = spec.bind("id" + i, r.idUsers())
                    .bind("hy" + i, r.hydrated());

            spec = bindOrNull(spec, "ca" + i, r.createdAt(), LocalDateTime.class);
            spec = bindOrNull(spec, "ua" + i, r.updatedAt(), LocalDateTime.class);
            spec = bindOrNull(spec, "fc" + i, r.friendsCount(), Integer.class);
            spec = bindOrNull(spec, "lc" + i, r.listedCount(), Integer.class);
            spec = bindOrNull(spec, "fv" + i, r.favouritesCount(), Integer.class);
            spec = bindOrNull(spec, "sc" + i, r.statusesCount(), Integer.class);
            spec = bindOrNull(spec, "pr" + i, r.protectedAccount(), Boolean.class);
            spec = bindOrNull(spec, "vf" + i, r.verified(), Boolean.class);
            spec = bindOrNull(spec, "sn" + i, r.screenName(), String.class);
            spec = bindOrNull(spec, "nm" + i, r.name(), String.class);
            spec = bindOrNull(spec, "lo" + i, r.location(), String.class);
            spec = bindOrNull(spec, "de" + i, r.description(), String.class);
            spec = bindOrNull(spec, "wc" + i, r.withheldInCountries(), String.class);
            spec = links.bind(spec, "ln" + i, r.url());
        }

        return spec.fetch().rowsUpdated();
    }

    static String hydratedSql(int rows, LinkRefs links, WriteMode mode, AuthorMergePolicy policy) {
        return insertHead(links) + values(rows, TUPLE)
                + onConflict(mode, mergeAssignments(links.column(), policy));
    }

    static String stubSql(int rows, LinkRefs links, WriteMode mode) {
        return insertHead(links) + values(rows, TUPLE)
                + onConflict(mode, "id_users = id_users");
    }

    /**
     * 병합 규칙별 ON DUPLICATE KEY UPDATE 대입 목록.
     * <p>
     * MySQL은 대입을 왼쪽부터 평가하므로 hydrated 는 반드시 마지막에 둔다
     * (앞의 IF가 갱신 전 값을 보게 하기 위함).
     */
    static String mergeAssignments(String linkColumn, AuthorMergePolicy policy) {
        List<String> columns = new ArrayList<>(PROFILE_COLUMNS);
        columns.add(linkColumn);

        String body = columns.stream()
                .map(c -> switch (policy) {
                    case UPGRADE_STUBS -> c + " = IF(hydrated, " + c + ", VALUES(" + c + "))";
                    case LAST_WRITER_WINS -> c + " = VALUES(" + c + ")";
                    case FILL_NULLS -> c + " = COALESCE(" + c + ", VALUES(" + c + "))";
                })
                .collect(Collectors.joining(",\n  "));
        return body + ",\n  hydrated = TRUE";
    }

    private static String insertHead(LinkRefs links) {
        return """
            INSERT INTO users (
              id_users, hydrated, created_at, updated_at, %s,
              friends_count, listed_count, favourites_count, statuses_count,
              protected, verified, screen_name, name, location, description, withheld_in_countries
            ) VALUES
            """.formatted(links.column());
    }
}
