package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.application.ingest.policy.AuthorMergePolicy;
import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.LinkRefs;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.UserRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * {@link UserRepo} 단위 테스트.
 *
 * <p>병합 규칙별 ON DUPLICATE KEY UPDATE 절, stub의 no-op 충돌 처리,
 * 링크 참조 방식에 따른 컬럼/바인딩, chunk 분할을 DB 없이 검증한다.</p>
 */
@DisplayName("user repo 테스트")
class UserRepoTest {

    /**
     * UPGRADE_STUBS는 기존 row가 hydrated 면 값을 유지하고, hydrated 플래그 갱신은 마지막에 둔다.
     */
    @DisplayName("UPGRADE_STUBS: hydrated row는 유지, hydrated 대입은 마지막")
    @Test
    void mergeAssignments_upgradeStubs() {
        String sql = UserRepo.mergeAssignments("id_urls", AuthorMergePolicy.UPGRADE_STUBS);

        assertTrue(sql.contains("screen_name = IF(hydrated, screen_name, VALUES(screen_name))"));
        assertTrue(sql.contains("id_urls = IF(hydrated, id_urls, VALUES(id_urls))"));
        assertTrue(sql.endsWith("hydrated = TRUE"));
        assertTrue(sql.indexOf("hydrated = TRUE") > sql.indexOf("withheld_in_countries ="));
    }

    @DisplayName("LAST_WRITER_WINS / FILL_NULLS 대입 형태")
    @Test
    void mergeAssignments_otherPolicies() {
        assertTrue(UserRepo.mergeAssignments("url", AuthorMergePolicy.LAST_WRITER_WINS)
                .contains("url = VALUES(url)"));
        assertTrue(UserRepo.mergeAssignments("url", AuthorMergePolicy.FILL_NULLS)
                .contains("description = COALESCE(description, VALUES(description))"));
    }

    @DisplayName("stub SQL: 충돌 시 아무것도 바꾸지 않음, 비정규화면 충돌 절 없음")
    @Test
    void stubSql_noOpOnConflict() {
        String normalized = UserRepo.stubSql(2, LinkRefs.interned(Map.of()), WriteMode.UNIQUE_UPSERT);
        String denormalized = UserRepo.stubSql(2, LinkRefs.inline(), WriteMode.DENORMALIZED_APPEND);

        assertTrue(normalized.contains("id_urls,"));
        assertTrue(normalized.contains(":id1"));
        assertTrue(normalized.endsWith("ON DUPLICATE KEY UPDATE\n  id_users = id_users"));
        assertTrue(denormalized.contains(" url,"));
        assertFalse(denormalized.contains("ON DUPLICATE KEY"));
    }

    /**
     * interned 링크면 프로필 url 대신 id_urls를 바인딩하고, null 값은 bindNull로 보낸다.
     */
    @DisplayName("hydrated upsert: interned 링크 id 바인딩, null 컬럼은 bindNull")
    @Test
    void upsertHydrated_bindsInternedLinkId() {
        // given
        MockDatabase mdb = new MockDatabase(2L);
        UserRepo repo = new UserRepo(mdb.db);
        UserRow author = new UserRow(10L, true, LocalDateTime.of(2010, 1, 1, 0, 0), LocalDateTime.of(2018, 10, 10, 0, 0),
                "https://alice.example", 1, 2, 3, 4, false, true, "alice", "Alice", null, null, null);

        // when / then
        StepVerifier.create(repo.upsertHydrated(List.of(author),
                        LinkRefs.interned(Map.of("https://alice.example", 77L)),
                        WriteMode.UNIQUE_UPSERT, AuthorMergePolicy.UPGRADE_STUBS))
                .expectNext(2L)
                .verifyComplete();

        verify(mdb.spec).bind("id0", 10L);
        verify(mdb.spec).bind("hy0", true);
        verify(mdb.spec).bind("ln0", 77L);
        verify(mdb.spec).bind("sn0", "alice");
        verify(mdb.spec).bindNull("lo0", String.class);
        assertTrue(mdb.executedSql().get(0).contains("hydrated = TRUE"));
    }

    @DisplayName("stub insert: 링크 컬럼은 null, chunk(400) 초과 시 분할 실행")
    @Test
    void insertStubs_overChunk_splits() {
        // given
        MockDatabase mdb = new MockDatabase(1L);
        UserRepo repo = new UserRepo(mdb.db);
        List<UserRow> stubs = new ArrayList<>();
        for (long i = 0; i < 401; i++) stubs.add(UserRow.stub(i, "s" + i, null));

        // when / then
        StepVerifier.create(repo.insertStubs(stubs, LinkRefs.inline(), WriteMode.DENORMALIZED_APPEND))
                .expectNext(2L)
                .verifyComplete();

        assertEquals(2, mdb.executedSql().size());
        verify(mdb.spec, times(401)).bindNull(startsWith("ln"), eq(String.class));
    }

    @DisplayName("빈 목록은 실행하지 않음")
    @Test
    void empty_noStatement() {
        MockDatabase mdb = new MockDatabase(1L);
        UserRepo repo = new UserRepo(mdb.db);

        StepVerifier.create(repo.insertStubs(List.of(), LinkRefs.inline(), WriteMode.UNIQUE_UPSERT))
                .expectNext(0L)
                .verifyComplete();

        verifyNoInteractions(mdb.db);
    }
}
