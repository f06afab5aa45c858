package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.LinkRefs;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.TweetUrlRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * tweet_urls 관계 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 * <p>
 * 링크는 {@link LinkRefs}에 따라 id_urls 또는 url 문자열로 저장됩니다.
 */
@Component
public class TweetUrlRepo extends BatchSqlSupport {

    /** 관계 row 배치 처리 시 한 번에 처리할 최대 행 수 */
    private static final int CHUNK = 800;

    public TweetUrlRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * @param rows  트윗-링크 row
     * @param links 링크 참조 방식
     * @param mode  쓰기 방식
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> insert(List<TweetUrlRow> rows, LinkRefs links, WriteMode mode) {
        return chunkedSum(rows, CHUNK, chunk -> insertOnce(chunk, links, mode));
    }

    private Mono<Long> insertOnce(List<TweetUrlRow> rows, LinkRefs links, WriteMode mode) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(insertSql(rows.size(), links, mode));
        for (int i = 0; i < rows.size(); i++) {
            TweetUrlRow r = rows.get(i);
            spec = spec.bind("t" + i, r.idTweets());
            spec = links.bind(spec, "l" + i, r.url());
        }
        return spec.fetch().rowsUpdated();
    }

    static String insertSql(int rows, LinkRefs links, WriteMode mode) {
        return "INSERT INTO tweet_urls (id_tweets, " + links.column() + ") VALUES\n"
                + values(rows, "(:t{i}, :l{i})")
                + onConflict(mode, "id_tweets = id_tweets");
    }
}
