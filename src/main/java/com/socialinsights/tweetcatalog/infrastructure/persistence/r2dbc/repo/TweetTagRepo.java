package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.TweetTagRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * tweet_tags 관계 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 * <p>
 * hashtag와 cashtag를 한 테이블에 저장하며, tag 값의 접두어('#' 또는 '$')로 구분합니다.
 */
@Component
public class TweetTagRepo extends BatchSqlSupport {

    private static final int CHUNK = 800;

    public TweetTagRepo(DatabaseClient db) {
        super(db);
    }

    public Mono<Long> insert(List<TweetTagRow> rows, WriteMode mode) {
        return chunkedSum(rows, CHUNK, chunk -> insertOnce(chunk, mode));
    }

    private Mono<Long> insertOnce(List<TweetTagRow> rows, WriteMode mode) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(insertSql(rows.size(), mode));
        for (int i = 0; i < rows.size(); i++) {
            TweetTagRow r = rows.get(i);
            spec = spec.bind("t" + i, r.idTweets())
                    .bind("g" + i, r.tag());
        }
        return spec.fetch().rowsUpdated();
    }

    static String insertSql(int rows, WriteMode mode) {
        return "INSERT INTO tweet_tags (id_tweets, tag) VALUES\n"
                + values(rows, "(:t{i}, :g{i})")
                + onConflict(mode, "id_tweets = id_tweets");
    }
}
