package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.TweetMentionRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * tweet_mentions 관계 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 */
@Component
public class TweetMentionRepo extends BatchSqlSupport {

    private static final int CHUNK = 800;

    public TweetMentionRepo(DatabaseClient db) {
        super(db);
    }

    public Mono<Long> insert(List<TweetMentionRow> rows, WriteMode mode) {
        return chunkedSum(rows, CHUNK, chunk -> insertOnce(chunk, mode));
    }

    private Mono<Long> insertOnce(List<TweetMentionRow> rows, WriteMode mode) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(insertSql(rows.size(), mode));
        for (int i = 0; i < rows.size(); i++) {
            TweetMentionRow r = rows.get(i);
            spec = spec.bind("t" + i, r.idTweets())
                    .bind("u" + i, r.idUsers());
        }
        return spec.fetch().rowsUpdated();
    }

    static String insertSql(int rows, WriteMode mode) {
        return "INSERT INTO tweet_mentions (id_tweets, id_users) VALUES\n"
                + values(rows, "(:t{i}, :u{i})")
                + onConflict(mode, "id_tweets = id_tweets");
    }
}
