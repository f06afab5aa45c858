package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.repo;

import com.socialinsights.tweetcatalog.application.ingest.policy.WriteMode;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.BatchSqlSupport;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.TweetRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * tweets 테이블에 대한 배치 저장 기능을 제공하는 Repository입니다.
 * <p>
 * 트윗은 id로 식별되며 내용이 바뀌지 않으므로, UNIQUE_UPSERT 모드에서 이미 있는 트윗은 그대로 둡니다.
 * geo 컬럼은 WKT 문자열을 {@code ST_GeomFromText}로 변환해 저장하며, 위치를 모르면 NULL 입니다.
 */
@Component
public class TweetRepo extends BatchSqlSupport {

    /** 트윗 배치 저장 시 한 번에 처리할 최대 행 수 */
    private static final int CHUNK = 300;

    public TweetRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 트윗 목록을 배치로 저장합니다.
     *
     * @param rows 저장할 트윗 목록
     * @param mode 쓰기 방식
     * @return 영향을 받은 행 수(배치 합계)
     */
    public Mono<Long> insert(List<TweetRow> rows, WriteMode mode) {
        return chunkedSum(rows, CHUNK, chunk -> insertOnce(chunk, mode));
    }

    private Mono<Long> insertOnce(List<TweetRow> rows, WriteMode mode) {
        if (rows.isEmpty()) return Mono.just(0L);

        DatabaseClient.GenericExecuteSpec spec = db.sql(insertSql(rows.size(), mode));
        for (int i = 0; i < rows.size(); i++) {
            TweetRow r = rows.get(i);
            spec = spec.bind("id" + i, r.idTweets());

            spec = bindOrNull(spec, "u" + i, r.idUsers(), Long.class);
            spec = bindOrNull(spec, "ca" + i, r.createdAt(), LocalDateTime.class);
            spec = bindOrNull(spec, "rs" + i, r.inReplyToStatusId(), Long.class);
            spec = bindOrNull(spec, "ru" + i, r.inReplyToUserId(), Long.class);
            spec = bindOrNull(spec, "qs" + i, r.quotedStatusId(), Long.class);
            spec = bindOrNull(spec, "rc" + i, r.retweetCount(), Integer.class);
            spec = bindOrNull(spec, "fc" + i, r.favoriteCount(), Integer.class);
            spec = bindOrNull(spec, "qc" + i, r.quoteCount(), Integer.class);
            spec = bindOrNull(spec, "wcp" + i, r.withheldCopyright(), Boolean.class);
            spec = bindOrNull(spec, "wic" + i, r.withheldInCountries(), String.class);
            spec = bindOrNull(spec, "src" + i, r.source(), String.class);
            spec = bindOrNull(spec, "tx" + i, r.text(), String.class);
            spec = bindOrNull(spec, "cc" + i, r.countryCode(), String.class);
            spec = bindOrNull(spec, "st" + i, r.stateCode(), String.class);
            spec = bindOrNull(spec, "lg" + i, r.lang(), String.class);
            spec = bindOrNull(spec, "pn" + i, r.placeName(), String.class);
            spec = bindOrNull(spec, "g" + i, r.geo() == null ? null : r.geo().wkt(), String.class);
        }

        return spec.fetch().rowsUpdated();
    }

    static String insertSql(int rows, WriteMode mode) {
        return """
            INSERT INTO tweets (
              id_tweets, id_users, created_at,
              in_reply_to_status_id, in_reply_to_user_id, quoted_status_id,
              retweet_count, favorite_count, quote_count,
              withheld_copyright, withheld_in_countries,
              source, text, country_code, state_code, lang, place_name, geo
            ) VALUES
            """
                + values(rows, "(:id{i}, :u{i}, :ca{i}, :rs{i}, :ru{i}, :qs{i}, :rc{i}, :fc{i}, :qc{i}, "
                        + ":wcp{i}, :wic{i}, :src{i}, :tx{i}, :cc{i}, :st{i}, :lg{i}, :pn{i}, ST_GeomFromText(:g{i}))")
                + onConflict(mode, "id_tweets = id_tweets");
    }
}
