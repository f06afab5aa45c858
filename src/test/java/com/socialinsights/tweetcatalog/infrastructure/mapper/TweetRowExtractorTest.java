package com.socialinsights.tweetcatalog.infrastructure.mapper;

import com.socialinsights.tweetcatalog.application.common.error.ExtractionPolicyException;
import com.socialinsights.tweetcatalog.application.ingest.policy.MissingAuthorPolicy;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.DecodedTweet;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.TweetDecoder;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link TweetRowExtractor} 단위 테스트.
 *
 * <p>디코더로 만든 {@link DecodedTweet}에서 작성자/stub/트윗/관계 row가 기대대로 추출되고,
 * 문서 내 중복이 제거되며, 같은 입력이면 같은 결과가 나오는지 검증한다.</p>
 */
@DisplayName("row 추출 테스트")
class TweetRowExtractorTest {

    private final TweetDecoder decoder = new TweetDecoder(JsonMapper.builder().build());
    private final TweetRowExtractor extractor = new TweetRowExtractor(MissingAuthorPolicy.STUB_POST);

    /**
     * 작성자, 트윗 1건, 멘션 stub이 만들어지고 관계 row는 트윗 id를 참조한다.
     */
    @DisplayName("작성자/트윗/멘션 stub 추출")
    @Test
    void extract_authorTweetAndMentionStub() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","text":"hi @bob",
                 "user":{"id":10,"screen_name":"alice","url":" https://alice.example "},
                 "entities":{"user_mentions":[{"id":20,"screen_name":"bob","name":"Bob"}]}}
                """);

        ExtractedTweet ex = extractor.extract(doc);

        // author
        assertNotNull(ex.author());
        assertEquals(10L, ex.author().idUsers());
        assertTrue(ex.author().hydrated());
        assertEquals("https://alice.example", ex.author().url());
        assertEquals(LocalDateTime.of(2018, 10, 10, 20, 19, 24), ex.author().updatedAt());

        // stub
        assertEquals(List.of(UserRow.stub(20L, "bob", "Bob")), ex.stubAuthors());
        assertFalse(ex.stubAuthors().get(0).hydrated());

        // tweet + relation
        assertEquals(1L, ex.tweet().idTweets());
        assertEquals(10L, ex.tweet().idUsers());
        assertEquals(List.of(new TweetMentionRow(1L, 20L)), ex.mentions());
        assertEquals(4, ex.rowCount());
    }

    /**
     * 대소문자만 다른 hashtag는 하나로 합치고, 처음 나온 표기를 '#' 접두어와 함께 저장한다.
     */
    @DisplayName("hashtag 대소문자 중복 제거, cashtag는 '$' 접두어")
    @Test
    void extract_tags_dedupCaseInsensitive() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "entities":{"hashtags":[{"text":"Java"},{"text":"java"},{"text":" "}],
                             "symbols":[{"text":"AAPL"},{"text":"aapl"}]}}
                """);

        ExtractedTweet ex = extractor.extract(doc);

        assertEquals(List.of(new TweetTagRow(1L, "#Java"), new TweetTagRow(1L, "$AAPL")), ex.tags());
    }

    /**
     * 같은 사용자를 두 번 멘션해도 관계 row와 stub은 하나씩이다.
     */
    @DisplayName("같은 사용자 두 번 멘션하면 하나로")
    @Test
    void extract_duplicateMention_once() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "entities":{"user_mentions":[{"id":20,"screen_name":"bob"},{"id":20,"name":"Bob"}]}}
                """);

        ExtractedTweet ex = extractor.extract(doc);

        assertEquals(1, ex.mentions().size());
        assertEquals(List.of(UserRow.stub(20L, "bob", "Bob")), ex.stubAuthors());
    }

    /**
     * 작성자 본인을 멘션하면 stub을 만들지 않는다(hydrated row가 있으므로).
     */
    @DisplayName("자기 자신 멘션은 stub을 만들지 않음")
    @Test
    void extract_selfMention_noStub() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "entities":{"user_mentions":[{"id":10,"screen_name":"me"}]}}
                """);

        ExtractedTweet ex = extractor.extract(doc);

        assertTrue(ex.stubAuthors().isEmpty());
        assertEquals(List.of(new TweetMentionRow(1L, 10L)), ex.mentions());
    }

    /**
     * 답글 대상 사용자도 stub으로 만들어진다.
     */
    @DisplayName("답글 대상 사용자는 stub")
    @Test
    void extract_replyTarget_stub() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "in_reply_to_status_id":5,"in_reply_to_user_id":30,"in_reply_to_screen_name":"carol"}
                """);

        ExtractedTweet ex = extractor.extract(doc);

        assertEquals(List.of(UserRow.stub(30L, "carol", null)), ex.stubAuthors());
        assertEquals(30L, ex.tweet().inReplyToUserId());
        assertEquals(5L, ex.tweet().inReplyToStatusId());
    }

    /**
     * url은 expanded_url을 우선하고, 미디어는 url 기준으로 중복 제거한다.
     */
    @DisplayName("링크는 expanded_url 우선, 미디어는 url 기준 중복 제거")
    @Test
    void extract_linksAndMedia() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "entities":{"urls":[{"url":"https://t.co/a","expanded_url":"https://example.com/a"},
                                     {"url":"https://t.co/b"},
                                     {"url":"https://t.co/a2","expanded_url":"https://example.com/a"}]},
                 "extended_entities":{"media":[{"media_url":"https://m/1.jpg","type":"photo"},
                                               {"media_url":"https://m/1.jpg","type":"photo"}]}}
                """);

        ExtractedTweet ex = extractor.extract(doc);

        assertEquals(List.of(
                new TweetUrlRow(1L, "https://example.com/a"),
                new TweetUrlRow(1L, "https://t.co/b")
        ), ex.urls());
        assertEquals(List.of(new TweetMediaRow(1L, "https://m/1.jpg", "photo")), ex.media());
    }

    /**
     * 미국 place는 국가/주 코드와 닫힌 polygon을 만든다.
     */
    @DisplayName("place에서 국가/주 코드와 geometry 추출")
    @Test
    void extract_place() {
        DecodedTweet doc = decode("""
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "place":{"full_name":"Austin, TX","country_code":"US",
                          "bounding_box":{"coordinates":[[[1,2],[3,4],[5,6]]]}}}
                """);

        TweetRow t = extractor.extract(doc).tweet();

        assertEquals("us", t.countryCode());
        assertEquals("tx", t.stateCode());
        assertEquals("Austin, TX", t.placeName());
        assertEquals("MULTIPOLYGON(((1 2,3 4,5 6,1 2)))", t.geo().wkt());
    }

    /**
     * 작성자 없는 트윗은 STUB_POST 정책이면 작성자 참조 없이 저장된다.
     */
    @DisplayName("작성자 없는 트윗: STUB_POST면 작성자 null")
    @Test
    void extract_missingAuthor_stubPost() {
        DecodedTweet doc = decode("{\"id\":4,\"created_at\":\"Wed Oct 10 20:19:24 +0000 2018\"}");

        ExtractedTweet ex = extractor.extract(doc);

        assertNull(ex.author());
        assertNull(ex.tweet().idUsers());
        assertEquals(GeoValue.UNKNOWN, ex.tweet().geo());
        assertEquals(1, ex.rowCount());
    }

    /**
     * 작성자 없는 트윗은 SKIP 정책이면 ExtractionPolicyException이 된다.
     */
    @DisplayName("작성자 없는 트윗: SKIP이면 ExtractionPolicyException")
    @Test
    void extract_missingAuthor_skip_throws() {
        TweetRowExtractor strict = new TweetRowExtractor(MissingAuthorPolicy.SKIP);
        DecodedTweet doc = decode("{\"id\":4,\"created_at\":\"Wed Oct 10 20:19:24 +0000 2018\"}");

        ExtractionPolicyException e = assertThrows(ExtractionPolicyException.class, () -> strict.extract(doc));
        assertEquals(4L, e.tweetId());
    }

    /**
     * 같은 입력을 두 번 추출하면 결과가 같다.
     */
    @DisplayName("같은 입력이면 같은 결과")
    @Test
    void extract_isDeterministic() {
        String json = """
                {"id":1,"created_at":"Wed Oct 10 20:19:24 +0000 2018","user":{"id":10},
                 "entities":{"hashtags":[{"text":"b"},{"text":"a"}],
                             "user_mentions":[{"id":3},{"id":2}]}}
                """;

        assertEquals(extractor.extract(decode(json)), extractor.extract(decode(json)));
    }

    @DisplayName("문서 하나짜리 배치로 변환")
    @Test
    void toBatch_singleDocument() {
        ExtractedTweet ex = extractor.extract(decode(
                "{\"id\":4,\"created_at\":\"Wed Oct 10 20:19:24 +0000 2018\"}"));

        RowBatch batch = ex.toBatch();

        assertEquals(1, batch.documents());
        assertTrue(batch.authors().isEmpty());
        assertEquals(1, batch.tweets().size());
    }

    private DecodedTweet decode(String json) {
        return decoder.decode(json.replace("\n", ""), 1).orElseThrow();
    }
}
