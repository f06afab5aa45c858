package com.socialinsights.tweetcatalog.infrastructure.mapper;

import com.socialinsights.tweetcatalog.application.common.error.ExtractionPolicyException;
import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import com.socialinsights.tweetcatalog.application.ingest.policy.MissingAuthorPolicy;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.DecodedTweet;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.TweetRaw;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.socialinsights.tweetcatalog.infrastructure.input.ndjson.NormalizeUtils.*;

/**
 * {@link DecodedTweet} 하나를 DB 입력용 row 묶음으로 변환한다.
 *
 * <p>순수 변환이며 같은 입력이면 항상 같은 row를 같은 순서로 만든다.
 * 문서 내 중복(같은 태그 두 번, 같은 사용자 두 번 멘션 등)은 여기서 제거하고,
 * 문서 간 중복은 저장소의 upsert/append 규칙에 맡긴다.</p>
 */
@Component
public class TweetRowExtractor {

    private static final String HASHTAG_PREFIX = "#";
    private static final String CASHTAG_PREFIX = "$";

    /** 작성자 없는 트윗 처리 방식 */
    private final MissingAuthorPolicy missingAuthorPolicy;

    @Autowired
    public TweetRowExtractor(LoaderProperties props) {
        this(props.missingAuthorPolicy());
    }

    public TweetRowExtractor(MissingAuthorPolicy missingAuthorPolicy) {
        this.missingAuthorPolicy = missingAuthorPolicy;
    }

    /**
     * 트윗 하나에서 작성자, stub 사용자, 트윗, 관계 row를 추출한다.
     *
     * @param doc 디코딩된 트윗
     * @return 추출 결과
     * @throws ExtractionPolicyException 작성자가 없고 정책이 SKIP 인 경우
     */
    public ExtractedTweet extract(DecodedTweet doc) {
        TweetRaw raw = doc.raw();
        long tweetId = doc.id();

        UserRow author = authorRow(doc);
        if (author == null && missingAuthorPolicy == MissingAuthorPolicy.SKIP) {
            throw new ExtractionPolicyException("tweet " + tweetId + " has no author", tweetId);
        }
        Long authorId = author == null ? null : author.idUsers();

        TweetRaw.EntitiesRaw entities = doc.entities();
        List<TweetRaw.MentionRaw> mentionList = entities == null ? null : entities.userMentions;

        return new ExtractedTweet(
                author,
                stubAuthors(raw, mentionList, authorId),
                tweetRow(doc, authorId),
                urlRows(tweetId, entities),
                mentionRows(tweetId, mentionList),
                tagRows(tweetId, entities),
                mediaRows(tweetId, doc.media())
        );
    }

    private UserRow authorRow(DecodedTweet doc) {
        TweetRaw.UserRaw u = doc.user();
        if (u == null || u.id == null) return null;

        return new UserRow(
                u.id,
                true,
                parseTimestampOrNull(u.createdAt),
                doc.createdAt(),
                norm(u.url),
                u.friendsCount,
                u.listedCount,
                u.favouritesCount,
                u.statusesCount,
                u.protectedAccount,
                u.verified,
                norm(u.screenName),
                norm(u.name),
                norm(u.location),
                norm(u.description),
                joinCountries(u.withheldInCountries)
        );
    }

    /**
     * 답글 대상과 멘션 대상 사용자를 stub으로 만든다.
     * <p>
     * 작성자 본인은 이미 hydrated row가 있으므로 제외하고,
     * 같은 id가 여러 번 나오면 먼저 알려진 값을 유지한 채 null만 채운다.
     */
    private List<UserRow> stubAuthors(TweetRaw raw, List<TweetRaw.MentionRaw> mentions, Long authorId) {
        Map<Long, UserRow> byId = new LinkedHashMap<>();

        if (raw.inReplyToUserId != null) {
            addStub(byId, UserRow.stub(raw.inReplyToUserId, norm(raw.inReplyToScreenName), null));
        }
        if (mentions != null) {
            for (TweetRaw.MentionRaw m : mentions) {
                if (m == null || m.id == null) continue;
                addStub(byId, UserRow.stub(m.id, norm(m.screenName), norm(m.name)));
            }
        }

        if (authorId != null) byId.remove(authorId);
        return new ArrayList<>(byId.values());
    }

    private static void addStub(Map<Long, UserRow> byId, UserRow stub) {
        byId.merge(stub.idUsers(), stub, UserRow::fillNullsFrom);
    }

    private TweetRow tweetRow(DecodedTweet doc, Long authorId) {
        TweetRaw raw = doc.raw();
        TweetRaw.PlaceRaw place = raw.place;

        String country = place == null ? null : countryCode(place.countryCode);
        String placeName = place == null ? null : norm(place.fullName);

        return new TweetRow(
                doc.id(),
                authorId,
                doc.createdAt(),
                raw.inReplyToStatusId,
                raw.inReplyToUserId,
                raw.quotedStatusId,
                raw.retweetCount,
                raw.favoriteCount,
                raw.quoteCount,
                raw.withheldCopyright,
                joinCountries(raw.withheldInCountries),
                norm(raw.source),
                doc.text(),
                country,
                stateCode(country, placeName),
                norm(raw.lang),
                placeName,
                PlaceGeometry.of(raw)
        );
    }

    private List<TweetUrlRow> urlRows(long tweetId, TweetRaw.EntitiesRaw entities) {
        if (entities == null || entities.urls == null) return List.of();

        Set<String> seen = new LinkedHashSet<>();
        for (TweetRaw.UrlRaw u : entities.urls) {
            if (u == null) continue;
            String url = norm(u.expandedUrl) != null ? norm(u.expandedUrl) : norm(u.url);
            if (url != null) seen.add(url);
        }
        return seen.stream().map(url -> new TweetUrlRow(tweetId, url)).toList();
    }

    private List<TweetMentionRow> mentionRows(long tweetId, List<TweetRaw.MentionRaw> mentions) {
        if (mentions == null) return List.of();

        Set<Long> seen = new LinkedHashSet<>();
        for (TweetRaw.MentionRaw m : mentions) {
            if (m != null && m.id != null) seen.add(m.id);
        }
        return seen.stream().map(uid -> new TweetMentionRow(tweetId, uid)).toList();
    }

    /**
     * hashtag는 '#', cashtag는 '$'를 붙여 같은 테이블에 저장한다.
     * 비교는 (접두어 + 소문자) 기준이고, 저장 값은 처음 나온 표기를 유지한다.
     */
    private List<TweetTagRow> tagRows(long tweetId, TweetRaw.EntitiesRaw entities) {
        if (entities == null) return List.of();

        Map<String, String> byKey = new LinkedHashMap<>();
        collectTags(byKey, HASHTAG_PREFIX, entities.hashtags);
        collectTags(byKey, CASHTAG_PREFIX, entities.symbols);

        return byKey.values().stream().map(tag -> new TweetTagRow(tweetId, tag)).toList();
    }

    private static void collectTags(Map<String, String> byKey, String prefix, List<TweetRaw.TagRaw> tags) {
        if (tags == null) return;
        for (TweetRaw.TagRaw t : tags) {
            if (t == null) continue;
            String text = norm(t.text);
            if (text == null) continue;
            byKey.putIfAbsent(prefix + tagKey(text), prefix + text);
        }
    }

    private List<TweetMediaRow> mediaRows(long tweetId, List<TweetRaw.MediaRaw> media) {
        Map<String, TweetMediaRow> byUrl = new LinkedHashMap<>();
        for (TweetRaw.MediaRaw m : media) {
            String url = norm(m.mediaUrl);
            if (url == null) continue;
            byUrl.putIfAbsent(url, new TweetMediaRow(tweetId, url, norm(m.type)));
        }
        return new ArrayList<>(byUrl.values());
    }
}
