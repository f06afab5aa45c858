package com.socialinsights.tweetcatalog.infrastructure.input.ndjson;

import com.socialinsights.tweetcatalog.application.common.error.DecodeException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * NDJSON 한 줄을 {@link DecodedTweet}으로 변환하는 디코더.
 *
 * <p>규칙</p>
 * <ul>
 *     <li>스트림 제어 메시지(delete, status_withheld 등)는 트윗이 아니므로 {@link Optional#empty()}</li>
 *     <li>JSON 구조 오류, id/created_at 누락은 {@link DecodeException}</li>
 *     <li>place, geo, extended_tweet 등 선택 필드 누락은 오류가 아니다</li>
 *     <li>extended_tweet이 있으면 본문/엔티티/미디어를 그쪽에서만 가져온다</li>
 * </ul>
 */
@Component
public class TweetDecoder {

    private final ObjectMapper mapper;

    public TweetDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 한 줄을 디코딩한다.
     *
     * @param line       JSON 한 줄(NUL 제거 완료)
     * @param lineNumber 파일 내 라인 번호
     * @return 트윗이면 디코딩 결과, 제어 메시지면 empty
     * @throws DecodeException 구조적으로 잘못된 레코드인 경우
     */
    public Optional<DecodedTweet> decode(String line, long lineNumber) {
        TweetRaw raw = parse(line, lineNumber);
        if (isControlNotice(raw)) return Optional.empty();

        Long id = tweetId(raw);
        if (id == null) {
            throw new DecodeException("record has no tweet id", lineNumber);
        }

        LocalDateTime createdAt = NormalizeUtils.parseTimestampOrNull(raw.createdAt);
        if (createdAt == null) {
            throw new DecodeException("tweet " + id + " has missing or malformed created_at: " + raw.createdAt, lineNumber);
        }

        TweetRaw.ExtendedTweetRaw ext = raw.extendedTweet;
        String text = (ext != null && ext.fullText != null) ? ext.fullText : raw.text;
        TweetRaw.EntitiesRaw entities = (ext != null && ext.entities != null) ? ext.entities : raw.entities;

        return Optional.of(new DecodedTweet(id, createdAt, text, entities, media(raw), raw, lineNumber));
    }

    private TweetRaw parse(String line, long lineNumber) {
        try {
            TweetRaw raw = mapper.readValue(line, TweetRaw.class);
            if (raw == null) throw new DecodeException("record is JSON null", lineNumber);
            return raw;
        } catch (JacksonException e) {
            throw new DecodeException("JSON parse error: " + e.getOriginalMessage(), lineNumber, e);
        }
    }

    /** delete / withheld / scrub_geo / limit 알림 여부 */
    static boolean isControlNotice(TweetRaw raw) {
        return raw.delete != null
                || raw.statusWithheld != null
                || raw.userWithheld != null
                || raw.scrubGeo != null
                || raw.limit != null;
    }

    private static Long tweetId(TweetRaw raw) {
        if (raw.id != null) return raw.id;
        String s = NormalizeUtils.norm(raw.idStr);
        if (s == null) return null;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** extended_tweet.extended_entities → extended_entities 순으로 첫 번째 존재하는 목록 */
    private static List<TweetRaw.MediaRaw> media(TweetRaw raw) {
        TweetRaw.ExtendedTweetRaw ext = raw.extendedTweet;
        List<TweetRaw.MediaRaw> media = null;
        if (ext != null && ext.extendedEntities != null) {
            media = ext.extendedEntities.media;
        } else if (raw.extendedEntities != null) {
            media = raw.extendedEntities.media;
        }
        if (media == null) return List.of();
        return media.stream().filter(Objects::nonNull).toList();
    }
}
