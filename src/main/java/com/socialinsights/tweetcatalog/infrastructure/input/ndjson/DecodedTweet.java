package com.socialinsights.tweetcatalog.infrastructure.input.ndjson;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 디코딩이 끝난 트윗 하나.
 * <p>
 * 본문과 엔티티 목록은 이미 "확장형 우선" 규칙으로 선택된 값이다.
 * extended_tweet이 있으면 그쪽 값만 쓰고 base 값과 합치지 않는다.
 *
 * @param id         트윗 id
 * @param createdAt  작성 시각(UTC)
 * @param text       선택된 본문(full_text 우선)
 * @param entities   선택된 엔티티 목록(없으면 null)
 * @param media      선택된 미디어 목록(없으면 빈 리스트)
 * @param raw        원본 DTO(작성자/place/geo 등 나머지 필드 접근용)
 * @param lineNumber 파일 내 라인 번호(1부터)
 */
public record DecodedTweet(
        long id,
        LocalDateTime createdAt,
        String text,
        TweetRaw.EntitiesRaw entities,
        List<TweetRaw.MediaRaw> media,
        TweetRaw raw,
        long lineNumber
) {
    public DecodedTweet {
        media = media == null ? List.of() : List.copyOf(media);
    }

    public TweetRaw.UserRaw user() {
        return raw.user;
    }
}
