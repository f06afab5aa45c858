package com.socialinsights.tweetcatalog.infrastructure.input.ndjson;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 아카이브 NDJSON의 "한 줄(= 트윗 하나)"을 매핑하기 위한 원본 DTO입니다.
 * <p>
 * 트위터 스트리밍 API 형식을 따르며, 스키마 변경/추가 필드에 대비해
 * {@link JsonIgnoreProperties#ignoreUnknown()}를 사용합니다.
 * 선택 하위 구조(place, geo, extended_tweet 등)는 없으면 null로 남습니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TweetRaw {

    @JsonProperty("id")
    public Long id;

    /** id가 문자열로만 오는 경우 대비 */
    @JsonProperty("id_str")
    public String idStr;

    /** 예: "Wed Oct 10 20:19:24 +0000 2018" */
    @JsonProperty("created_at")
    public String createdAt;

    @JsonProperty("text")
    public String text;

    @JsonProperty("source")
    public String source;

    @JsonProperty("lang")
    public String lang;

    @JsonProperty("user")
    public UserRaw user;

    @JsonProperty("in_reply_to_status_id")
    public Long inReplyToStatusId;

    @JsonProperty("in_reply_to_user_id")
    public Long inReplyToUserId;

    @JsonProperty("in_reply_to_screen_name")
    public String inReplyToScreenName;

    @JsonProperty("quoted_status_id")
    public Long quotedStatusId;

    @JsonProperty("retweet_count")
    public Integer retweetCount;

    @JsonProperty("favorite_count")
    public Integer favoriteCount;

    @JsonProperty("quote_count")
    public Integer quoteCount;

    @JsonProperty("withheld_copyright")
    public Boolean withheldCopyright;

    @JsonProperty("withheld_in_countries")
    public List<String> withheldInCountries;

    @JsonProperty("geo")
    public GeoRaw geo;

    @JsonProperty("place")
    public PlaceRaw place;

    @JsonProperty("entities")
    public EntitiesRaw entities;

    @JsonProperty("extended_entities")
    public ExtendedEntitiesRaw extendedEntities;

    /** 280자 확장 트윗. 있으면 본문/엔티티가 base 값을 대체한다. */
    @JsonProperty("extended_tweet")
    public ExtendedTweetRaw extendedTweet;

    // 스트림 제어 메시지(트윗이 아닌 레코드)
    @JsonProperty("delete")
    public Map<String, Object> delete;

    @JsonProperty("status_withheld")
    public Map<String, Object> statusWithheld;

    @JsonProperty("user_withheld")
    public Map<String, Object> userWithheld;

    @JsonProperty("scrub_geo")
    public Map<String, Object> scrubGeo;

    @JsonProperty("limit")
    public Map<String, Object> limit;

    /** 트윗 작성자 프로필 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserRaw {
        @JsonProperty("id")
        public Long id;

        @JsonProperty("created_at")
        public String createdAt;

        @JsonProperty("screen_name")
        public String screenName;

        @JsonProperty("name")
        public String name;

        @JsonProperty("location")
        public String location;

        @JsonProperty("url")
        public String url;

        @JsonProperty("description")
        public String description;

        @JsonProperty("protected")
        public Boolean protectedAccount;

        @JsonProperty("verified")
        public Boolean verified;

        @JsonProperty("friends_count")
        public Integer friendsCount;

        @JsonProperty("listed_count")
        public Integer listedCount;

        @JsonProperty("favourites_count")
        public Integer favouritesCount;

        @JsonProperty("statuses_count")
        public Integer statusesCount;

        @JsonProperty("geo_enabled")
        public Boolean geoEnabled;

        @JsonProperty("withheld_in_countries")
        public List<String> withheldInCountries;
    }

    /** 본문 엔티티 목록 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EntitiesRaw {
        @JsonProperty("hashtags")
        public List<TagRaw> hashtags;

        /** cashtag */
        @JsonProperty("symbols")
        public List<TagRaw> symbols;

        @JsonProperty("urls")
        public List<UrlRaw> urls;

        @JsonProperty("user_mentions")
        public List<MentionRaw> userMentions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtendedEntitiesRaw {
        @JsonProperty("media")
        public List<MediaRaw> media;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtendedTweetRaw {
        @JsonProperty("full_text")
        public String fullText;

        @JsonProperty("entities")
        public EntitiesRaw entities;

        @JsonProperty("extended_entities")
        public ExtendedEntitiesRaw extendedEntities;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TagRaw {
        @JsonProperty("text")
        public String text;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UrlRaw {
        @JsonProperty("url")
        public String url;

        @JsonProperty("expanded_url")
        public String expandedUrl;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MentionRaw {
        @JsonProperty("id")
        public Long id;

        @JsonProperty("screen_name")
        public String screenName;

        @JsonProperty("name")
        public String name;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MediaRaw {
        @JsonProperty("media_url")
        public String mediaUrl;

        @JsonProperty("type")
        public String type;
    }

    /** "geo": {"type":"Point","coordinates":[lat, lon]} */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GeoRaw {
        @JsonProperty("type")
        public String type;

        @JsonProperty("coordinates")
        public List<Double> coordinates;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlaceRaw {
        @JsonProperty("full_name")
        public String fullName;

        @JsonProperty("country_code")
        public String countryCode;

        @JsonProperty("bounding_box")
        public BoundingBoxRaw boundingBox;
    }

    /** "bounding_box": {"type":"Polygon","coordinates":[[[lon,lat],...]]} */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BoundingBoxRaw {
        @JsonProperty("type")
        public String type;

        @JsonProperty("coordinates")
        public List<List<List<Double>>> coordinates;
    }
}
