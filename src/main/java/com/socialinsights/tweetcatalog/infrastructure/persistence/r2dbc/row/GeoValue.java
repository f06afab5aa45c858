package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

/**
 * tweets.geo 컬럼에 들어갈 geometry 값(WKT).
 * <p>
 * 위치를 해석할 수 없는 경우는 오류가 아니라 {@link #UNKNOWN}으로 표현합니다.
 *
 * @param wkt WKT 문자열 (UNKNOWN이면 null)
 */
public record GeoValue(String wkt) {

    /** 해석되지 않은 위치 */
    public static final GeoValue UNKNOWN = new GeoValue(null);
}
