package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc;

import org.springframework.r2dbc.core.DatabaseClient;

import java.util.Map;

/**
 * 링크(url)를 참조하는 컬럼의 표현 방식.
 *
 * <ul>
 *     <li>interned: urls 테이블에 한 번만 저장하고 {@code id_urls}로 참조 (정규화 스키마)</li>
 *     <li>inline: 참조하는 row마다 url 문자열을 {@code url} 컬럼에 그대로 저장 (비정규화 스키마)</li>
 * </ul>
 */
public final class LinkRefs {

    private final Map<String, Long> idByUrl;

    private LinkRefs(Map<String, Long> idByUrl) {
        this.idByUrl = idByUrl;
    }

    public static LinkRefs inline() {
        return new LinkRefs(null);
    }

    /**
     * @param idByUrl url -> id_urls (이번 배치가 참조하는 모든 url 포함)
     */
    public static LinkRefs interned(Map<String, Long> idByUrl) {
        return new LinkRefs(Map.copyOf(idByUrl));
    }

    public boolean isInterned() {
        return idByUrl != null;
    }

    /** 링크 참조 컬럼 이름 */
    public String column() {
        return isInterned() ? "id_urls" : "url";
    }

    /**
     * 링크 참조 값을 바인딩한다.
     *
     * @throws IllegalStateException interned 인데 url의 id를 모르는 경우
     */
    public DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, String name, String url) {
        if (url == null) {
            return spec.bindNull(name, isInterned() ? Long.class : String.class);
        }
        if (!isInterned()) return spec.bind(name, url);

        Long id = idByUrl.get(url);
        if (id == null) {
            throw new IllegalStateException("url was not interned before use: " + url);
        }
        return spec.bind(name, id);
    }
}
