package com.socialinsights.tweetcatalog.infrastructure.input.ndjson;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * ingest 과정에서 반복적으로 사용하는 "정규화/파싱" 유틸리티입니다.
 * <p>
 * - 문자열 정규화(trim, 빈 값 처리, NUL 제거)
 * - 트위터 시각 문자열 파싱
 * - 태그 비교 키, 국가/주 코드 정규화
 * - url 식별용 해시 생성
 */
public class NormalizeUtils {

    /** 트위터 v1.1 created_at 형식. 예: "Wed Oct 10 20:19:24 +0000 2018" */
    private static final DateTimeFormatter TWITTER_TS =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    private static final String NUL_ESCAPE = "\\u0000";

    /**
     * 문자열을 정규화합니다.
     * <p>
     * trim 후 빈 문자열이면 null을 반환합니다.
     *
     * @param s 원본 문자열
     * @return 정규화된 문자열 또는 null
     */
    public static String norm(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    /**
     * 원본 라인에서 NUL 문자를 제거합니다.
     * <p>
     * JSON 이스케이프({@code \u0000})와 실제 NUL 문자 둘 다 제거합니다.
     * DB 텍스트 컬럼이 NUL을 허용하지 않기 때문에 디코딩 전에 처리합니다.
     * <p>
     * 앞에 붙은 역슬래시가 짝수 개(0 포함)인 {@code \u0000}만 NUL 이스케이프입니다.
     * {@code \\u0000}은 역슬래시 문자 뒤에 "u0000"이 오는 텍스트라 그대로 둡니다.
     *
     * @param line 원본 라인
     * @return NUL이 제거된 라인
     */
    public static String stripNulls(String line) {
        if (line == null) return null;
        if (line.indexOf(NUL_ESCAPE) < 0 && line.indexOf('\0') < 0) return line;

        StringBuilder sb = new StringBuilder(line.length());
        int backslashes = 0;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\0') {
                i++;
                continue;
            }
            if (c == '\\' && backslashes % 2 == 0 && line.startsWith(NUL_ESCAPE, i)) {
                i += NUL_ESCAPE.length();
                continue;
            }
            backslashes = c == '\\' ? backslashes + 1 : 0;
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    /**
     * 트위터 시각 문자열을 UTC 기준 {@link LocalDateTime}으로 파싱합니다.
     * <p>
     * 트위터 형식이 아니면 ISO-8601 offset 형식을 한 번 더 시도합니다.
     * 빈 값이거나 두 형식 모두 실패하면 null을 반환합니다.
     *
     * @param s 시각 문자열
     * @return UTC LocalDateTime 또는 null
     */
    public static LocalDateTime parseTimestampOrNull(String s) {
        String t = norm(s);
        if (t == null) return null;
        try {
            return toUtc(OffsetDateTime.parse(t, TWITTER_TS));
        } catch (DateTimeParseException e) {
            try {
                return toUtc(OffsetDateTime.parse(t));
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static LocalDateTime toUtc(OffsetDateTime odt) {
        return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    /** 태그 동일성 키 (대소문자 무시) */
    public static String tagKey(String tagText) {
        String t = norm(tagText);
        return t == null ? null : t.toLowerCase(Locale.ROOT);
    }

    /** 국가 코드 소문자 정규화 */
    public static String countryCode(String raw) {
        String t = norm(raw);
        return t == null ? null : t.toLowerCase(Locale.ROOT);
    }

    /**
     * 미국 place의 full_name("Austin, TX")에서 주 코드를 뽑습니다.
     * <p>
     * 마지막 쉼표 뒤 토큰이 두 글자 이하일 때만 주 코드로 인정합니다.
     *
     * @param countryCode 정규화된 국가 코드
     * @param fullName    place.full_name
     * @return 소문자 주 코드 또는 null
     */
    public static String stateCode(String countryCode, String fullName) {
        if (!"us".equals(countryCode)) return null;
        String name = norm(fullName);
        if (name == null) return null;
        String last = norm(name.substring(name.lastIndexOf(',') + 1));
        if (last == null || last.length() > 2) return null;
        return last.toLowerCase(Locale.ROOT);
    }

    /** withheld_in_countries 목록을 "DE,FR" 형태 문자열로 합칩니다. */
    public static String joinCountries(List<String> countries) {
        if (countries == null || countries.isEmpty()) return null;
        String joined = countries.stream()
                .map(NormalizeUtils::norm)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(","));
        return joined.isEmpty() ? null : joined;
    }

    /**
     * 입력 문자열을 SHA-256으로 해시한 16진수 문자열을 반환합니다.
     * <p>
     * url은 길이 제한이 없어 그대로 유니크 키로 쓰기 어렵기 때문에,
     * 해시를 고정 길이 유니크 키(url_hash)로 사용하기 위한 목적입니다.
     *
     * @param input 해시할 원본 문자열
     * @return SHA-256 해시(hex)
     * @throws IllegalStateException 해시 알고리즘 사용에 실패한 경우
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
