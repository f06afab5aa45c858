package com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row;

import java.time.LocalDateTime;

/**
 * users 테이블의 한 행을 표현하는 Row 객체입니다.
 * <p>
 * 트윗 작성자로 등장하면 hydrated(모든 프로필 필드), 멘션/답글 대상으로만 등장하면
 * stub(id와 이름 정도만 알려진 상태)으로 만들어집니다.
 *
 * @param idUsers             사용자 id
 * @param hydrated            프로필 전체가 채워진 row인지 여부
 * @param createdAt           계정 생성 시각(UTC)
 * @param updatedAt           이 스냅샷을 관측한 트윗의 작성 시각(UTC)
 * @param url                 프로필 링크
 * @param friendsCount        팔로잉 수
 * @param listedCount         리스트 등록 수
 * @param favouritesCount     좋아요 수
 * @param statusesCount       트윗 수
 * @param protectedAccount    비공개 계정 여부
 * @param verified            인증 계정 여부
 * @param screenName          screen name
 * @param name                표시 이름
 * @param location            자기소개 위치
 * @param description         자기소개
 * @param withheldInCountries 게시 제한 국가 코드(쉼표 구분)
 */
public record UserRow(
        Long idUsers,
        boolean hydrated,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        String url,
        Integer friendsCount,
        Integer listedCount,
        Integer favouritesCount,
        Integer statusesCount,
        Boolean protectedAccount,
        Boolean verified,
        String screenName,
        String name,
        String location,
        String description,
        String withheldInCountries
) {

    /**
     * 참조로만 관측된 사용자의 stub row를 만든다.
     *
     * @param idUsers    사용자 id
     * @param screenName screen name (nullable)
     * @param name       표시 이름 (nullable)
     * @return stub row
     */
    public static UserRow stub(Long idUsers, String screenName, String name) {
        return new UserRow(idUsers, false, null, null, null,
                null, null, null, null, null, null,
                screenName, name, null, null, null);
    }

    /**
     * 같은 사용자에 대한 두 stub을 합친다. 이미 알려진 값은 유지하고 null만 채운다.
     *
     * @param other 같은 id의 다른 stub
     * @return 병합된 stub
     */
    public UserRow fillNullsFrom(UserRow other) {
        return stub(
                idUsers,
                screenName != null ? screenName : other.screenName(),
                name != null ? name : other.name()
        );
    }
}
