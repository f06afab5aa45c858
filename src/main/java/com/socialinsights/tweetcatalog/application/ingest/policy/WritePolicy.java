package com.socialinsights.tweetcatalog.application.ingest.policy;

import java.util.EnumMap;
import java.util.Map;

/**
 * 엔티티 종류별로 확정된 쓰기 방식과 작성자 병합 규칙.
 *
 * @param modes              엔티티 종류 -> 쓰기 방식 (모든 종류 포함)
 * @param authorMergePolicy  hydrated 작성자 병합 규칙
 */
public record WritePolicy(Map<EntityKind, WriteMode> modes, AuthorMergePolicy authorMergePolicy) {

    public WritePolicy {
        EnumMap<EntityKind, WriteMode> copy = new EnumMap<>(EntityKind.class);
        copy.putAll(modes);
        for (EntityKind kind : EntityKind.values()) {
            if (!copy.containsKey(kind)) {
                throw new IllegalArgumentException("write mode missing for " + kind);
            }
        }
        modes = Map.copyOf(copy);
    }

    /**
     * 스키마 기본값에 엔티티별 override를 덮어 정책을 만든다.
     *
     * @param variant   프로비저닝된 스키마 종류
     * @param overrides 엔티티별 override (nullable)
     * @param policy    작성자 병합 규칙
     * @return 확정된 정책
     */
    public static WritePolicy of(SchemaVariant variant,
                                 Map<EntityKind, WriteMode> overrides,
                                 AuthorMergePolicy policy) {
        EnumMap<EntityKind, WriteMode> modes = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            modes.put(kind, variant.defaultMode());
        }
        if (overrides != null) modes.putAll(overrides);
        return new WritePolicy(modes, policy);
    }

    public static WritePolicy normalized() {
        return of(SchemaVariant.NORMALIZED, null, AuthorMergePolicy.UPGRADE_STUBS);
    }

    public static WritePolicy denormalized() {
        return of(SchemaVariant.DENORMALIZED, null, AuthorMergePolicy.UPGRADE_STUBS);
    }

    public WriteMode modeOf(EntityKind kind) {
        return modes.get(kind);
    }

    /** url을 urls 테이블에 intern 하고 id로 참조하는지 여부 */
    public boolean internsLinks() {
        return modeOf(EntityKind.LINK) == WriteMode.UNIQUE_UPSERT;
    }
}
