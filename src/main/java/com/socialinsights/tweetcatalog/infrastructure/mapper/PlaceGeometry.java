package com.socialinsights.tweetcatalog.infrastructure.mapper;

import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.TweetRaw;
import com.socialinsights.tweetcatalog.infrastructure.persistence.r2dbc.row.GeoValue;

import java.math.BigDecimal;
import java.util.List;

/**
 * 트윗의 geo/place 필드에서 WKT geometry를 만든다.
 *
 * <p>우선순위: {@code geo.coordinates} → POINT,
 * 없으면 {@code place.bounding_box.coordinates} → 닫힌 MULTIPOLYGON,
 * 둘 다 해석할 수 없으면 {@link GeoValue#UNKNOWN}.</p>
 */
final class PlaceGeometry {

    private PlaceGeometry() {}

    static GeoValue of(TweetRaw raw) {
        String point = point(raw.geo);
        if (point != null) return new GeoValue(point);

        String polygon = raw.place == null ? null : multiPolygon(raw.place.boundingBox);
        if (polygon != null) return new GeoValue(polygon);

        return GeoValue.UNKNOWN;
    }

    /** "POINT(a b)" (좌표 순서는 원본 그대로) */
    static String point(TweetRaw.GeoRaw geo) {
        if (geo == null || geo.coordinates == null || geo.coordinates.size() < 2) return null;
        Double a = geo.coordinates.get(0);
        Double b = geo.coordinates.get(1);
        if (a == null || b == null) return null;
        return "POINT(" + num(a) + " " + num(b) + ")";
    }

    /**
     * 각 polygon ring의 첫 점을 끝에 한 번 더 붙여 닫는다.
     * 예: [[[1,2],[3,4],[5,6]]] → "MULTIPOLYGON(((1 2,3 4,5 6,1 2)))"
     */
    static String multiPolygon(TweetRaw.BoundingBoxRaw box) {
        if (box == null || box.coordinates == null || box.coordinates.isEmpty()) return null;

        StringBuilder sb = new StringBuilder("MULTIPOLYGON((");
        for (int i = 0; i < box.coordinates.size(); i++) {
            List<List<Double>> ring = box.coordinates.get(i);
            if (ring == null || ring.isEmpty()) return null;
            if (i > 0) sb.append(",");
            sb.append("(");
            for (List<Double> p : ring) {
                if (!isPair(p)) return null;
                sb.append(num(p.get(0))).append(" ").append(num(p.get(1))).append(",");
            }
            List<Double> first = ring.get(0);
            sb.append(num(first.get(0))).append(" ").append(num(first.get(1)));
            sb.append(")");
        }
        return sb.append("))").toString();
    }

    private static boolean isPair(List<Double> p) {
        return p != null && p.size() >= 2 && p.get(0) != null && p.get(1) != null;
    }

    // 지수 표기 없이 출력 (WKT 파서 호환)
    private static String num(Double d) {
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
