package com.socialinsights.tweetcatalog.application.ingest.report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 전체 적재 결과 요약.
 *
 * <p>모든 파일이 {@link FileLoadStatus#SUCCEEDED}일 때만 종료 코드 0을 돌려준다.</p>
 *
 * @param files 파일별 리포트 (입력 순서)
 */
public record LoadSummary(List<FileLoadReport> files) {

    /** 하나 이상의 파일이 실패했을 때의 종료 코드 */
    public static final int FAILURE_EXIT_CODE = 1;

    public LoadSummary {
        files = List.copyOf(files);
    }

    public int exitCode() {
        return allSucceeded() ? 0 : FAILURE_EXIT_CODE;
    }

    public boolean allSucceeded() {
        return files.stream().allMatch(FileLoadReport::succeeded);
    }

    public List<FileLoadReport> failedFiles() {
        return files.stream().filter(f -> !f.succeeded()).toList();
    }

    public long documentsRead() {
        return files.stream().mapToLong(FileLoadReport::documentsRead).sum();
    }

    public long documentsLoaded() {
        return files.stream().mapToLong(FileLoadReport::documentsLoaded).sum();
    }

    public long batchesRetried() {
        return files.stream().mapToLong(FileLoadReport::batchesRetried).sum();
    }

    public long batchesFailed() {
        return files.stream().mapToLong(FileLoadReport::batchesFailed).sum();
    }

    /** 사유별 skip 건수 합계 */
    public Map<SkipReason, Long> skipped() {
        Map<SkipReason, Long> out = new EnumMap<>(SkipReason.class);
        for (FileLoadReport f : files) {
            f.skipped().forEach((reason, n) -> out.merge(reason, n, Long::sum));
        }
        return out;
    }
}
