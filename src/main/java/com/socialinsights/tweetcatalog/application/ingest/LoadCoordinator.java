package com.socialinsights.tweetcatalog.application.ingest;

import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadReport;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadStats;
import com.socialinsights.tweetcatalog.application.ingest.report.LoadSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 입력 파일을 N개의 워커에 나눠 동시에 적재하고 결과를 모으는 서비스입니다.
 * <p>
 * 워커끼리는 저장소 외에 공유하는 상태가 없으며, 한 워커의 실패가 다른 워커를 취소하지 않습니다.
 * 파일은 {@code loader.files-per-worker}개씩 묶여 한 워커가 순서대로 처리합니다.
 */
@Service
public class LoadCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(LoadCoordinator.class);

    private final TweetFileLoader loader;
    private final LoaderProperties props;

    public LoadCoordinator(TweetFileLoader loader, LoaderProperties props) {
        this.loader = loader;
        this.props = props;
    }

    /**
     * 모든 파일을 적재합니다.
     *
     * @param files 적재할 파일 목록(처리 순서)
     * @return 전체 요약 (파일 리포트는 입력 순서)
     */
    public Mono<LoadSummary> run(List<Path> files) {
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < files.size(); i++) {
            position.putIfAbsent(files.get(i).toString(), i);
        }

        LOG.info("Loading {} files with {} workers ({} files per worker)",
                files.size(), props.concurrency(), props.filesPerWorker());

        return Flux.fromIterable(partition(files, props.filesPerWorker()))
                // 한 그룹의 error가 flatMap 전체를 취소하지 않도록 그룹 단위로 가둔다
                .flatMap(group -> loader.loadGroup(group)
                                .onErrorResume(e -> Flux.fromIterable(group).map(f -> failedReport(f, e))),
                        props.concurrency())
                .collectList()
                .map(reports -> {
                    List<FileLoadReport> ordered = new ArrayList<>(reports);
                    ordered.sort(Comparator.comparing((FileLoadReport r) -> position.getOrDefault(r.file(), Integer.MAX_VALUE)));
                    return new LoadSummary(ordered);
                })
                .doOnNext(LoadCoordinator::logSummary);
    }

    /**
     * 파일 목록을 앞에서부터 size개씩 자른다.
     *
     * @param files 파일 목록
     * @param size  그룹 크기(1 이상)
     * @return 그룹 목록
     */
    static List<List<Path>> partition(List<Path> files, int size) {
        List<List<Path>> groups = new ArrayList<>();
        for (int i = 0; i < files.size(); i += size) {
            groups.add(List.copyOf(files.subList(i, Math.min(files.size(), i + size))));
        }
        return groups;
    }

    private static FileLoadReport failedReport(Path file, Throwable e) {
        FileLoadStats stats = new FileLoadStats(file);
        stats.readFailed(e.toString());
        return stats.toReport();
    }

    private static void logSummary(LoadSummary s) {
        LOG.info("Load finished: files={}, failed={}, read={}, loaded={}, skipped={}, retriedBatches={}, failedBatches={}",
                s.files().size(), s.failedFiles().size(), s.documentsRead(), s.documentsLoaded(),
                s.skipped(), s.batchesRetried(), s.batchesFailed());
        for (FileLoadReport f : s.failedFiles()) {
            LOG.error("  {} -> {}: {}", f.file(), f.status(), f.failure());
        }
    }
}
