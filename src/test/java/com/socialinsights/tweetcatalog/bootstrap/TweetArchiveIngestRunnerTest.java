package com.socialinsights.tweetcatalog.bootstrap;

import com.socialinsights.tweetcatalog.application.ingest.LoadCoordinator;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadReport;
import com.socialinsights.tweetcatalog.application.ingest.report.FileLoadStatus;
import com.socialinsights.tweetcatalog.application.ingest.report.LoadSummary;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.InputFileResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * {@link TweetArchiveIngestRunner} 단위 테스트.
 *
 * <p>커맨드라인 인자를 입력 경로로 해석해 코디네이터에 넘기는 흐름과,
 * 적재 결과에 따른 종료 코드(0/1/2)를 검증한다.</p>
 */
@DisplayName("적재 러너 테스트")
class TweetArchiveIngestRunnerTest {

    private final InputFileResolver resolver = mock(InputFileResolver.class);
    private final LoadCoordinator coordinator = mock(LoadCoordinator.class);
    private final TweetArchiveIngestRunner runner = new TweetArchiveIngestRunner(resolver, coordinator);

    /**
     * Spring 옵션 인자는 입력 경로에서 제외되고, 모든 파일이 성공하면 종료 코드는 0이다.
     */
    @DisplayName("모든 파일 성공이면 종료 코드 0, -- 인자는 경로에서 제외")
    @Test
    void run_allSucceeded_exitCode0() {
        // given
        List<Path> files = List.of(Path.of("data/a.jsonl"));
        when(resolver.resolve(List.of("data"))).thenReturn(files);
        when(coordinator.run(files)).thenReturn(Mono.just(summary(FileLoadStatus.SUCCEEDED)));

        // when
        runner.run("--spring.profiles.active=ingest", "data");

        // then
        assertEquals(0, runner.getExitCode());
        verify(coordinator).run(files);
    }

    @DisplayName("실패한 파일이 있으면 종료 코드 1")
    @Test
    void run_someFailed_exitCode1() {
        // given
        List<Path> files = List.of(Path.of("a.jsonl"), Path.of("b.jsonl"));
        when(resolver.resolve(anyList())).thenReturn(files);
        when(coordinator.run(files)).thenReturn(Mono.just(
                summary(FileLoadStatus.SUCCEEDED, FileLoadStatus.FATAL_WRITE_FAILURE)));

        // when
        runner.run("a.jsonl", "b.jsonl");

        // then
        assertEquals(LoadSummary.FAILURE_EXIT_CODE, runner.getExitCode());
    }

    @DisplayName("입력 경로가 없으면 종료 코드 2, 적재하지 않음")
    @Test
    void run_noInputs_usageExitCode() {
        runner.run("--spring.profiles.active=ingest");

        assertEquals(TweetArchiveIngestRunner.USAGE_EXIT_CODE, runner.getExitCode());
        verifyNoInteractions(resolver, coordinator);
    }

    @DisplayName("경로를 펼친 결과가 비어 있으면 종료 코드 2")
    @Test
    void run_emptyDirectory_usageExitCode() {
        when(resolver.resolve(anyList())).thenReturn(List.of());

        runner.run("empty-dir");

        assertEquals(TweetArchiveIngestRunner.USAGE_EXIT_CODE, runner.getExitCode());
        verifyNoInteractions(coordinator);
    }

    private static LoadSummary summary(FileLoadStatus... statuses) {
        List<FileLoadReport> reports = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            reports.add(new FileLoadReport("f" + i, statuses[i], 1, 1, Map.of(), 1, 0, 0, 0,
                    statuses[i] == FileLoadStatus.SUCCEEDED ? null : "failed"));
        }
        return new LoadSummary(reports);
    }
}
