package com.socialinsights.tweetcatalog.bootstrap;

import com.socialinsights.tweetcatalog.application.ingest.LoadCoordinator;
import com.socialinsights.tweetcatalog.application.ingest.report.LoadSummary;
import com.socialinsights.tweetcatalog.infrastructure.input.ndjson.InputFileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * 트윗 아카이브 파일을 DB에 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code ingest}일 때만 활성화된다.</p>
 * <p>흐름: 인자 해석 → 파일 목록 확정 → 워커 N개로 동시 적재 → 요약 출력</p>
 * <p>하나라도 실패한 파일이 있으면 {@link #getExitCode()}가 0이 아닌 값을 돌려준다.</p>
 */
@Component
@Profile("ingest")
public class TweetArchiveIngestRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TweetArchiveIngestRunner.class);

    /** 인자 누락 등 적재 전에 끝난 경우의 종료 코드 */
    static final int USAGE_EXIT_CODE = 2;

    /** 커맨드라인 경로 → 입력 파일 목록 */
    private final InputFileResolver resolver;

    /** 파일 단위 동시 적재 */
    private final LoadCoordinator coordinator;

    private volatile int exitCode;

    /**
     * 의존성을 주입받아 러너를 초기화합니다.
     *
     * @param resolver    입력 경로 해석기
     * @param coordinator 적재 코디네이터
     */
    public TweetArchiveIngestRunner(InputFileResolver resolver, LoadCoordinator coordinator) {
        this.resolver = resolver;
        this.coordinator = coordinator;
    }

    /**
     * 애플리케이션 시작 시 실행되는 엔트리 포인트입니다.
     * <p>
     * {@code --}로 시작하는 인자(Spring 옵션)를 제외한 나머지를 입력 경로로 보고,
     * 전체 적재가 끝날 때까지 {@code block()}으로 대기합니다.
     *
     * @param args 커맨드라인 인자
     */
    @Override
    public void run(String... args) {
        List<String> inputs = Arrays.stream(args)
                .filter(a -> !a.startsWith("--"))
                .toList();

        if (inputs.isEmpty()) {
            LOG.error("No input given. Usage: --spring.profiles.active=ingest <file|dir|zip>...");
            exitCode = USAGE_EXIT_CODE;
            return;
        }

        List<Path> files = resolver.resolve(inputs);
        if (files.isEmpty()) {
            LOG.error("No input files found under {}", inputs);
            exitCode = USAGE_EXIT_CODE;
            return;
        }

        LoadSummary summary = coordinator.run(files).block();
        exitCode = summary == null ? LoadSummary.FAILURE_EXIT_CODE : summary.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
