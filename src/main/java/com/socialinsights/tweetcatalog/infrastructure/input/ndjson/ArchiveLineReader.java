package com.socialinsights.tweetcatalog.infrastructure.input.ndjson;

import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * 트윗 아카이브 파일을 "한 줄씩" 읽기 위한 라인 리더입니다.
 * <p>
 * 일반 NDJSON 파일과 zip 아카이브(엔트리별 NDJSON)를 모두 지원합니다.
 * {@link BufferedReader#lines()}의 lazy 스트림을 이용해 메모리 사용량을 최소화하며,
 * 리소스 생성/사용/해제를 {@link Flux#using}으로 안전하게 관리합니다.
 * <p>
 * 각 라인은 방출 전에 NUL 문자가 제거됩니다({@link NormalizeUtils#stripNulls(String)}).
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class ArchiveLineReader {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveLineReader.class);

    /** zip 엔트리를 이름 역순으로 읽을지 여부 */
    private final boolean reverseEntryOrder;

    @Autowired
    public ArchiveLineReader(LoaderProperties props) {
        this(props.reverseFileOrder());
    }

    public ArchiveLineReader(boolean reverseEntryOrder) {
        this.reverseEntryOrder = reverseEntryOrder;
    }

    /**
     * 파일을 한 줄씩 {@link Flux}로 반환합니다.
     * <p>
     * 확장자가 {@code .zip}이면 디렉터리가 아닌 엔트리를 차례로 열어 이어 붙입니다.
     * 구독 전까지는 파일을 열지 않습니다.
     *
     * @param file 입력 파일 경로
     * @return 파일(또는 아카이브 엔트리들)의 각 라인을 순차적으로 방출하는 Flux
     */
    public Flux<String> readLines(Path file) {
        Flux<String> lines = isZip(file) ? zipLines(file) : plainLines(file);
        return lines
                .map(NormalizeUtils::stripNulls)
                .subscribeOn(Schedulers.boundedElastic()); // blocking IO는 elastic으로
    }

    private Flux<String> plainLines(Path file) {
        return Flux.using(
                () -> Files.newBufferedReader(file, StandardCharsets.UTF_8),
                br -> Flux.fromStream(br.lines()),
                this::closeQuietly
        );
    }

    private Flux<String> zipLines(Path file) {
        return Flux.using(
                () -> new ZipFile(file.toFile(), StandardCharsets.UTF_8),
                zip -> Flux.fromIterable(orderedEntries(zip))
                        .concatMap(entry -> Flux.using(
                                () -> new BufferedReader(new InputStreamReader(
                                        zip.getInputStream(entry), StandardCharsets.UTF_8)),
                                br -> Flux.fromStream(br.lines()),
                                this::closeQuietly
                        )),
                this::closeQuietly
        );
    }

    /** 디렉터리 엔트리를 제외하고 이름순(설정 시 역순) 정렬 */
    List<? extends ZipEntry> orderedEntries(ZipFile zip) {
        Comparator<ZipEntry> byName = Comparator.comparing(ZipEntry::getName);
        return zip.stream()
                .filter(e -> !e.isDirectory())
                .sorted(reverseEntryOrder ? byName.reversed() : byName)
                .toList();
    }

    static boolean isZip(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            LOG.warn("failed to close input resource: {}", e.getMessage());
        }
    }
}
