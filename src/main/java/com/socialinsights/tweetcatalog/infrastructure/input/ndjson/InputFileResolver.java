package com.socialinsights.tweetcatalog.infrastructure.input.ndjson;

import com.socialinsights.tweetcatalog.application.ingest.config.LoaderProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 커맨드라인에서 받은 입력 경로 목록을 실제 적재 대상 파일 목록으로 펼친다.
 *
 * <p>디렉터리는 바로 아래의 일반 파일(숨김 파일 제외)로 확장하고,
 * 전체 목록을 경로 이름순(설정 시 역순)으로 정렬한다.
 * 존재하지 않는 경로는 그대로 남겨 두어 파일별 리포트에서 READ_FAILURE로 드러나게 한다.</p>
 */
@Component
public class InputFileResolver {

    private final boolean reverseOrder;

    @Autowired
    public InputFileResolver(LoaderProperties props) {
        this(props.reverseFileOrder());
    }

    public InputFileResolver(boolean reverseOrder) {
        this.reverseOrder = reverseOrder;
    }

    /**
     * @param paths 파일 또는 디렉터리 경로
     * @return 중복 없는 정렬된 파일 목록
     */
    public List<Path> resolve(List<String> paths) {
        Set<Path> files = new LinkedHashSet<>();
        for (String p : paths) {
            Path path = Path.of(p);
            if (Files.isDirectory(path)) {
                files.addAll(listFiles(path));
            } else {
                files.add(path);
            }
        }

        Comparator<Path> byName = Comparator.comparing(Path::toString);
        List<Path> out = new ArrayList<>(files);
        out.sort(reverseOrder ? byName.reversed() : byName);
        return out;
    }

    private List<Path> listFiles(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(f -> !f.getFileName().toString().startsWith("."))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list input directory " + dir, e);
        }
    }
}
