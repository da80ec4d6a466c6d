package com.ryuqq.urengine.core.rule;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * include/exclude glob 필터.
 *
 * <p>'/'가 없는 패턴은 파일명에, '/'가 있는 패턴은 전체 경로에 적용됩니다.
 * include가 비어 있으면 모든 경로를 포함하고, exclude는 include보다 우선합니다.</p>
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public final class GlobFilter {

    private static final GlobFilter ACCEPT_ALL = new GlobFilter(List.of(), List.of());

    private final List<Glob> includes;
    private final List<Glob> excludes;

    private GlobFilter(List<String> includes, List<String> excludes) {
        FileSystem fs = FileSystems.getDefault();
        this.includes = includes.stream().map(p -> Glob.compile(fs, p)).toList();
        this.excludes = excludes.stream().map(p -> Glob.compile(fs, p)).toList();
    }

    /**
     * 필터 생성.
     *
     * @param includes 포함 glob (null 또는 빈 목록이면 제한 없음)
     * @param excludes 제외 glob (null 가능)
     * @return GlobFilter
     * @throws IllegalArgumentException 잘못된 glob인 경우
     */
    public static GlobFilter of(List<String> includes, List<String> excludes) {
        boolean noIncludes = includes == null || includes.isEmpty();
        boolean noExcludes = excludes == null || excludes.isEmpty();
        if (noIncludes && noExcludes) {
            return ACCEPT_ALL;
        }
        return new GlobFilter(noIncludes ? List.of() : includes, noExcludes ? List.of() : excludes);
    }

    /**
     * 경로 허용 여부.
     *
     * @param path 검사할 경로 ('/' 구분)
     * @return 포함되고 제외되지 않으면 true
     */
    public boolean accepts(String path) {
        if (path == null || path.isEmpty()) {
            return includes.isEmpty();
        }
        Path full;
        try {
            full = Path.of(path);
        } catch (InvalidPathException e) {
            return false;
        }
        Path name = full.getFileName();
        for (Glob exclude : excludes) {
            if (exclude.matches(full, name)) {
                return false;
            }
        }
        if (includes.isEmpty()) {
            return true;
        }
        for (Glob include : includes) {
            if (include.matches(full, name)) {
                return true;
            }
        }
        return false;
    }

    private record Glob(PathMatcher matcher, boolean fileNameOnly) {

        static Glob compile(FileSystem fs, String pattern) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("glob pattern cannot be null or blank");
            }
            return new Glob(fs.getPathMatcher("glob:" + pattern), !pattern.contains("/"));
        }

        boolean matches(Path full, Path name) {
            if (fileNameOnly) {
                return name != null && matcher.matches(name);
            }
            return matcher.matches(full);
        }
    }
}
