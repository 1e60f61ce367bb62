package org.liveindex.filesystem;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话级“忽略路径”登记表。
 * <p>
 * 说明：
 * <ul>
 *   <li>因权限不足/文件系统不支持而无法访问的路径会被标记为忽略，进程生命周期内不再尝试（不持久化）。</li>
 *   <li>绝对路径与规范路径两种形式存放在同一个集合中，通过 {@link #isIgnored(String)} 统一判断。</li>
 *   <li>以配置的后缀结尾（默认 {@code .sock}）的路径始终视为忽略。</li>
 * </ul>
 */
public class IgnoredPaths {

    private static final List<String> UNSUPPORTED_REASONS = List.of(
            "operation not supported",
            "operation not permitted",
            "permission denied",
            "file name too long"
    );

    private final CanonicalPaths paths;
    private final List<String> ignoredSuffixes;
    private final Set<String> marked = ConcurrentHashMap.newKeySet();

    public IgnoredPaths(CanonicalPaths paths, List<String> ignoredSuffixes) {
        this.paths = paths;
        this.ignoredSuffixes = ignoredSuffixes == null
                ? List.of()
                : ignoredSuffixes.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * 标记一个绝对路径（以及其规范形式）为忽略。
     */
    public void mark(Path absolute) {
        if (absolute == null) {
            return;
        }
        Path normalized = absolute.toAbsolutePath().normalize();
        marked.add(normalized.toString());
        String canonical = paths.toCanonical(normalized);
        if (canonical != null && !CanonicalPaths.ROOT.equals(canonical)) {
            marked.add(canonical);
        }
    }

    public boolean isIgnored(Path absolute) {
        return absolute != null && isIgnored(absolute.toAbsolutePath().normalize().toString());
    }

    /**
     * 唯一的判断入口：参数可以是绝对路径字符串，也可以是规范路径。
     */
    public boolean isIgnored(String absoluteOrCanonical) {
        if (absoluteOrCanonical == null || absoluteOrCanonical.isEmpty()) {
            return false;
        }
        if (marked.contains(absoluteOrCanonical)) {
            return true;
        }
        String lower = absoluteOrCanonical.toLowerCase(Locale.ROOT);
        for (String suffix : ignoredSuffixes) {
            if (lower.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return marked.size();
    }

    /**
     * 是否为“权限不足 / 文件系统不支持”这一类错误（对应的路径应被永久忽略）。
     */
    public static boolean isUnsupported(IOException e) {
        if (e instanceof AccessDeniedException) {
            return true;
        }
        if (e instanceof FileSystemException fse && fse.getReason() != null) {
            String reason = fse.getReason().toLowerCase(Locale.ROOT);
            for (String r : UNSUPPORTED_REASONS) {
                if (reason.contains(r)) {
                    return true;
                }
            }
        }
        return false;
    }
}
