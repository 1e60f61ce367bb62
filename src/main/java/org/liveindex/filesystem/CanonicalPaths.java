package org.liveindex.filesystem;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * 规范路径（canonical path）转换器：把绝对路径映射为“相对索引根目录、以 / 分隔”的规范形式，并提供反向映射。
 * <p>
 * 规则：
 * <ul>
 *   <li>根目录本身表示为 {@code /}；子节点形如 {@code /src/a.txt}。</li>
 *   <li>根目录之外的路径返回 {@code null}（表示“范围外”），调用方不得写入索引。</li>
 *   <li>反向映射时拒绝包含 {@code ..} 等可能逃逸出根目录的输入。</li>
 * </ul>
 * 本类无状态（仅持有根目录），可在多线程间共享。
 */
public class CanonicalPaths {

    public static final String ROOT = "/";

    private static final String GIT_DIR = ".git";

    private final Path root;

    public CanonicalPaths(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /**
     * 根目录的显示名称（目录名；根目录为文件系统根时返回其字符串形式）。
     */
    public String rootName() {
        Path fileName = root.getFileName();
        return fileName == null ? root.toString() : fileName.toString();
    }

    /**
     * 绝对路径 -> 规范路径。
     *
     * @return 规范路径；路径不在根目录范围内时返回 {@code null}
     */
    public String toCanonical(Path absolute) {
        if (absolute == null) {
            return null;
        }
        Path normalized = absolute.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            return null;
        }
        Path relative = root.relativize(normalized);
        if (relative.toString().isEmpty()) {
            return ROOT;
        }
        StringBuilder sb = new StringBuilder(relative.toString().length() + 1);
        for (Path segment : relative) {
            sb.append('/').append(segment);
        }
        return sb.toString();
    }

    /**
     * 规范路径 -> 绝对路径。
     *
     * @throws IllegalArgumentException 路径为空、不是以 / 开头或试图逃逸出根目录
     */
    public Path toAbsolute(String canonical) {
        if (canonical == null || canonical.isBlank()) {
            throw new IllegalArgumentException("路径不能为空");
        }
        if (!canonical.startsWith(ROOT)) {
            throw new IllegalArgumentException("路径必须以 / 开头：" + canonical);
        }
        if (ROOT.equals(canonical)) {
            return root;
        }
        Path resolved = root;
        for (String segment : canonical.substring(1).split("/")) {
            if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                throw new IllegalArgumentException("路径包含非法片段：" + canonical);
            }
            resolved = resolved.resolve(segment);
        }
        Path normalized = resolved.normalize();
        if (!normalized.startsWith(root)) {
            throw new IllegalArgumentException("路径不在索引根目录范围内：" + canonical);
        }
        return normalized;
    }

    public boolean isInsideRoot(Path absolute) {
        return toCanonical(absolute) != null;
    }

    public static String parentOf(String canonical) {
        if (canonical == null || ROOT.equals(canonical)) {
            return null;
        }
        int idx = canonical.lastIndexOf('/');
        return idx <= 0 ? ROOT : canonical.substring(0, idx);
    }

    public static int depthOf(String canonical) {
        if (canonical == null || ROOT.equals(canonical)) {
            return 0;
        }
        int depth = 0;
        for (int i = 0; i < canonical.length(); i++) {
            if (canonical.charAt(i) == '/') {
                depth++;
            }
        }
        return depth;
    }

    public static String nameOf(String canonical) {
        if (canonical == null || ROOT.equals(canonical)) {
            return "";
        }
        return canonical.substring(canonical.lastIndexOf('/') + 1);
    }

    /**
     * 扩展名：小写、去掉前导点；没有扩展名（或是隐藏文件 {@code .bashrc} 这种）返回空串。
     */
    public static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * {@code candidate} 是否等于 {@code ancestor} 或位于其子树内（按路径片段判断，而非字符串前缀）。
     */
    public static boolean isSameOrDescendant(String candidate, String ancestor) {
        if (candidate == null || ancestor == null) {
            return false;
        }
        if (ROOT.equals(ancestor) || candidate.equals(ancestor)) {
            return candidate.startsWith(ROOT);
        }
        return candidate.startsWith(ancestor + "/");
    }

    /**
     * 对位于 {@code .git} 内部的路径，返回其所属仓库根目录的规范路径。
     * <ul>
     *   <li>{@code /.git/HEAD} -> {@code /}</li>
     *   <li>{@code /proj/.git/refs/heads/main} -> {@code /proj}</li>
     *   <li>{@code /proj/.gitignore} -> {@code null}</li>
     * </ul>
     */
    public static String repositoryRootOfGitInternal(String canonical) {
        if (canonical == null || ROOT.equals(canonical)) {
            return null;
        }
        String marker = "/" + GIT_DIR;
        int idx = canonical.indexOf(marker);
        while (idx >= 0) {
            int end = idx + marker.length();
            if (end == canonical.length() || canonical.charAt(end) == '/') {
                return idx == 0 ? ROOT : canonical.substring(0, idx);
            }
            idx = canonical.indexOf(marker, end);
        }
        return null;
    }

    public static boolean isGitDirectory(String canonical) {
        return GIT_DIR.equals(nameOf(canonical));
    }
}
