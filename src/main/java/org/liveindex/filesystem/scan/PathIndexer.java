package org.liveindex.filesystem.scan;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IgnoredPaths;
import org.liveindex.filesystem.dto.EntryKind;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个路径的索引写入：stat、过滤、构造条目并 upsert。
 * <p>
 * 初始扫描与变更协调共用同一套规则：
 * <ul>
 *   <li>忽略表中的路径、根目录之外的路径直接跳过。</li>
 *   <li>stat 跟随符号链接（悬空链接视为不存在）；权限/不支持类错误把路径标记为忽略。</li>
 *   <li>既不是普通文件也不是目录的节点（socket、FIFO、设备文件）跳过。</li>
 *   <li>文件条目写入时顺带清除同路径上残留的 Git 元数据（目录变文件的情况）。</li>
 * </ul>
 */
public class PathIndexer {

    private static final Logger log = LoggerFactory.getLogger(PathIndexer.class);

    private final CanonicalPaths paths;
    private final IgnoredPaths ignored;
    private final EntryStore store;

    public PathIndexer(CanonicalPaths paths, IgnoredPaths ignored, EntryStore store) {
        this.paths = paths;
        this.ignored = ignored;
        this.store = store;
    }

    public CanonicalPaths paths() {
        return paths;
    }

    /**
     * 读取磁盘状态并写入索引。
     *
     * @return 写入的条目；被忽略、已消失或类型不支持时返回 null
     */
    public IndexEntry index(Path absolute) {
        Path normalized = absolute.toAbsolutePath().normalize();
        String canonical = paths.toCanonical(normalized);
        if (canonical == null || ignored.isIgnored(normalized) || ignored.isIgnored(canonical)) {
            return null;
        }
        BasicFileAttributes attrs = stat(normalized);
        if (attrs == null) {
            return null;
        }
        if (!attrs.isDirectory() && !attrs.isRegularFile()) {
            log.debug("跳过特殊文件：{}", canonical);
            return null;
        }
        IndexEntry entry = entryOf(canonical, attrs);
        store.upsertEntry(entry);
        if (!entry.isDirectory()) {
            store.deleteGitMetadata(canonical);
        }
        return entry;
    }

    /**
     * 补齐某个路径在索引中缺失的祖先目录（自上而下），保证“父条目先于子条目存在”。
     *
     * @return 本次新写入的祖先条目，按深度升序
     */
    public List<IndexEntry> backfillAncestors(String canonical) {
        List<String> missing = new ArrayList<>();
        String parent = CanonicalPaths.parentOf(canonical);
        while (parent != null && !store.exists(parent)) {
            missing.add(0, parent);
            parent = CanonicalPaths.parentOf(parent);
        }
        List<IndexEntry> inserted = new ArrayList<>(missing.size());
        for (String ancestor : missing) {
            IndexEntry entry = index(paths.toAbsolute(ancestor));
            if (entry == null) {
                // 祖先不可访问：子条目也无法挂到树上
                break;
            }
            inserted.add(entry);
        }
        return inserted;
    }

    /**
     * 列出目录的直接子节点，按文件名排序；目录不可列举时返回空列表。
     */
    public List<Path> listChildren(Path directory) {
        List<Path> children = new ArrayList<>();
        try (var stream = Files.newDirectoryStream(directory)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (NoSuchFileException | NotDirectoryException e) {
            return List.of();
        } catch (IOException e) {
            if (IgnoredPaths.isUnsupported(e)) {
                ignored.mark(directory);
            }
            log.debug("无法列举目录，跳过：{}（{}）", directory, e.getMessage());
            return List.of();
        }
        children.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return children;
    }

    private BasicFileAttributes stat(Path absolute) {
        try {
            return Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            if (IgnoredPaths.isUnsupported(e)) {
                ignored.mark(absolute);
                log.debug("无权限或文件系统不支持，加入忽略列表：{}", absolute);
            } else {
                log.debug("读取属性失败，跳过：{}（{}）", absolute, e.getMessage());
            }
            return null;
        }
    }

    IndexEntry entryOf(String canonical, BasicFileAttributes attrs) {
        boolean directory = attrs.isDirectory();
        String name = CanonicalPaths.ROOT.equals(canonical) ? paths.rootName() : CanonicalPaths.nameOf(canonical);
        long modifiedAt = attrs.lastModifiedTime() == null ? System.currentTimeMillis() : attrs.lastModifiedTime().toMillis();
        return new IndexEntry(
                canonical,
                name,
                CanonicalPaths.parentOf(canonical),
                directory ? EntryKind.DIRECTORY : EntryKind.FILE,
                directory ? null : attrs.size(),
                modifiedAt,
                directory ? "" : CanonicalPaths.extensionOf(name),
                CanonicalPaths.depthOf(canonical)
        );
    }
}
