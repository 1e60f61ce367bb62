package org.liveindex.filesystem.content;

import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.EntryNotFoundException;
import org.liveindex.filesystem.FileUnreadableException;
import org.liveindex.filesystem.IgnoredPaths;
import org.liveindex.filesystem.dto.FileLineMatch;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.index.FuzzyIndex;
import org.liveindex.filesystem.store.EntryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件内容服务：流式读取与文件内模糊搜索。只读，不修改任何文件。
 * <p>
 * 说明：
 * <ul>
 *   <li>路径必须是索引中的文件条目；磁盘上的节点也必须仍是普通文件。</li>
 *   <li>流式读取按 64 KiB 分块写出，不会把整个文件读入内存；同一客户端发起新的读取后旧的读取停止。</li>
 *   <li>文件内搜索按行模糊匹配（阈值 0.4），结果算完之后如已被新请求取代则整体丢弃。</li>
 * </ul>
 */
public class FileContentService {

    private static final Logger log = LoggerFactory.getLogger(FileContentService.class);

    static final double LINE_THRESHOLD = 0.4;
    static final int CHUNK_SIZE = 64 * 1024;

    public static final String OP_STREAM = "stream";
    public static final String OP_SEARCH = "search";

    private final CanonicalPaths paths;
    private final EntryStore store;
    private final ClientRequestTracker tracker;
    private final int searchLimit;
    private final int snippetMaxLength;

    public FileContentService(CanonicalPaths paths,
                              EntryStore store,
                              ClientRequestTracker tracker,
                              int searchLimit,
                              int snippetMaxLength) {
        this.paths = paths;
        this.store = store;
        this.tracker = tracker;
        this.searchLimit = Math.max(1, searchLimit);
        this.snippetMaxLength = Math.max(2, snippetMaxLength);
    }

    /**
     * 已打开的文件流。调用方负责关闭（{@link #copy} 结束时会自动关闭）。
     *
     * @param path       规范路径
     * @param size       文件大小（字节）
     * @param modifiedAt 修改时间（毫秒）
     */
    public record FileStream(String path,
                             long size,
                             long modifiedAt,
                             InputStream input,
                             String clientId,
                             long generation) implements Closeable {
        @Override
        public void close() throws IOException {
            input.close();
        }
    }

    /**
     * 打开文件用于流式读取。
     */
    public FileStream open(String path, String clientId) {
        ResolvedFile file = resolve(path);
        long generation = tracker.begin(clientId, OP_STREAM);
        try {
            InputStream input = Files.newInputStream(file.absolute());
            return new FileStream(path, file.size(), file.modifiedAt(), input, clientId, generation);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(path);
        } catch (IOException e) {
            throw translate(path, e);
        }
    }

    /**
     * 分块写出文件内容；被同一客户端的新读取取代时提前停止。无论成功、失败还是中止都会关闭文件流。
     *
     * @return 已写出的字节数
     */
    public long copy(FileStream stream, OutputStream out) throws IOException {
        long written = 0;
        try (stream) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int read;
            while ((read = stream.input().read(buffer)) != -1) {
                if (!tracker.isCurrent(stream.clientId(), OP_STREAM, stream.generation())) {
                    log.debug("读取已被新请求取代，停止发送：{}", stream.path());
                    break;
                }
                out.write(buffer, 0, read);
                written += read;
            }
            out.flush();
        }
        return written;
    }

    /**
     * 文件内模糊搜索。
     */
    public List<FileLineMatch> search(String path, String query, String clientId) {
        String q = query == null ? "" : query.trim();
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        if (q.isEmpty()) {
            throw new IllegalArgumentException("参数错误：q 不能为空");
        }
        long generation = tracker.begin(clientId, OP_SEARCH);
        ResolvedFile file = resolve(path);

        String content = readText(path, file.absolute());
        String[] lines = content.split("\\r\\n|\\n|\\r", -1);
        List<Line> items = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            items.add(new Line(i + 1, lines[i]));
        }
        FuzzyIndex<Line> index = FuzzyIndex.of(items, LINE_THRESHOLD, Line::text);
        List<FileLineMatch> matches = new ArrayList<>();
        for (FuzzyIndex.Hit<Line> hit : index.search(q, searchLimit)) {
            Line line = hit.item();
            matches.add(new FileLineMatch(line.number(), hit.score(), SnippetBuilder.build(line.text(), q, snippetMaxLength)));
        }
        tracker.ensureCurrent(clientId, OP_SEARCH, generation);
        return matches;
    }

    private record Line(int number, String text) {
    }

    private record ResolvedFile(Path absolute, long size, long modifiedAt) {
    }

    private ResolvedFile resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        IndexEntry entry = store.findEntry(path);
        if (entry == null) {
            throw new EntryNotFoundException(path);
        }
        if (entry.isDirectory()) {
            throw new IllegalArgumentException("请求的路径不是文件：" + path);
        }
        Path absolute = paths.toAbsolute(path);
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(absolute, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(path);
        } catch (IOException e) {
            throw translate(path, e);
        }
        if (!attrs.isRegularFile()) {
            throw new IllegalArgumentException("请求的路径不是普通文件：" + path);
        }
        return new ResolvedFile(absolute, attrs.size(), attrs.lastModifiedTime().toMillis());
    }

    /**
     * 按 UTF-8 读取整个文件，非法字节替换为 U+FFFD。
     */
    private static String readText(String path, Path absolute) {
        try {
            return new String(Files.readAllBytes(absolute), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new EntryNotFoundException(path);
        } catch (IOException e) {
            throw translate(path, e);
        }
    }

    private static RuntimeException translate(String path, IOException e) {
        if (IgnoredPaths.isUnsupported(e)) {
            return new FileUnreadableException(path, e);
        }
        return new UncheckedIOException("读取文件失败：" + path, e);
    }
}
