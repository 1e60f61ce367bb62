package org.liveindex.filesystem.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.EntryNotFoundException;
import org.liveindex.filesystem.dto.EntryKind;
import org.liveindex.filesystem.dto.GitMetadata;
import org.liveindex.filesystem.dto.GitRemote;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.dto.TagValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 索引库：条目、标签与 Git 元数据的唯一数据来源（关系型存储，默认使用进程内 H2）。
 * <p>
 * 约定：
 * <ul>
 *   <li>条目以规范路径为主键，写入一律为 upsert，重复写入结果不变（幂等）。</li>
 *   <li>删除目录时在同一事务内删除其自身与全部后代条目、标签与 Git 元数据，读者不会看到“删了一半”的子树。</li>
 *   <li>标签与 Git 元数据通过外键级联删除，作为显式删除之外的兜底。</li>
 * </ul>
 */
public class EntryStore {

    private static final Logger log = LoggerFactory.getLogger(EntryStore.class);

    private static final TypeReference<List<GitRemote>> REMOTE_LIST = new TypeReference<>() {
    };

    private static final String ENTRY_COLUMNS = "path, name, parent_path, kind, size, mtime, extension, depth";

    private static final RowMapper<IndexEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> {
        long size = rs.getLong("size");
        Long sizeOrNull = rs.wasNull() ? null : size;
        return new IndexEntry(
                rs.getString("path"),
                rs.getString("name"),
                rs.getString("parent_path"),
                EntryKind.fromValue(rs.getString("kind")),
                sizeOrNull,
                rs.getLong("mtime"),
                rs.getString("extension"),
                rs.getInt("depth")
        );
    };

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final ObjectMapper objectMapper;

    public EntryStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbc = new JdbcTemplate(dataSource);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
    }

    // ---------------------------------------------------------------- entries

    public void upsertEntry(IndexEntry entry) {
        jdbc.update(
                "MERGE INTO entries (" + ENTRY_COLUMNS + ") KEY (path) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                entry.path(),
                entry.name(),
                entry.parentPath(),
                entry.kind().value(),
                entry.size(),
                entry.modifiedAt(),
                entry.extension() == null ? "" : entry.extension(),
                entry.depth()
        );
    }

    public IndexEntry findEntry(String path) {
        if (path == null) {
            return null;
        }
        List<IndexEntry> rows = jdbc.query(
                "SELECT " + ENTRY_COLUMNS + " FROM entries WHERE path = ?", ENTRY_ROW_MAPPER, path);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public boolean exists(String path) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM entries WHERE path = ?", Integer.class, path);
        return count != null && count > 0;
    }

    /**
     * 全部条目：按深度升序，同深度按名称忽略大小写排序（这也是搜索“无关键字”时的返回顺序）。
     */
    public List<IndexEntry> findAllEntries() {
        return jdbc.query(
                "SELECT " + ENTRY_COLUMNS + " FROM entries ORDER BY depth ASC, LOWER(name) ASC, name ASC, path ASC",
                ENTRY_ROW_MAPPER);
    }

    public int countEntries() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM entries", Integer.class);
        return count == null ? 0 : count;
    }

    /**
     * 删除某个条目及其全部后代（前缀匹配），连同标签与 Git 元数据，在一个事务内完成。
     *
     * @return 删除的条目数
     */
    public int deleteSubtree(String path) {
        if (path == null) {
            return 0;
        }
        Integer deleted = tx.execute(status -> {
            if (CanonicalPaths.ROOT.equals(path)) {
                jdbc.update("DELETE FROM tags");
                jdbc.update("DELETE FROM git_metadata");
                return jdbc.update("DELETE FROM entries");
            }
            String pattern = escapeLike(path) + "/%";
            jdbc.update("DELETE FROM tags WHERE entry_path = ? OR entry_path LIKE ? ESCAPE '\\'", path, pattern);
            jdbc.update("DELETE FROM git_metadata WHERE entry_path = ? OR entry_path LIKE ? ESCAPE '\\'", path, pattern);
            return jdbc.update("DELETE FROM entries WHERE path = ? OR path LIKE ? ESCAPE '\\'", path, pattern);
        });
        return deleted == null ? 0 : deleted;
    }

    // ---------------------------------------------------------------- tags

    /**
     * 添加标签（幂等：已存在时不重复插入）。
     *
     * @return 是否真正插入了新行
     * @throws EntryNotFoundException 条目不存在
     */
    public boolean addTag(Tag tag) {
        try {
            Boolean inserted = tx.execute(status -> {
                if (!exists(tag.path())) {
                    throw new EntryNotFoundException(tag.path());
                }
                Integer existing = jdbc.queryForObject(
                        "SELECT COUNT(*) FROM tags WHERE entry_path = ? AND tag_key = ? AND tag_value = ?",
                        Integer.class, tag.path(), tag.key(), tag.value());
                if (existing != null && existing > 0) {
                    return false;
                }
                jdbc.update("INSERT INTO tags (entry_path, tag_key, tag_value) VALUES (?, ?, ?)",
                        tag.path(), tag.key(), tag.value());
                return true;
            });
            return Boolean.TRUE.equals(inserted);
        } catch (DuplicateKeyException e) {
            return false;
        } catch (DataIntegrityViolationException e) {
            // 条目在检查之后被并发删除
            throw new EntryNotFoundException(tag.path());
        }
    }

    /**
     * 删除标签；不存在时什么也不做。
     *
     * @return 是否删除了行
     */
    public boolean removeTag(Tag tag) {
        return jdbc.update(
                "DELETE FROM tags WHERE entry_path = ? AND tag_key = ? AND tag_value = ?",
                tag.path(), tag.key(), tag.value()) > 0;
    }

    public List<TagValue> tagsFor(String path) {
        return jdbc.query(
                "SELECT tag_key, tag_value FROM tags WHERE entry_path = ? ORDER BY tag_key, tag_value",
                (rs, rowNum) -> new TagValue(rs.getString("tag_key"), rs.getString("tag_value")),
                path);
    }

    public List<Tag> findAllTags() {
        return jdbc.query(
                "SELECT entry_path, tag_key, tag_value FROM tags ORDER BY id",
                (rs, rowNum) -> new Tag(rs.getString("entry_path"), rs.getString("tag_key"), rs.getString("tag_value")));
    }

    public Set<String> pathsWithTag(String key, String value) {
        return new HashSet<>(jdbc.queryForList(
                "SELECT entry_path FROM tags WHERE tag_key = ? AND tag_value = ?", String.class, key, value));
    }

    // ---------------------------------------------------------------- git metadata

    public void upsertGitMetadata(GitMetadata metadata) {
        try {
            jdbc.update(
                    "MERGE INTO git_metadata (entry_path, detected_at, current_branch, commit_count, branch_count, remote_count, remotes) "
                            + "KEY (entry_path) VALUES (?, ?, ?, ?, ?, ?, ?)",
                    metadata.path(),
                    metadata.detectedAt(),
                    metadata.currentBranch(),
                    metadata.commitCount(),
                    metadata.branchCount(),
                    metadata.remotes().size(),
                    writeRemotes(metadata.remotes())
            );
        } catch (DataIntegrityViolationException e) {
            // 目录在采集期间已被删除：元数据没有归属，直接丢弃
            log.debug("目录已不在索引中，丢弃 Git 元数据：{}", metadata.path());
        }
    }

    public boolean deleteGitMetadata(String path) {
        return jdbc.update("DELETE FROM git_metadata WHERE entry_path = ?", path) > 0;
    }

    public GitMetadata findGitMetadata(String path) {
        List<GitMetadata> rows = jdbc.query(
                "SELECT * FROM git_metadata WHERE entry_path = ?", (rs, rowNum) -> mapGit(rs), path);
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<GitMetadata> findAllGitMetadata() {
        return jdbc.query("SELECT * FROM git_metadata", (rs, rowNum) -> mapGit(rs));
    }

    private GitMetadata mapGit(ResultSet rs) throws SQLException {
        int commitCount = rs.getInt("commit_count");
        Integer commitCountOrNull = rs.wasNull() ? null : commitCount;
        int branchCount = rs.getInt("branch_count");
        Integer branchCountOrNull = rs.wasNull() ? null : branchCount;
        return new GitMetadata(
                rs.getString("entry_path"),
                rs.getLong("detected_at"),
                rs.getString("current_branch"),
                commitCountOrNull,
                branchCountOrNull,
                readRemotes(rs.getString("remotes"))
        );
    }

    private String writeRemotes(List<GitRemote> remotes) {
        try {
            return objectMapper.writeValueAsString(remotes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化远程列表失败", e);
        }
    }

    private List<GitRemote> readRemotes(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            List<GitRemote> parsed = objectMapper.readValue(raw, REMOTE_LIST);
            return parsed.stream().filter(r -> r != null && r.name() != null && !r.name().isEmpty()).toList();
        } catch (JsonProcessingException e) {
            log.warn("远程列表解析失败，按空列表处理：{}", e.getOriginalMessage());
            return List.of();
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
