package org.liveindex.filesystem.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.EntryNotFoundException;
import org.liveindex.filesystem.dto.EntryKind;
import org.liveindex.filesystem.dto.GitMetadata;
import org.liveindex.filesystem.dto.GitRemote;
import org.liveindex.filesystem.dto.IndexEntry;
import org.liveindex.filesystem.dto.Tag;
import org.liveindex.filesystem.dto.TagValue;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryStoreTest {

    private EmbeddedDatabase database;
    private EntryStore store;

    @BeforeEach
    void setUp() {
        database = IndexDatabase.create();
        store = new EntryStore(database, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private static IndexEntry dir(String path) {
        return new IndexEntry(path, CanonicalPaths.nameOf(path), CanonicalPaths.parentOf(path),
                EntryKind.DIRECTORY, null, 1L, "", CanonicalPaths.depthOf(path));
    }

    private static IndexEntry file(String path, long size) {
        String name = CanonicalPaths.nameOf(path);
        return new IndexEntry(path, name, CanonicalPaths.parentOf(path),
                EntryKind.FILE, size, 1L, CanonicalPaths.extensionOf(name), CanonicalPaths.depthOf(path));
    }

    @Test
    void upsertEntry_isIdempotentAndOverwrites() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(file("/a.txt", 5));
        store.upsertEntry(file("/a.txt", 5));
        store.upsertEntry(file("/a.txt", 9));

        assertThat(store.countEntries()).isEqualTo(2);
        assertThat(store.findEntry("/a.txt").size()).isEqualTo(9L);
        assertThat(store.findEntry("/missing")).isNull();
    }

    @Test
    void findAllEntries_ordersByDepthThenName() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(dir("/src"));
        store.upsertEntry(file("/src/B.txt", 1));
        store.upsertEntry(file("/src/a.txt", 1));
        store.upsertEntry(file("/Zeta.md", 1));

        assertThat(store.findAllEntries()).extracting(IndexEntry::path)
                .containsExactly("/", "/src", "/Zeta.md", "/src/a.txt", "/src/B.txt");
    }

    @Test
    void deleteSubtree_removesDescendantsTagsAndGitMetadata() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(dir("/src"));
        store.upsertEntry(dir("/src/b"));
        store.upsertEntry(file("/src/b/c.txt", 3));
        store.upsertEntry(file("/src/a.txt", 5));
        store.upsertEntry(file("/srcx.txt", 1));
        store.addTag(new Tag("/src/b/c.txt", "lang", "txt"));
        store.addTag(new Tag("/src/a.txt", "lang", "txt"));
        store.upsertGitMetadata(new GitMetadata("/src/b", 1L, "main", 3, 1, List.of()));

        int deleted = store.deleteSubtree("/src/b");

        assertThat(deleted).isEqualTo(2);
        assertThat(store.exists("/src/b")).isFalse();
        assertThat(store.exists("/src/b/c.txt")).isFalse();
        assertThat(store.exists("/src/a.txt")).isTrue();
        assertThat(store.exists("/srcx.txt")).isTrue();
        assertThat(store.findAllTags()).extracting(Tag::path).containsExactly("/src/a.txt");
        assertThat(store.findGitMetadata("/src/b")).isNull();
    }

    @Test
    void deleteSubtree_treatsLikeWildcardsLiterally() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(dir("/a_b"));
        store.upsertEntry(dir("/axb"));
        store.upsertEntry(file("/axb/c.txt", 1));

        store.deleteSubtree("/a_b");

        assertThat(store.exists("/axb/c.txt")).isTrue();
        assertThat(store.exists("/a_b")).isFalse();
    }

    @Test
    void addTag_isIdempotentAndRequiresEntry() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(file("/a.txt", 1));

        assertThat(store.addTag(new Tag("/a.txt", "lang", "txt"))).isTrue();
        assertThat(store.addTag(new Tag("/a.txt", "lang", "txt"))).isFalse();
        assertThat(store.addTag(new Tag("/a.txt", "lang", "md"))).isTrue();
        assertThat(store.tagsFor("/a.txt")).containsExactly(new TagValue("lang", "md"), new TagValue("lang", "txt"));
        assertThat(store.pathsWithTag("lang", "md")).containsExactly("/a.txt");

        assertThatThrownBy(() -> store.addTag(new Tag("/missing", "k", "v")))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void removeTag_reportsWhetherAnythingWasRemoved() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(file("/a.txt", 1));
        store.addTag(new Tag("/a.txt", "lang", "txt"));

        assertThat(store.removeTag(new Tag("/a.txt", "lang", "txt"))).isTrue();
        assertThat(store.removeTag(new Tag("/a.txt", "lang", "txt"))).isFalse();
        assertThat(store.findAllTags()).isEmpty();
    }

    @Test
    void gitMetadata_roundTripsRemotes() {
        store.upsertEntry(dir("/"));
        store.upsertEntry(dir("/repo"));
        List<GitRemote> remotes = List.of(new GitRemote("origin", "git@example.com:a.git", "git@example.com:a.git"));

        store.upsertGitMetadata(new GitMetadata("/repo", 10L, "main", 12, 2, remotes));
        store.upsertGitMetadata(new GitMetadata("/repo", 20L, "dev", 13, 2, remotes));

        GitMetadata loaded = store.findGitMetadata("/repo");
        assertThat(loaded.currentBranch()).isEqualTo("dev");
        assertThat(loaded.commitCount()).isEqualTo(13);
        assertThat(loaded.remotes()).isEqualTo(remotes);
        assertThat(store.findAllGitMetadata()).hasSize(1);
        assertThat(store.deleteGitMetadata("/repo")).isTrue();
        assertThat(store.findGitMetadata("/repo")).isNull();
    }

    @Test
    void escapeLike_escapesWildcards() {
        assertThat(EntryStore.escapeLike("/a_b%c\\d")).isEqualTo("/a\\_b\\%c\\\\d");
    }
}
