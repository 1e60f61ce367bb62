package org.liveindex.filesystem.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.liveindex.filesystem.IndexFixture;
import org.liveindex.filesystem.dto.TreeNode;
import org.liveindex.filesystem.index.ChangeEvent;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileChangeReconcilerTest {

    @TempDir
    Path root;

    private IndexFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src/b"));
        Files.writeString(root.resolve("src/a.txt"), "hello");
        Files.writeString(root.resolve("src/b/c.txt"), "c");
        fixture = new IndexFixture(root).scan();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void addFile_backfillsMissingAncestors() throws IOException {
        Path deep = Files.createDirectories(root.resolve("x/y"));
        Files.writeString(deep.resolve("z.txt"), "z");

        fixture.reconciler().apply(FileChangeEvent.of(FileChangeEvent.Kind.ADD_FILE, deep.resolve("z.txt")));

        assertThat(fixture.store().exists("/x")).isTrue();
        assertThat(fixture.store().exists("/x/y")).isTrue();
        assertThat(fixture.store().exists("/x/y/z.txt")).isTrue();
        assertThat(fixture.broadcaster().events()).containsExactly(
                ChangeEvent.entryAdded("/x"), ChangeEvent.entryAdded("/x/y"), ChangeEvent.entryAdded("/x/y/z.txt"));
        assertThat(fixture.pipeline().snapshot().entry("/x/y/z.txt")).isNotNull();
    }

    @Test
    void changeFile_updatesSizeAndBroadcastsUpdate() throws IOException {
        Files.writeString(root.resolve("src/a.txt"), "hello world");

        fixture.reconciler().apply(FileChangeEvent.of(FileChangeEvent.Kind.CHANGE_FILE, root.resolve("src/a.txt")));

        assertThat(fixture.store().findEntry("/src/a.txt").size()).isEqualTo(11L);
        assertThat(fixture.broadcaster().events()).containsExactly(ChangeEvent.entryUpdated("/src/a.txt"));
    }

    @Test
    void removeDirectory_dropsSubtreeAndItsTags() throws IOException {
        fixture.tags().add("/src/b/c.txt", "lang", "txt");
        Files.delete(root.resolve("src/b/c.txt"));
        Files.delete(root.resolve("src/b"));

        // 原生监听的删除事件不区分类型
        fixture.reconciler().apply(FileChangeEvent.of(FileChangeEvent.Kind.REMOVE_FILE, root.resolve("src/b")));

        TreeNode src = fixture.queries().tree().root().children().get(0);
        assertThat(src.children()).extracting(TreeNode::path).containsExactly("/src/a.txt");
        assertThat(fixture.store().exists("/src/b/c.txt")).isFalse();
        assertThat(fixture.queries().tags(null)).isEmpty();
        assertThat(fixture.broadcaster().events()).endsWith(ChangeEvent.entryRemoved("/src/b"));
    }

    @Test
    void removeUnknownPath_isSilent() {
        fixture.reconciler().apply(FileChangeEvent.of(FileChangeEvent.Kind.REMOVE_FILE, root.resolve("nope")));

        assertThat(fixture.broadcaster().events()).isEmpty();
        assertThat(fixture.reconciler().processedCount()).isEqualTo(1);
    }

    @Test
    void addIgnoredPath_isSkipped() throws IOException {
        Files.writeString(root.resolve("agent.sock"), "");

        fixture.reconciler().apply(FileChangeEvent.of(FileChangeEvent.Kind.ADD_FILE, root.resolve("agent.sock")));

        assertThat(fixture.store().exists("/agent.sock")).isFalse();
        assertThat(fixture.broadcaster().events()).isEmpty();
    }

    @Test
    void overflow_resyncsWholeTree() throws IOException {
        Files.delete(root.resolve("src/a.txt"));
        Files.writeString(root.resolve("late.txt"), "late");

        fixture.reconciler().apply(FileChangeEvent.overflow());

        assertThat(fixture.store().exists("/src/a.txt")).isFalse();
        assertThat(fixture.store().exists("/late.txt")).isTrue();
        assertThat(fixture.broadcaster().events()).containsExactly(ChangeEvent.entryUpdated("/"));
    }

    @Test
    void permissionError_marksPathIgnored() {
        Path secret = root.resolve("secret");

        fixture.reconciler().apply(FileChangeEvent.error(secret, new AccessDeniedException(secret.toString())));

        assertThat(fixture.ignored().isIgnored(secret)).isTrue();
    }
}
