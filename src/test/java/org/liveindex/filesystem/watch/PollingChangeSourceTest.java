package org.liveindex.filesystem.watch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.liveindex.filesystem.CanonicalPaths;
import org.liveindex.filesystem.IgnoredPaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PollingChangeSourceTest {

    @TempDir
    Path root;

    private static final PollingChangeSource.NodeState DIR = new PollingChangeSource.NodeState(true, 0, 1);

    private static PollingChangeSource.NodeState file(long size, long mtime) {
        return new PollingChangeSource.NodeState(false, size, mtime);
    }

    @Test
    void diff_reportsOnlyTopmostRemoval() {
        Path base = Path.of("/r");
        Map<Path, PollingChangeSource.NodeState> before = new LinkedHashMap<>();
        before.put(base, DIR);
        before.put(base.resolve("d"), DIR);
        before.put(base.resolve("d/x.txt"), file(1, 1));
        before.put(base.resolve("keep.txt"), file(1, 1));
        Map<Path, PollingChangeSource.NodeState> after = new LinkedHashMap<>();
        after.put(base, DIR);
        after.put(base.resolve("keep.txt"), file(1, 1));

        List<FileChangeEvent> events = PollingChangeSource.diff(before, after);

        assertThat(events).containsExactly(FileChangeEvent.of(FileChangeEvent.Kind.REMOVE_DIRECTORY, base.resolve("d")));
    }

    @Test
    void diff_reportsAddsParentFirstAndFileChanges() {
        Path base = Path.of("/r");
        Map<Path, PollingChangeSource.NodeState> before = new LinkedHashMap<>();
        before.put(base, DIR);
        before.put(base.resolve("a.txt"), file(1, 1));
        Map<Path, PollingChangeSource.NodeState> after = new LinkedHashMap<>();
        after.put(base, new PollingChangeSource.NodeState(true, 0, 99));
        after.put(base.resolve("a.txt"), file(2, 1));
        after.put(base.resolve("n"), DIR);
        after.put(base.resolve("n/m.txt"), file(1, 1));

        List<FileChangeEvent> events = PollingChangeSource.diff(before, after);

        assertThat(events).containsExactly(
                FileChangeEvent.of(FileChangeEvent.Kind.CHANGE_FILE, base.resolve("a.txt")),
                FileChangeEvent.of(FileChangeEvent.Kind.ADD_DIRECTORY, base.resolve("n")),
                FileChangeEvent.of(FileChangeEvent.Kind.ADD_FILE, base.resolve("n/m.txt")));
    }

    @Test
    void diff_kindChangeBecomesRemoveThenAdd() {
        Path base = Path.of("/r");
        Map<Path, PollingChangeSource.NodeState> before = new LinkedHashMap<>();
        before.put(base.resolve("x"), file(1, 1));
        Map<Path, PollingChangeSource.NodeState> after = new LinkedHashMap<>();
        after.put(base.resolve("x"), DIR);

        assertThat(PollingChangeSource.diff(before, after)).containsExactly(
                FileChangeEvent.of(FileChangeEvent.Kind.REMOVE_FILE, base.resolve("x")),
                FileChangeEvent.of(FileChangeEvent.Kind.ADD_DIRECTORY, base.resolve("x")));
    }

    @Test
    void poll_detectsChangesOnDisk() throws IOException {
        Files.writeString(root.resolve("a.txt"), "a");
        Files.writeString(root.resolve("gone.txt"), "g");
        CanonicalPaths paths = new CanonicalPaths(root);
        PollingChangeSource source = new PollingChangeSource(paths, new IgnoredPaths(paths, List.of(".sock")), false, Duration.ofHours(1));
        List<FileChangeEvent> events = new ArrayList<>();
        source.poll(e -> { });

        Files.writeString(root.resolve("a.txt"), "longer content");
        Files.delete(root.resolve("gone.txt"));
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve("sub/new.txt"), "n");
        Files.writeString(root.resolve("ignored.sock"), "");
        source.poll(events::add);

        assertThat(events).containsExactlyInAnyOrder(
                FileChangeEvent.of(FileChangeEvent.Kind.REMOVE_FILE, paths.root().resolve("gone.txt")),
                FileChangeEvent.of(FileChangeEvent.Kind.CHANGE_FILE, paths.root().resolve("a.txt")),
                FileChangeEvent.of(FileChangeEvent.Kind.ADD_DIRECTORY, paths.root().resolve("sub")),
                FileChangeEvent.of(FileChangeEvent.Kind.ADD_FILE, paths.root().resolve("sub/new.txt")));
    }

    @Test
    void snapshot_isPreOrderWithSortedChildren() throws IOException {
        Files.createDirectories(root.resolve("b/inner"));
        Files.writeString(root.resolve("a.txt"), "a");
        Files.writeString(root.resolve("b/inner/z.txt"), "z");
        CanonicalPaths paths = new CanonicalPaths(root);
        PollingChangeSource source = new PollingChangeSource(paths, new IgnoredPaths(paths, List.of()), false, Duration.ofSeconds(1));

        assertThat(new ArrayList<>(source.snapshot().keySet())).containsExactly(
                paths.root(),
                paths.root().resolve("a.txt"),
                paths.root().resolve("b"),
                paths.root().resolve("b/inner"),
                paths.root().resolve("b/inner/z.txt"));
    }
}
