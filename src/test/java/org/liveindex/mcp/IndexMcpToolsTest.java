package org.liveindex.mcp;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.liveindex.filesystem.EntryNotFoundException;
import org.liveindex.filesystem.IndexFixture;
import org.liveindex.filesystem.IndexLifecycle;
import org.liveindex.filesystem.IndexProperties;
import org.liveindex.filesystem.content.ClientRequestTracker;
import org.liveindex.filesystem.content.FileContentService;
import org.liveindex.filesystem.dto.EntryDetail;
import org.liveindex.filesystem.dto.TagMutationResult;
import org.liveindex.filesystem.watch.IndexWatcher;
import org.liveindex.filesystem.watch.PollingChangeSource;
import org.springframework.ai.tool.ToolCallback;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexMcpToolsTest {

    @TempDir
    Path root;

    private IndexFixture fixture;
    private IndexMcpTools tools;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/a.txt"), "alpha\nfoobar\ngamma");
        fixture = new IndexFixture(root).scan();
        IndexProperties properties = new IndexProperties();
        properties.setWatchEnabled(false);
        IndexWatcher watcher = new IndexWatcher(fixture.reconciler(),
                mode -> new PollingChangeSource(fixture.paths(), fixture.ignored(), false, Duration.ofSeconds(1)));
        IndexLifecycle lifecycle = new IndexLifecycle(fixture.scanner(), fixture.pipeline(), watcher,
                fixture.paths(), fixture.ignored(), fixture.git(), properties);
        FileContentService content = new FileContentService(
                fixture.paths(), fixture.store(), new ClientRequestTracker(), 50, 240);
        tools = new IndexMcpTools(fixture.queries(), fixture.tags(), content, lifecycle);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void toolCallbacks_exposeEveryTool() {
        List<ToolCallback> callbacks = new McpToolConfiguration().indexToolCallbacks(tools);

        assertThat(callbacks).extracting(c -> c.getToolDefinition().name()).containsExactlyInAnyOrder(
                "index_tree", "index_entry", "index_search", "index_suggest",
                "index_file_search", "index_tag_add", "index_tag_remove", "index_status");
    }

    @Test
    void tagRoundTripIsVisibleToSearch() {
        TagMutationResult added = tools.addTag("/src/a.txt", "lang", "txt");

        assertThat(added.changed()).isTrue();
        assertThat(tools.search(null, "lang:txt")).extracting(EntryDetail::path).containsExactly("/src/a.txt");
        assertThat(tools.removeTag("/src/a.txt", "lang", "txt").changed()).isTrue();
        assertThat(tools.search(null, "lang:txt")).isEmpty();
    }

    @Test
    void entryAndFileSearch() {
        assertThat(tools.entry("/src/a.txt").size()).isEqualTo(18L);
        assertThat(tools.fileSearch("/src/a.txt", "foo")).singleElement()
                .satisfies(m -> assertThat(m.line()).isEqualTo(2));
        assertThatThrownBy(() -> tools.entry("/nope")).isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void treeAndStatus() {
        assertThat(tools.tree().root().children()).hasSize(1);
        assertThat(tools.status().entryCount()).isEqualTo(3);
        assertThat(tools.status().watchMode()).isEqualTo("stopped");
    }
}
