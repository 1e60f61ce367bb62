package org.liveindex.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalPathsTest {

    @TempDir
    Path root;

    @Test
    void toCanonical_mapsRootAndChildren() {
        CanonicalPaths paths = new CanonicalPaths(root);

        assertThat(paths.toCanonical(root)).isEqualTo("/");
        assertThat(paths.toCanonical(root.resolve("src").resolve("a.txt"))).isEqualTo("/src/a.txt");
        assertThat(paths.toCanonical(root.resolve("src/../b"))).isEqualTo("/b");
    }

    @Test
    void toCanonical_returnsNullOutsideRoot() {
        CanonicalPaths paths = new CanonicalPaths(root.resolve("inner"));

        assertThat(paths.toCanonical(root)).isNull();
        assertThat(paths.toCanonical(root.resolve("innerx/a"))).isNull();
        assertThat(paths.toCanonical(null)).isNull();
    }

    @Test
    void toAbsolute_roundTripsAndRejectsEscapes() {
        CanonicalPaths paths = new CanonicalPaths(root);

        assertThat(paths.toAbsolute("/")).isEqualTo(paths.root());
        assertThat(paths.toAbsolute("/src/a.txt")).isEqualTo(paths.root().resolve("src").resolve("a.txt"));
        assertThatThrownBy(() -> paths.toAbsolute("/src/../../etc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> paths.toAbsolute("src")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> paths.toAbsolute(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parentDepthNameAndExtension() {
        assertThat(CanonicalPaths.parentOf("/")).isNull();
        assertThat(CanonicalPaths.parentOf("/src")).isEqualTo("/");
        assertThat(CanonicalPaths.parentOf("/src/b/c.txt")).isEqualTo("/src/b");

        assertThat(CanonicalPaths.depthOf("/")).isZero();
        assertThat(CanonicalPaths.depthOf("/src")).isEqualTo(1);
        assertThat(CanonicalPaths.depthOf("/src/b/c.txt")).isEqualTo(3);

        assertThat(CanonicalPaths.nameOf("/src/b/c.txt")).isEqualTo("c.txt");
        assertThat(CanonicalPaths.extensionOf("Readme.MD")).isEqualTo("md");
        assertThat(CanonicalPaths.extensionOf(".bashrc")).isEmpty();
        assertThat(CanonicalPaths.extensionOf("Makefile")).isEmpty();
    }

    @Test
    void isSameOrDescendant_comparesWholeSegments() {
        assertThat(CanonicalPaths.isSameOrDescendant("/src/b", "/src")).isTrue();
        assertThat(CanonicalPaths.isSameOrDescendant("/src", "/src")).isTrue();
        assertThat(CanonicalPaths.isSameOrDescendant("/srcx", "/src")).isFalse();
        assertThat(CanonicalPaths.isSameOrDescendant("/anything", "/")).isTrue();
    }

    @Test
    void repositoryRootOfGitInternal_findsOwningRepository() {
        assertThat(CanonicalPaths.repositoryRootOfGitInternal("/.git/HEAD")).isEqualTo("/");
        assertThat(CanonicalPaths.repositoryRootOfGitInternal("/proj/.git/refs/heads/main")).isEqualTo("/proj");
        assertThat(CanonicalPaths.repositoryRootOfGitInternal("/proj/.git")).isEqualTo("/proj");
        assertThat(CanonicalPaths.repositoryRootOfGitInternal("/proj/.gitignore")).isNull();
        assertThat(CanonicalPaths.repositoryRootOfGitInternal("/proj/src/a.java")).isNull();
    }
}
