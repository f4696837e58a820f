package org.repogov.governance.path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.repogov.governance.exception.InvalidPathException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PathResolver")
class PathResolverTest {

    private final PathResolver resolver = new PathResolver("Framestore");

    @Nested
    @DisplayName("resolvePath")
    class ResolvePath {

        @Test
        @DisplayName("should split group and project")
        void shouldSplitGroupAndProject() {
            ResolvedPath resolved = resolver.resolvePath("tools/pipeline/widget");

            assertThat(resolved.groupPath()).isEqualTo("tools/pipeline");
            assertThat(resolved.projectName()).isEqualTo("widget");
        }

        @Test
        @DisplayName("should strip a .git suffix")
        void shouldStripGitSuffix() {
            ResolvedPath resolved = resolver.resolvePath("team-a/widget.git");

            assertThat(resolved.groupPath()).isEqualTo("team-a");
            assertThat(resolved.projectName()).isEqualTo("widget");
        }

        @Test
        @DisplayName("should leave the group empty for a bare name")
        void shouldAllowBareName() {
            ResolvedPath resolved = resolver.resolvePath("widget");

            assertThat(resolved.group()).isEmpty();
            assertThat(resolved.projectName()).isEqualTo("widget");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "team a/widget", "team-a/", "/widget", "team-a/widget.tar.gz"})
        @DisplayName("should reject malformed paths")
        void shouldRejectMalformedPaths(String raw) {
            assertThatThrownBy(() -> resolver.resolvePath(raw)).isInstanceOf(InvalidPathException.class);
        }
    }

    @Nested
    @DisplayName("rootedPath")
    class RootedPath {

        @ParameterizedTest
        @ValueSource(strings = {"team-a", "team-a/tools", "users/vfx", "a/b/c/d"})
        @DisplayName("should give the same result with or without the root segment")
        void shouldBeIdempotent(String path) {
            assertThat(resolver.rootedPath(path)).isEqualTo(resolver.rootedPath("Framestore/" + path));
            assertThat(resolver.rootedPath(path).toString()).isEqualTo("Framestore/" + path);
        }

        @Test
        @DisplayName("should compare the root segment case-insensitively")
        void shouldMatchRootIgnoringCase() {
            NamespacePath rooted = resolver.rootedPath("framestore/users");

            assertThat(rooted.segments()).containsExactly("framestore", "users");
        }

        @Test
        @DisplayName("should treat null and blank as the root alone")
        void shouldDefaultToRoot() {
            assertThat(resolver.rootedPath(null)).isEqualTo(NamespacePath.of("Framestore"));
            assertThat(resolver.rootedPath("  ")).isEqualTo(NamespacePath.of("Framestore"));
        }

        @Test
        @DisplayName("should reject empty segments")
        void shouldRejectEmptySegments() {
            assertThatThrownBy(() -> resolver.rootedPath("team-a//widget")).isInstanceOf(InvalidPathException.class);
        }
    }

    @Nested
    @DisplayName("validateProjectName")
    class ValidateProjectName {

        @ParameterizedTest
        @ValueSource(strings = {"widget", "render-farm-tools", "-", "a"})
        @DisplayName("should accept lowercase letters and dashes")
        void shouldAcceptLowercaseAndDashes(String name) {
            assertThatCode(() -> PathResolver.validateProjectName(name)).doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {"Widget", "widget2", "render_farm", "", "widget.git", "wid get"})
        @DisplayName("should reject uppercase, digits, underscores and anything else")
        void shouldRejectEverythingElse(String name) {
            assertThatThrownBy(() -> PathResolver.validateProjectName(name))
                    .isInstanceOf(InvalidPathException.class)
                    .hasMessageContaining("lowercase and dashes only");
        }
    }

    @Test
    @DisplayName("should refuse a multi-segment root")
    void shouldRefuseMultiSegmentRoot() {
        assertThatThrownBy(() -> new PathResolver("a/b")).isInstanceOf(IllegalArgumentException.class);
    }
}
