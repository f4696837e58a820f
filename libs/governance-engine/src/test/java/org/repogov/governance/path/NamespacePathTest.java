package org.repogov.governance.path;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespacePathTest {

    @Test
    void testParentAndLeaf() {
        NamespacePath path = NamespacePath.of("Framestore", "team-a", "widget");

        assertThat(path.root()).isEqualTo("Framestore");
        assertThat(path.leaf()).isEqualTo("widget");
        assertThat(path.depth()).isEqualTo(3);
        assertThat(path.parent()).isEqualTo(NamespacePath.of("Framestore", "team-a"));
        assertThat(NamespacePath.of("Framestore").parent()).isNull();
    }

    @Test
    void testImmutableSegments() {
        List<String> segments = new ArrayList<>(List.of("Framestore", "team-a"));
        NamespacePath path = new NamespacePath(segments);
        segments.add("widget");

        assertThat(path.toString()).isEqualTo("Framestore/team-a");
        assertThatThrownBy(() -> path.segments().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testEmptyPathRejected() {
        assertThatThrownBy(() -> new NamespacePath(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
