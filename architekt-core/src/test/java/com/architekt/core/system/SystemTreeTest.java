package com.architekt.core.system;

import com.architekt.core.TestProjects;
import com.architekt.core.error.NotFoundException;
import com.architekt.core.error.ValidationException;
import com.architekt.core.model.Project;
import com.architekt.core.model.SystemNode;
import com.architekt.core.util.Immutables;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architekt.core.TestProjects.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SystemTree}.
 */
class SystemTreeTest {

    @Test
    void add_underExistingParent_appendsChildId() {
        Project project = TestProjects.rootOnly();

        Project updated = SystemTree.add(project, ROOT, SystemNode.leaf("sysX", "Search", null, List.of("edge")));

        assertThat(updated.systems()).containsKeys(ROOT, "sysX");
        assertThat(updated.systems().get(ROOT).childIds()).containsExactly("sysX");
        assertThat(updated.systems().get("sysX").tags()).containsExactly("edge");
        assertThat(project.systems()).containsOnlyKeys(ROOT);
    }

    @Test
    void add_forcesNewSystemToBeChildlessLeaf() {
        SystemNode sneaky = new SystemNode("sysX", "Search", null, List.of(), List.of("other"), true);

        Project updated = SystemTree.add(TestProjects.rootOnly(), ROOT, sneaky);

        SystemNode added = updated.systems().get("sysX");
        assertThat(added.isRoot()).isFalse();
        assertThat(added.childIds()).isEmpty();
    }

    @Test
    void add_withMissingParent_throwsNotFound() {
        assertThatThrownBy(() -> SystemTree.add(TestProjects.rootOnly(), "missing",
                SystemNode.leaf("sysX", "Search", null, List.of())))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void add_withExistingId_throwsValidation() {
        Project project = TestProjects.threeSystems();

        assertThatThrownBy(() -> SystemTree.add(project, SYS_B, SystemNode.leaf(SYS_A, "Again", null, List.of())))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void remove_leaf_leavesOnlyRoot() {
        Project project = SystemTree.add(TestProjects.rootOnly(), ROOT, SystemNode.leaf("A", "A", null, List.of()));

        Project updated = SystemTree.remove(project, "A");

        assertThat(updated.systems()).containsOnlyKeys(ROOT);
        assertThat(updated.systems().get(ROOT).childIds()).isEmpty();
    }

    @Test
    void remove_subtree_removesEveryDescendant() {
        Project project = TestProjects.threeSystems();

        Project updated = SystemTree.remove(project, SYS_A);

        assertThat(updated.systems()).containsOnlyKeys(ROOT, SYS_B);
        assertThat(updated.systems().values())
            .allSatisfy(system -> assertThat(system.childIds()).doesNotContain(SYS_A, SYS_C));
    }

    @Test
    void remove_root_throwsValidationAndLeavesProjectUnchanged() {
        Project project = TestProjects.threeSystems();

        assertThatThrownBy(() -> SystemTree.remove(project, ROOT))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("root");
        assertThat(project.systems()).containsOnlyKeys(ROOT, SYS_A, SYS_B, SYS_C);
    }

    @Test
    void remove_rootWithoutChildren_stillThrowsValidation() {
        assertThatThrownBy(() -> SystemTree.remove(TestProjects.rootOnly(), ROOT))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void remove_missingSystem_throwsNotFound() {
        assertThatThrownBy(() -> SystemTree.remove(TestProjects.rootOnly(), "ghost"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void collectSubtree_withCyclicChildIds_terminates() {
        Project project = TestProjects.threeSystems();
        SystemNode cyclic = project.systems().get(SYS_C).withChildIds(List.of(SYS_A));
        Project malformed = project.withSystems(Immutables.with(project.systems(), SYS_C, cyclic));

        assertThat(SystemTree.collectSubtree(malformed, SYS_A)).containsExactlyInAnyOrder(SYS_A, SYS_C);
    }

    @Test
    void findParentId_returnsDirectParent() {
        Project project = TestProjects.threeSystems();

        assertThat(SystemTree.findParentId(project, SYS_C)).contains(SYS_A);
        assertThat(SystemTree.findParentId(project, ROOT)).isEmpty();
    }
}
