package com.blockdsl.tree;

import com.blockdsl.api.model.BlockField;
import com.blockdsl.api.model.BlockType;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.LogicBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link BlockForest} arena and its pure mutators.
 */
class BlockForestTest {

    private BlockForest forest;

    @BeforeEach
    void setUp() {
        // s1, loop(s2, inner(s3)), c1
        forest = BlockForest.empty()
            .add(BlockForest.ROOT, LogicBlock.set("s1", "order.status", "\"New\""))
            .add(BlockForest.ROOT, LogicBlock.forEach("loop", "item", "LineItem", "item.qty > 0"))
            .add("loop", LogicBlock.set("s2", "item.flag", "true"))
            .add("loop", LogicBlock.forEach("inner", "tag", "Tag", ""))
            .add("inner", LogicBlock.set("s3", "tag.seen", "true"))
            .add(null, LogicBlock.call("c1", "Billing", "charge", List.of(new CallArgument("amount", "10"))));
    }

    private static List<String> ids(List<LogicBlock> blocks) {
        return blocks.stream().map(LogicBlock::id).toList();
    }

    @Test
    @DisplayName("Should build nested structure with parent links")
    void shouldBuildNestedStructure() {
        assertThat(forest.size()).isEqualTo(6);
        assertThat(ids(forest.roots())).containsExactly("s1", "loop", "c1");
        assertThat(forest.childIds("loop")).containsExactly("s2", "inner");
        assertThat(forest.childIds("inner")).containsExactly("s3");
        assertThat(forest.parentOf("s3")).contains("inner");
        assertThat(forest.parentOf("s1")).contains(BlockForest.ROOT);
        assertThat(ids(forest.depthFirst())).containsExactly("s1", "loop", "s2", "inner", "s3", "c1");
    }

    @Test
    @DisplayName("Should project the arena as a nested tree")
    void shouldProjectTree() {
        List<BlockNode> tree = forest.toTree();

        assertThat(tree).hasSize(3);
        BlockNode loop = tree.get(1);
        assertThat(loop.block().id()).isEqualTo("loop");
        assertThat(loop.children()).extracting(node -> node.block().id()).containsExactly("s2", "inner");
        assertThat(loop.children().get(1).children()).hasSize(1);
        assertThat(tree.get(0).children()).isEmpty();
    }

    @Nested
    @DisplayName("add")
    class Add {

        @Test
        @DisplayName("Should be a no-op for an unknown parent")
        void shouldIgnoreUnknownParent() {
            assertThat(forest.add("missing", LogicBlock.set("x", "a", "b"))).isSameAs(forest);
        }

        @Test
        @DisplayName("Should be a no-op for a non-container parent")
        void shouldIgnoreNonContainerParent() {
            assertThat(forest.add("s1", LogicBlock.set("x", "a", "b"))).isSameAs(forest);
        }

        @Test
        @DisplayName("Should reject duplicate ids anywhere in the forest")
        void shouldRejectDuplicateIds() {
            assertThat(forest.add(BlockForest.ROOT, LogicBlock.set("s3", "a", "b"))).isSameAs(forest);
            assertThat(forest.add(BlockForest.ROOT, LogicBlock.set(BlockForest.ROOT, "a", "b"))).isSameAs(forest);
        }

        @Test
        @DisplayName("Should never accept a PRECONDITION block")
        void shouldRejectPrecondition() {
            LogicBlock check = LogicBlock.empty("p1", BlockType.PRECONDITION);

            assertThat(forest.add(BlockForest.ROOT, check)).isSameAs(forest);
            assertThat(forest.add("loop", check)).isSameAs(forest);
        }

        @Test
        @DisplayName("Should give a new FOR block an empty child list")
        void shouldRegisterContainer() {
            BlockForest updated = forest.add("inner", LogicBlock.empty("deep", BlockType.FOR))
                .add("deep", LogicBlock.empty("leaf", BlockType.TRIGGER));

            assertThat(updated.parentOf("leaf")).contains("deep");
            assertThat(updated.childIds("deep")).containsExactly("leaf");
            assertThat(forest.contains("deep")).isFalse();
        }
    }

    @Nested
    @DisplayName("updateField")
    class UpdateField {

        @Test
        @DisplayName("Should update a deeply nested block and share the rest")
        void shouldUpdateNestedBlock() {
            BlockForest updated = forest.updateField("s3", BlockField.VALUE, "false");

            assertThat(updated).isNotSameAs(forest);
            assertThat(updated.find("s3")).get().extracting(LogicBlock::value).isEqualTo("false");
            assertThat(updated.find("s1").get()).isSameAs(forest.find("s1").get());
            assertThat(updated.childIds("loop")).isEqualTo(forest.childIds("loop"));
            assertThat(forest.find("s3").get().value()).isEqualTo("true");
        }

        @Test
        @DisplayName("Should return the same instance for unknown id, foreign field or equal value")
        void shouldDetectNoOps() {
            assertThat(forest.updateField("nope", BlockField.VALUE, "x")).isSameAs(forest);
            assertThat(forest.updateField("loop", BlockField.VALUE, "x")).isSameAs(forest);
            assertThat(forest.updateField("s1", BlockField.TARGET, "order.status")).isSameAs(forest);
        }

        @Test
        @DisplayName("Should replace CALL arguments only on CALL blocks")
        void shouldUpdateArguments() {
            List<CallArgument> args = List.of(new CallArgument("amount", "20"), new CallArgument("currency", "\"EUR\""));

            BlockForest updated = forest.updateArguments("c1", args);

            assertThat(updated.find("c1").get().args()).isEqualTo(args);
            assertThat(forest.updateArguments("s1", args)).isSameAs(forest);
        }

        @Test
        @DisplayName("Should refuse updates that change id or type")
        void shouldRefuseIdentityChange() {
            assertThatThrownBy(() -> forest.update("s1", b -> LogicBlock.set("other", "a", "b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("keep id and type");
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        @DisplayName("Should remove a FOR block together with its subtree")
        void shouldRemoveSubtree() {
            BlockForest updated = forest.remove("loop");

            assertThat(updated.ids()).containsExactlyInAnyOrder("s1", "c1");
            assertThat(updated.childIds("loop")).isEmpty();
            assertThat(updated.childIds("inner")).isEmpty();
            assertThat(updated.parentOf("s3")).isEmpty();
            assertThat(ids(updated.roots())).containsExactly("s1", "c1");
        }

        @Test
        @DisplayName("Should remove a nested leaf and keep its siblings in order")
        void shouldRemoveNestedLeaf() {
            BlockForest updated = forest.remove("s2");

            assertThat(updated.childIds("loop")).containsExactly("inner");
            assertThat(updated.size()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should be a no-op for unknown ids and the root container")
        void shouldIgnoreUnknown() {
            assertThat(forest.remove("ghost")).isSameAs(forest);
            assertThat(forest.remove(BlockForest.ROOT)).isSameAs(forest);
            assertThat(forest.remove(null)).isSameAs(forest);
        }
    }

    @Nested
    @DisplayName("reorder")
    class Reorder {

        @Test
        @DisplayName("Should move a block to the index of its sibling")
        void shouldMoveWithinSiblings() {
            BlockForest updated = forest.reorder("c1", "s1");

            assertThat(ids(updated.roots())).containsExactly("c1", "s1", "loop");
            assertThat(updated.childIds("loop")).isEqualTo(forest.childIds("loop"));
        }

        @Test
        @DisplayName("Should move forward using remove-then-insert")
        void shouldMoveForward() {
            BlockForest updated = forest.reorder("s1", "c1");

            assertThat(ids(updated.roots())).containsExactly("loop", "c1", "s1");
        }

        @Test
        @DisplayName("Should reorder inside a nested container only")
        void shouldReorderNested() {
            BlockForest updated = forest.reorder("inner", "s2");

            assertThat(updated.childIds("loop")).containsExactly("inner", "s2");
            assertThat(updated.childIds(BlockForest.ROOT)).isEqualTo(forest.childIds(BlockForest.ROOT));
        }

        @Test
        @DisplayName("Should ignore cross-level moves and identical ids")
        void shouldIgnoreCrossLevel() {
            assertThat(forest.reorder("s2", "s1")).isSameAs(forest);
            assertThat(forest.reorder("s1", "s1")).isSameAs(forest);
            assertThat(forest.reorder("s1", "ghost")).isSameAs(forest);
        }
    }

    @Test
    @DisplayName("Builder should follow the same insertion rules")
    void builderShouldFollowAddRules() {
        BlockForest.Builder builder = BlockForest.builder();

        assertThat(builder.append(BlockForest.ROOT, LogicBlock.forEach("f", "v", "E", ""))).isTrue();
        assertThat(builder.append("f", LogicBlock.set("a", "x", "1"))).isTrue();
        assertThat(builder.append("a", LogicBlock.set("b", "x", "1"))).isFalse();
        assertThat(builder.append(BlockForest.ROOT, LogicBlock.set("a", "x", "1"))).isFalse();
        assertThat(builder.append(BlockForest.ROOT, LogicBlock.empty("p", BlockType.PRECONDITION))).isFalse();

        BlockForest built = builder.build();
        BlockForest added = BlockForest.empty()
            .add(BlockForest.ROOT, LogicBlock.forEach("f", "v", "E", ""))
            .add("f", LogicBlock.set("a", "x", "1"));
        assertThat(built).isEqualTo(added);
    }

    @Test
    @DisplayName("Empty builder should yield the shared empty forest")
    void emptyBuilderShouldYieldEmpty() {
        assertThat(BlockForest.builder().build()).isSameAs(BlockForest.empty());
        assertThat(BlockForest.empty().isEmpty()).isTrue();
        assertThat(BlockForest.empty().roots()).isEmpty();
    }
}
