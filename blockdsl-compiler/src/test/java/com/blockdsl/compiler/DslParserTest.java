package com.blockdsl.compiler;

import com.blockdsl.api.model.ActionSignature;
import com.blockdsl.api.model.BlockType;
import com.blockdsl.api.model.CallArgument;
import com.blockdsl.api.model.EditorMeta;
import com.blockdsl.api.model.EditorMode;
import com.blockdsl.api.model.LogicBlock;
import com.blockdsl.api.model.ParseResult;
import com.blockdsl.api.model.RuleSignature;
import com.blockdsl.tree.BlockForest;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DslParserTest {

    private DslParser parser;

    @BeforeEach
    void setUp() {
        AtomicInteger counter = new AtomicInteger();
        parser = new DslParser(OpenTelemetry.noop().getTracer("test"), () -> "b" + counter.incrementAndGet());
    }

    private static List<BlockType> types(List<LogicBlock> blocks) {
        return blocks.stream().map(LogicBlock::type).toList();
    }

    @Nested
    @DisplayName("RULE mode")
    class RuleMode {

        @Test
        @DisplayName("Should parse all statement shapes")
        void shouldParseStatements() {
            String dsl = """
                RULE Demo PRIORITY 10 {
                    ON UPDATE(Order.status)

                    SET order.status = "Shipped";
                    TRIGGER Invoice.create ON order;
                    CALL Billing.charge({ amount: order.total, currency: "EUR" });
                    CALL "Credit Bureau".score.v2({});
                }
                """;

            ParseResult result = parser.parse(dsl, EditorMode.RULE);

            assertThat(result.droppedLines()).isZero();
            assertThat(result.preconditions().isEmpty()).isTrue();
            List<LogicBlock> roots = result.statements().roots();
            assertThat(types(roots)).containsExactly(BlockType.SET, BlockType.TRIGGER, BlockType.CALL, BlockType.CALL);

            assertThat(roots.get(0).target()).isEqualTo("order.status");
            assertThat(roots.get(0).value()).isEqualTo("\"Shipped\"");

            assertThat(roots.get(1).actionEntity()).isEqualTo("Invoice");
            assertThat(roots.get(1).actionName()).isEqualTo("create");
            assertThat(roots.get(1).target()).isEqualTo("order");

            assertThat(roots.get(2).dataProduct()).isEqualTo("Billing");
            assertThat(roots.get(2).methodName()).isEqualTo("charge");
            assertThat(roots.get(2).args()).containsExactly(
                new CallArgument("amount", "order.total"),
                new CallArgument("currency", "\"EUR\""));

            assertThat(roots.get(3).dataProduct()).isEqualTo("Credit Bureau");
            assertThat(roots.get(3).methodName()).isEqualTo("score.v2");
            assertThat(roots.get(3).args()).isEmpty();
        }

        @Test
        @DisplayName("Should keep nested commas and inner ');' inside CALL argument values")
        void shouldKeepCallValuesWhole() {
            String dsl = """
                CALL Erp.ship({ qty: max(a, b) });
                CALL Erp.ship({ note: f(x);, qty: 2 });
                CALL Erp.ship({ label: "a, b", dims: [1, 2], qty: 3 });
                """;

            List<LogicBlock> roots = parser.parse(dsl, EditorMode.RULE).statements().roots();

            assertThat(roots).hasSize(3);
            assertThat(roots.get(0).args()).containsExactly(new CallArgument("qty", "max(a, b)"));
            assertThat(roots.get(1).args()).containsExactly(
                new CallArgument("note", "f(x);"),
                new CallArgument("qty", "2"));
            assertThat(roots.get(2).args()).containsExactly(
                new CallArgument("label", "\"a, b\""),
                new CallArgument("dims", "[1, 2]"),
                new CallArgument("qty", "3"));
        }

        @Test
        @DisplayName("Should nest statements under FOR until the closing brace")
        void shouldNestLoops() {
            String dsl = """
                RULE Nest PRIORITY 1 {
                    FOR (item: LineItem WHERE item.qty > 0) {
                        SET item.flag = true;
                        FOR (tag: Tag) {
                            SET tag.seen = true;
                        }
                        SET item.done = true;
                    }
                    SET order.checked = true;
                }
                """;

            BlockForest forest = parser.parse(dsl, EditorMode.RULE).statements();

            assertThat(types(forest.roots())).containsExactly(BlockType.FOR, BlockType.SET);
            LogicBlock loop = forest.roots().get(0);
            assertThat(loop.variable()).isEqualTo("item");
            assertThat(loop.entity()).isEqualTo("LineItem");
            assertThat(loop.conditions()).isEqualTo("item.qty > 0");

            List<LogicBlock> children = forest.childrenOf(loop.id());
            assertThat(types(children)).containsExactly(BlockType.SET, BlockType.FOR, BlockType.SET);
            assertThat(children.get(1).conditions()).isEmpty();
            assertThat(forest.childrenOf(children.get(1).id())).extracting(LogicBlock::target).containsExactly("tag.seen");
        }

        @Test
        @DisplayName("Should drop unknown lines, comments and stray braces without failing")
        void shouldBeLenient() {
            String dsl = """
                // header comment
                SET a = 1;
                garbage here
                IF x THEN y;
                }
                }
                SET b = 2;
                SET missing_semicolon = 3
                """;

            ParseResult result = parser.parse(dsl, EditorMode.RULE);

            assertThat(result.statements().roots()).extracting(LogicBlock::target).containsExactly("a", "b");
            assertThat(result.droppedLines()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should treat a trailing comment after a statement as ignorable")
        void shouldIgnoreTrailingText() {
            ParseResult result = parser.parse("SET a = 1; // note", EditorMode.RULE);

            assertThat(result.statements().roots()).hasSize(1);
        }

        @Test
        @DisplayName("Should never parse PRECONDITION lines in RULE mode")
        void shouldIgnorePreconditionsInRuleMode() {
            ParseResult result = parser.parse("PRECONDITION ok: true\n    ON_FAILURE: \"no\"\nSET a = 1;", EditorMode.RULE);

            assertThat(result.preconditions().isEmpty()).isTrue();
            assertThat(result.statements().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return an empty result for null or blank input")
        void shouldHandleEmptyInput() {
            assertThat(parser.parse(null, EditorMode.RULE).statements().isEmpty()).isTrue();
            assertThat(parser.parse("   \n\n", EditorMode.ACTION).statements().isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("ACTION mode")
    class ActionMode {

        @Test
        @DisplayName("Should read preconditions anywhere and statements only after EFFECT")
        void shouldSplitPreconditionsAndEffect() {
            String dsl = """
                ACTION Order.ship(carrier: String, express: Boolean?) {
                    DESCRIPTION: "Ships the order"

                    SET ignored.before = effect;
                    PRECONDITION paid: order.paid == true
                        ON_FAILURE: "Order must be paid"
                    PRECONDITION stocked: order.stock > 0
                    EFFECT {
                        SET order.status = "Shipped";
                        FOR (line: Line) {
                            TRIGGER Line.pack ON line;
                        }
                    }
                }
                """;

            ParseResult result = parser.parse(dsl, EditorMode.ACTION);

            assertThat(result.preconditions().asList())
                .extracting(LogicBlock::label, LogicBlock::conditions, LogicBlock::onFailure)
                .containsExactly(
                    tuple("paid", "order.paid == true", "Order must be paid"),
                    tuple("stocked", "order.stock > 0", null));

            BlockForest forest = result.statements();
            assertThat(types(forest.roots())).containsExactly(BlockType.SET, BlockType.FOR);
            assertThat(forest.roots().get(0).target()).isEqualTo("order.status");
            assertThat(forest.childrenOf(forest.roots().get(1).id())).hasSize(1);
        }

        @Test
        @DisplayName("Should assign ids unique across statements and preconditions")
        void shouldAssignUniqueIds() {
            DslParser repeating = new DslParser(OpenTelemetry.noop().getTracer("test"),
                new java.util.Iterator<String>() {
                    private int n;
                    @Override public boolean hasNext() { return true; }
                    @Override public String next() { return "id" + (n++ / 2); }
                }::next);

            ParseResult result = repeating.parse("""
                ACTION A.b {
                    PRECONDITION one: x
                    EFFECT {
                        SET a = 1;
                        SET b = 2;
                    }
                }
                """, EditorMode.ACTION);

            List<String> statementIds = result.statements().roots().stream().map(LogicBlock::id).toList();
            String preconditionId = result.preconditions().asList().get(0).id();
            assertThat(statementIds).doesNotHaveDuplicates().doesNotContain(preconditionId);
        }
    }

    @Nested
    @DisplayName("Signatures")
    class Signatures {

        @Test
        @DisplayName("Should read the rule header and trigger")
        void shouldReadRuleSignature() {
            RuleSignature signature = parser.parseRuleSignature("""
                RULE AutoShip PRIORITY 250 {
                    ON UPDATE(Order.status)
                }
                """).orElseThrow();

            assertThat(signature.name()).isEqualTo("AutoShip");
            assertThat(signature.priority()).isEqualTo(250);
            assertThat(signature.trigger()).isEqualTo(new EditorMeta.Trigger("UPDATE", "Order", "status"));
        }

        @Test
        @DisplayName("Should read a rule without trigger and reject malformed headers")
        void shouldHandlePartialRuleHeaders() {
            assertThat(parser.parseRuleSignature("RULE X PRIORITY -5 {\n}").orElseThrow().trigger()).isNull();
            assertThat(parser.parseRuleSignature("RULE X PRIORITY high {")).isEmpty();
            assertThat(parser.parseRuleSignature("RULE X PRIORITY 99999999999 {")).isEmpty();
            assertThat(parser.parseRuleSignature(null)).isEmpty();
        }

        @Test
        @DisplayName("Should read the action header, parameters and unescaped description")
        void shouldReadActionSignature() {
            ActionSignature signature = parser.parseActionSignature("""
                ACTION Order.ship(carrier: String, express: Boolean?) {
                    DESCRIPTION: "Ships the \\"big\\" order"
                    EFFECT {
                    }
                }
                """).orElseThrow();

            assertThat(signature.entityType()).isEqualTo("Order");
            assertThat(signature.actionName()).isEqualTo("ship");
            assertThat(signature.parameters()).containsExactly(
                new EditorMeta.Parameter("carrier", "String", false),
                new EditorMeta.Parameter("express", "Boolean", true));
            assertThat(signature.description()).isEqualTo("Ships the \"big\" order");
        }

        @Test
        @DisplayName("Should read an action without parameters or description")
        void shouldReadBareAction() {
            ActionSignature signature = parser.parseActionSignature("ACTION Order {\n}").orElseThrow();

            assertThat(signature.entityType()).isEqualTo("Order");
            assertThat(signature.actionName()).isEmpty();
            assertThat(signature.parameters()).isEmpty();
            assertThat(signature.description()).isNull();
            assertThat(parser.parseActionSignature("RULE X PRIORITY 1 {")).isEmpty();
        }
    }
}
