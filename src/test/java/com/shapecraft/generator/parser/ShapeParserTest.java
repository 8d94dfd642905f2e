package com.shapecraft.generator.parser;

import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.model.*;
import com.shapecraft.generator.parser.exception.ParseException;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ShapeParser.
 */
class ShapeParserTest {

    @Test
    void testParseHeaderAndProjection() {
        String source = """
            package com.acme.views;

            import com.acme.Order;
            import com.acme.model.*;

            projection OrderRow from Order o => {
                id: o.id,
                customerName: o.customer?.name
            };
            """;

        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ShapeFile file = ShapeParser.parseSource(source, "orders.shape", diagnostics);

        assertThat(diagnostics.getEntries()).isEmpty();
        assertThat(file.getPackageName()).isEqualTo("com.acme.views");
        assertThat(file.getImports()).containsExactly("com.acme.Order", "com.acme.model.*");
        assertThat(file.getProjections()).hasSize(1);

        ProjectionDeclaration projection = file.getProjections().get(0);
        assertThat(projection.getName()).isEqualTo("OrderRow");
        assertThat(projection.getSourceType().getName()).isEqualTo("Order");
        assertThat(projection.getParameterName()).isEqualTo("o");
        assertThat(projection.getPosition().getLine()).isEqualTo(6);

        ShapeNode body = (ShapeNode) projection.getBody();
        assertThat(body.isNamed()).isFalse();
        assertThat(body.getEntries()).extracting(ShapeEntry::getName).containsExactly("id", "customerName");

        MemberAccessNode name = (MemberAccessNode) body.getEntries().get(1).getValue();
        assertThat(name.getMember()).isEqualTo("name");
        assertThat(name.isNullSafe()).isTrue();
        MemberAccessNode customer = (MemberAccessNode) name.getTarget();
        assertThat(customer.isNullSafe()).isFalse();
        assertThat(customer.getTarget()).isInstanceOf(ParameterNode.class);
    }

    @Test
    void testWildcardImports() {
        String source = """
            package com.acme.views;
            import com.acme.*;
            import com.acme.model.Customer;
            import java.util.*;

            projection from Order o => { o.id };
            """;

        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ShapeFile file = ShapeParser.parseSource(source, "orders.shape", diagnostics);

        assertThat(diagnostics.getEntries()).isEmpty();
        assertThat(file.getImports()).containsExactly("com.acme.*", "com.acme.model.Customer", "java.util.*");
        assertThat(file.getProjections()).hasSize(1);
    }

    @Test
    void testWildcardMustEndImport() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ShapeParser.parseSource("import com.*.Order;\nprojection from Order o => { o.id };\n", "bad.shape",
                diagnostics);

        assertThat(diagnostics.has(DiagnosticCode.PARSE_ERROR)).isTrue();
    }

    @Test
    void testAnonymousProjectionWithCaptures() {
        String source = """
            projection (String prefix, int limit) from Order o => { label: prefix + o.number };
            """;

        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ProjectionDeclaration projection = ShapeParser.parseSource(source, "a.shape", diagnostics)
                .getProjections().get(0);

        assertThat(projection.getName()).isNull();
        assertThat(projection.getCaptures()).extracting(CaptureDeclaration::getName)
                .containsExactly("prefix", "limit");
        assertThat(projection.getCaptures().get(1).getType().getName()).isEqualTo("int");

        BinaryNode label = (BinaryNode) ((ShapeNode) projection.getBody()).getEntries().get(0).getValue();
        assertThat(label.getOperator()).isEqualTo(BinaryOperator.ADD);
        assertThat(label.getLeft()).isInstanceOf(CaptureNode.class);
    }

    @Test
    void testOperatorPrecedence() {
        ExprNode node = ShapeParser.parseExpression("o.a + o.b * 2 > 10 && !o.flag", "o", Set.of());

        BinaryNode and = (BinaryNode) node;
        assertThat(and.getOperator()).isEqualTo(BinaryOperator.AND);
        assertThat(and.getRight()).isInstanceOf(UnaryNode.class);

        BinaryNode greater = (BinaryNode) and.getLeft();
        assertThat(greater.getOperator()).isEqualTo(BinaryOperator.GREATER);

        BinaryNode add = (BinaryNode) greater.getLeft();
        assertThat(add.getOperator()).isEqualTo(BinaryOperator.ADD);
        assertThat(((BinaryNode) add.getRight()).getOperator()).isEqualTo(BinaryOperator.MULTIPLY);
    }

    @Test
    void testConditionalAndCoalesceBindLoosest() {
        ExprNode node = ShapeParser.parseExpression("o.a ?? o.b ?? \"x\"", "o", Set.of());

        CoalesceNode outer = (CoalesceNode) node;
        assertThat(outer.getFallback()).isInstanceOf(CoalesceNode.class);

        ExprNode conditional = ShapeParser.parseExpression("o.n > 0 ? o.a : o.b", "o", Set.of());
        assertThat(conditional).isInstanceOf(ConditionalNode.class);
        assertThat(((ConditionalNode) conditional).getCondition()).isInstanceOf(BinaryNode.class);
    }

    @Test
    void testLambdaParameterIsScoped() {
        ExprNode node = ShapeParser.parseExpression("o.items.map(i => { sku: i.sku, owner: o.id })", "o", Set.of());

        MethodCallNode map = (MethodCallNode) node;
        assertThat(map.getMethod()).isEqualTo("map");
        LambdaNode lambda = map.lambdaArgument();
        assertThat(lambda).isNotNull();
        assertThat(lambda.getParameter()).isEqualTo("i");

        ShapeNode element = (ShapeNode) lambda.getBody();
        MemberAccessNode sku = (MemberAccessNode) element.getEntries().get(0).getValue();
        assertThat(sku.getTarget()).isEqualTo(new ParameterNode("i", null));
        MemberAccessNode owner = (MemberAccessNode) element.getEntries().get(1).getValue();
        assertThat(((ParameterNode) owner.getTarget()).getName()).isEqualTo("o");
    }

    @Test
    void testUnnamedEntriesAndNamedTarget() {
        ExprNode node = ShapeParser.parseExpression("new com.acme.Summary { o.id, total: o.total }", "o", Set.of());

        ShapeNode shape = (ShapeNode) node;
        assertThat(shape.getTypeName()).isEqualTo("com.acme.Summary");
        assertThat(shape.getEntries().get(0).isExplicitlyNamed()).isFalse();
        assertThat(ExprQueries.implicitName(shape.getEntries().get(0).getValue())).contains("id");
        assertThat(shape.getEntries().get(1).getName()).isEqualTo("total");
    }

    @Test
    void testKeywordsAllowedAsMemberNames() {
        ExprNode node = ShapeParser.parseExpression("{ from: o.from, o.package }", "o", Set.of());

        ShapeNode shape = (ShapeNode) node;
        assertThat(shape.getEntries().get(0).getName()).isEqualTo("from");
        assertThat(((MemberAccessNode) shape.getEntries().get(1).getValue()).getMember()).isEqualTo("package");
    }

    @Test
    void testPrintingIsCanonical() {
        ExprNode parsed = ShapeParser.parseExpression("(o.a + o.b) * o.c", "o", Set.of());
        ExprNode reparsed = ShapeParser.parseExpression(parsed.toSource(), "o", Set.of());

        assertThat(parsed.toSource()).isEqualTo("(o.a + o.b) * o.c");
        assertThat(reparsed).isEqualTo(parsed);
    }

    @Test
    void testTypeExpressions() {
        TypeExpr list = ShapeParser.parseTypeExpression("List<com.acme.OrderItem>");
        assertThat(list.getName()).isEqualTo("List");
        assertThat(list.getArguments()).hasSize(1);

        TypeExpr array = ShapeParser.parseTypeExpression("int[][]");
        assertThat(array.getArrayDimensions()).isEqualTo(2);

        TypeExpr anonymous = ShapeParser.parseTypeExpression("{ city: String, zip: String }");
        assertThat(anonymous.isAnonymous()).isTrue();
        assertThat(anonymous.getAnonymousFields()).containsOnlyKeys("city", "zip");
    }

    @Test
    void testErrorRecoveryContinuesWithNextProjection() {
        String source = """
            projection Broken from Order o => { id: o.id +  };
            projection Fine from Order o => { id: o.id };
            """;

        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ShapeFile file = ShapeParser.parseSource(source, "mixed.shape", diagnostics);

        assertThat(file.getProjections()).extracting(ProjectionDeclaration::getName).containsExactly("Fine");
        assertThat(diagnostics.getErrors()).hasSize(1);
        assertThat(diagnostics.has(DiagnosticCode.PARSE_ERROR)).isTrue();
        assertThat(diagnostics.getErrors().get(0).getMessage())
                .startsWith("mixed.shape:1:")
                .contains("Expected an expression but found '}'");
    }

    @Test
    void testTokenizerErrorYieldsEmptyFile() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ShapeFile file = ShapeParser.parseSource("projection A from B b => { x: \"open }", "bad.shape", diagnostics);

        assertThat(file.getProjections()).isEmpty();
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void testDuplicateCaptureIsRejected() {
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        ShapeParser.parseSource("projection (String a, String a) from B b => { x: a };", "dup.shape", diagnostics);

        assertThat(diagnostics.getErrors()).singleElement()
                .satisfies(d -> assertThat(d.getMessage()).contains("Duplicate capture 'a'"));
    }

    @Test
    void testTrailingTokensInStandaloneExpression() {
        assertThatThrownBy(() -> ShapeParser.parseExpression("o.a o.b", "o", Set.of()))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Expected end of expression");
    }
}
