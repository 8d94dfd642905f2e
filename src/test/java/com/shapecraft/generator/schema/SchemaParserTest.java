package com.shapecraft.generator.schema;

import com.shapecraft.generator.ShapeFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaParser.
 */
class SchemaParserTest {

    @Test
    void testParseOrderSchema() {
        TypeSchema schema = ShapeFixtures.orderSchema();

        assertThat(schema.typeNames()).contains("com.acme.Order", "com.acme.Customer", "com.acme.Address");

        TypeInfo order = schema.describe("com.acme.Order").orElseThrow();
        assertThat(order.getMembers()).extracting(MemberInfo::getName)
                .containsExactly("id", "number", "note", "total", "customer", "shipping", "items", "tags");
        assertThat(order.isDefaultConstructible()).isTrue();

        MemberInfo id = order.member("id").orElseThrow();
        assertThat(id.getType().isPrimitive()).isTrue();
        assertThat(id.getNullability()).isEqualTo(Nullability.NON_NULL);

        assertThat(order.member("number").orElseThrow().getNullability()).isEqualTo(Nullability.NON_NULL);
        assertThat(order.member("note").orElseThrow().getNullability()).isEqualTo(Nullability.UNKNOWN);
        assertThat(order.member("customer").orElseThrow().getNullability()).isEqualTo(Nullability.NULLABLE);
    }

    @Test
    void testCollectionAndArrayMembers() {
        TypeInfo order = ShapeFixtures.orderSchema().describe("com.acme.Order").orElseThrow();

        TypeRef items = order.member("items").orElseThrow().getType();
        assertThat(items.isCollection()).isTrue();
        assertThat(items.getCollectionKind()).isEqualTo(CollectionKind.LIST);
        assertThat(items.getElementType().getName()).isEqualTo("com.acme.OrderItem");

        TypeRef tags = order.member("tags").orElseThrow().getType();
        assertThat(tags.isArray()).isTrue();
        assertThat(tags.getElementType().isString()).isTrue();
    }

    @Test
    void testAccessStyles() {
        SchemaDocument doc = new SchemaParser().parse(List.of(
                "type com.acme.Point access=field",
                "  x: int",
                "  y: int readonly",
                "type com.acme.Pair access=record",
                "  left: String!",
                "type com.acme.Holder constructible=false",
                "  value: String"));

        assertThat(doc.hasErrors()).isFalse();
        TypeSchema schema = doc.getSchema();

        MemberInfo x = schema.describe("com.acme.Point").orElseThrow().member("x").orElseThrow();
        assertThat(x.readExpression("p")).isEqualTo("p.x");
        assertThat(x.writeStatement("p", "1")).isEqualTo("p.x = 1;");
        assertThat(schema.describe("com.acme.Point").orElseThrow().member("y").orElseThrow().isWritable()).isFalse();

        TypeInfo pair = schema.describe("com.acme.Pair").orElseThrow();
        assertThat(pair.isDefaultConstructible()).isFalse();
        assertThat(pair.member("left").orElseThrow().readExpression("p")).isEqualTo("p.left()");
        assertThat(pair.member("left").orElseThrow().isWritable()).isFalse();

        TypeInfo holder = schema.describe("com.acme.Holder").orElseThrow();
        assertThat(holder.isDefaultConstructible()).isFalse();
        assertThat(holder.member("value").orElseThrow().writeStatement("h", "v")).isEqualTo("h.setValue(v);");
    }

    @Test
    void testSimpleNamesResolveAgainstDeclaredTypes() {
        SchemaDocument doc = new SchemaParser().parse(List.of(
                "type com.acme.Parent",
                "  child: Child?",
                "  children: Set<Child>",
                "end",
                "type com.acme.Child",
                "  born: LocalDate",
                "end"));

        assertThat(doc.hasErrors()).isFalse();
        TypeInfo parent = doc.getSchema().describe("com.acme.Parent").orElseThrow();
        assertThat(parent.member("child").orElseThrow().getType().getName()).isEqualTo("com.acme.Child");
        assertThat(parent.member("children").orElseThrow().getType().getCollectionKind())
                .isEqualTo(CollectionKind.SET);
        TypeInfo child = doc.getSchema().describe("com.acme.Child").orElseThrow();
        assertThat(child.member("born").orElseThrow().getType().getName()).isEqualTo("java.time.LocalDate");
    }

    @Test
    void testErrorsAreCollectedWithLineNumbers() {
        SchemaDocument doc = new SchemaParser().parse(List.of(
                "orphan: String",
                "type com.acme.A access=magic",
                "type com.acme.B",
                "  ok: String",
                "  not a member"));

        assertThat(doc.hasErrors()).isTrue();
        assertThat(doc.getErrors()).hasSize(3);
        assertThat(doc.getErrors().get(0)).startsWith("Line 1:").contains("Member outside of a type");
        assertThat(doc.getErrors().get(1)).startsWith("Line 2:").contains("Unknown access style");
        assertThat(doc.getErrors().get(2)).startsWith("Line 5:").contains("Invalid member format");
        assertThat(doc.getSchema().describe("com.acme.B").orElseThrow().getMembers()).hasSize(1);
    }

    @Test
    void testFingerprintTracksContent() {
        TypeSchema first = ShapeFixtures.schema("type a.A\n  x: String\n");
        TypeSchema same = ShapeFixtures.schema("# comment\ntype a.A\n  x: String\nend\n");
        TypeSchema changed = ShapeFixtures.schema("type a.A\n  x: String?\n");

        assertThat(first.fingerprint()).isEqualTo(same.fingerprint());
        assertThat(first.fingerprint()).isNotEqualTo(changed.fingerprint());
    }
}
