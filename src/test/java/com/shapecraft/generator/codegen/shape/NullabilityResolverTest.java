package com.shapecraft.generator.codegen.shape;

import com.shapecraft.generator.ShapeFixtures;
import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.model.FieldShape;
import com.shapecraft.generator.codegen.model.NullabilityRule;
import com.shapecraft.generator.codegen.model.StructureField;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the nullability decision of structure fields.
 */
class NullabilityResolverTest {

    @Test
    void testPrimitiveMemberIsNonNull() {
        StructureField id = field("{ id: o.id }", "id");

        assertThat(id.isNullable()).isFalse();
        assertThat(id.getResolvedType().isPrimitive()).isTrue();
        assertThat(id.getNullabilityRule()).isEqualTo(NullabilityRule.DECLARED_MEMBER);
    }

    @Test
    void testNullableIntermediateMakesFieldNullable() {
        // customer is nullable, name is declared non-null
        StructureField name = field("{ name: o.customer.name }", "name");

        assertThat(name.isNullable()).isTrue();
        assertThat(name.getNullabilityRule()).isEqualTo(NullabilityRule.DECLARED_MEMBER);
    }

    @Test
    void testNullSafeOverridesNonNullDeclaration() {
        StructureField number = field("{ number: o?.number }", "number");

        assertThat(number.isNullable()).isTrue();
        assertThat(number.getNullabilityRule()).isEqualTo(NullabilityRule.NULL_SAFE_ACCESS);
    }

    @Test
    void testNonNullMemberWithoutNullSafe() {
        StructureField number = field("{ number: o.number }", "number");

        assertThat(number.isNullable()).isFalse();
        assertThat(number.getNullabilityRule()).isEqualTo(NullabilityRule.DECLARED_MEMBER);
    }

    @Test
    void testMaterializedCollectionIsNonNull() {
        StructureField codes = field("{ codes: o.items.map(i => i.sku).toList() }", "codes");

        assertThat(codes.isNullable()).isFalse();
        assertThat(codes.getNullabilityRule()).isEqualTo(NullabilityRule.MATERIALIZED_COLLECTION);
        assertThat(codes.getResolvedType().isCollection()).isTrue();
        assertThat(codes.getResolvedType().getElementType().isString()).isTrue();
    }

    @Test
    void testUnannotatedMultiHopChainFallsBackToNullable() {
        StructureField street = field("{ street: o.shipping.street }", "street");

        assertThat(street.isNullable()).isTrue();
        assertThat(street.getNullabilityRule()).isEqualTo(NullabilityRule.MULTI_HOP_FALLBACK);
        assertThat(street.isDefensiveGuards()).isTrue();
    }

    @Test
    void testUnannotatedSingleHopIsNotGuessed() {
        StructureField note = field("{ note: o.note }", "note");

        assertThat(note.isNullable()).isFalse();
        assertThat(note.getNullabilityRule()).isEqualTo(NullabilityRule.EXPRESSION);
    }

    @Test
    void testCoalesceTakesFallbackNullability() {
        StructureField label = field("{ label: o.customer?.email ?? \"none\" }", "label");

        assertThat(label.isNullable()).isFalse();
        assertThat(label.getNullabilityRule()).isEqualTo(NullabilityRule.COALESCE_FALLBACK);
    }

    @Test
    void testNullSafeNestedCollectionCollapsesToEmpty() {
        StructureField history = field("{ history: o.customer?.previous.map(p => { p.sku }) }", "history");

        assertThat(history.getShape()).isEqualTo(FieldShape.NESTED_COLLECTION);
        assertThat(history.isNullable()).isFalse();
        assertThat(history.getNullabilityRule()).isEqualTo(NullabilityRule.COLLECTION_COLLAPSE);
        assertThat(history.isEmptyCollectionFallback()).isTrue();

        StructureField sku = history.getNestedStructure().field("sku").orElseThrow();
        assertThat(sku.isNullable()).isFalse();
    }

    @Test
    void testCollapseCanBeDisabled() {
        GeneratorConfig config = GeneratorConfig.builder().arrayNullabilityRemoval(false).build();
        AnalyzedCallSite site = ShapeFixtures.analyze(config,
                "projection History from Order o => { history: o.customer?.previous.map(p => { p.sku }) };");

        StructureField history = site.getRoot().field("history").orElseThrow();
        assertThat(history.isNullable()).isTrue();
        assertThat(history.getNullabilityRule()).isEqualTo(NullabilityRule.NULL_SAFE_ACCESS);
    }

    @Test
    void testNamedTargetMemberDecidesComputedField() {
        AnalyzedCallSite site = ShapeFixtures.analyze(
                "projection from Order o => new Summary { id: o.id, label: o.number + \"!\" };");

        StructureField label = site.getRoot().field("label").orElseThrow();
        assertThat(label.isNullable()).isTrue();
        assertThat(label.getNullabilityRule()).isEqualTo(NullabilityRule.TARGET_MEMBER);
        assertThat(label.isFromNamedSubtype()).isTrue();
    }

    @Test
    void testNullableFieldsAreBoxed() {
        StructureField total = field("{ total: o.note != null ? o.total : null }", "total");

        assertThat(total.isNullable()).isTrue();
        assertThat(total.getNullabilityRule()).isEqualTo(NullabilityRule.EXPRESSION);
        assertThat(total.getResolvedType().isPrimitive()).isFalse();
        assertThat(total.getResolvedType().getName()).isEqualTo("java.lang.Double");
    }

    @Test
    void testDeclaredGroupKeyMemberTypeDecides() {
        AnalyzedCallSite site = ShapeFixtures.analyze("""
            projection Yearly from group<{ region: String, year: int }, Order> g => {
                y: g.key.year,
                r: g.key.region
            };
            """);
        assertThat(site.isFailed()).as("analysis failed: %s", site.getDiagnostics().getEntries()).isFalse();

        StructureField year = site.getRoot().field("y").orElseThrow();
        assertThat(year.isNullable()).isFalse();
        assertThat(year.getNullabilityRule()).isEqualTo(NullabilityRule.DECLARED_MEMBER);
        assertThat(year.getResolvedType().getName()).isEqualTo("int");

        StructureField region = site.getRoot().field("r").orElseThrow();
        assertThat(region.isNullable()).isTrue();
        assertThat(region.getNullabilityRule()).isEqualTo(NullabilityRule.MULTI_HOP_FALLBACK);
    }

    private StructureField field(String shape, String name) {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection Row from Order o => " + shape + ";");
        assertThat(site.isFailed()).as("analysis failed: %s", site.getDiagnostics().getEntries()).isFalse();
        return site.getRoot().field(name).orElseThrow();
    }
}
