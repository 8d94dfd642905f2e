package com.shapecraft.generator.codegen.shape;

import com.shapecraft.generator.ShapeFixtures;
import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.variant.EmissionStrategy;
import com.shapecraft.generator.codegen.variant.VariantKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProjectionAnalyzer: variant selection, naming, emission
 * strategy and failure handling.
 */
class ProjectionAnalyzerTest {

    private static final GeneratorConfig PREBUILT = GeneratorConfig.builder().prebuiltTransforms(true).build();

    @Test
    void testExplicitProjection() {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection order_row from Order o => { o.id, o.number };");

        assertThat(site.isFailed()).isFalse();
        assertThat(site.getVariant().kind()).isEqualTo(VariantKind.EXPLICIT_DTO);
        assertThat(site.getMethodName()).isEqualTo("orderRow");
        assertThat(site.getRoot().getHintName()).isEqualTo("OrderRow");
        assertThat(site.getEmissionStrategy()).isEqualTo(EmissionStrategy.INLINE_CLOSURE);
        assertThat(site.isReverseSupported()).isTrue();
        assertThat(site.getRoot().getFields()).extracting(StructureField::getName).containsExactly("id", "number");
    }

    @Test
    void testAnonymousProjectionIsNamedByHash() {
        AnalyzedCallSite site = ShapeFixtures.analyze(PREBUILT, "projection from Order o => { o.id };");

        String hash = site.getRoot().getContentHash();
        assertThat(site.getVariant().kind()).isEqualTo(VariantKind.ANONYMOUS);
        assertThat(site.getMethodName()).isEqualTo("projectOrder_" + hash);
        assertThat(site.getRoot().getHintName()).isEqualTo("Order");
        assertThat(site.getEmissionStrategy()).isEqualTo(EmissionStrategy.INLINE_CLOSURE);
    }

    @Test
    void testNamedTargetProjection() {
        AnalyzedCallSite site = ShapeFixtures.analyze(PREBUILT,
                "projection from Order o => new Summary { id: o.id, label: o.note };");

        assertThat(site.getVariant().kind()).isEqualTo(VariantKind.NAMED_TYPE);
        assertThat(site.getRoot().getTargetType()).isEqualTo("com.acme.Summary");
        assertThat(site.getMethodName()).isEqualTo("toSummary_" + site.getRoot().getContentHash());
        assertThat(site.getEmissionStrategy()).isEqualTo(EmissionStrategy.PREBUILT_TRANSFORM);
        assertThat(site.isReverseSupported()).isFalse();
    }

    @Test
    void testGroupedProjectionNames() {
        AnalyzedCallSite site = ShapeFixtures.analyze(
                "projection from group<String, OrderItem> g => { sku: g.key, lines: g.count() };");

        assertThat(site.getVariant().kind()).isEqualTo(VariantKind.GROUPED);
        assertThat(site.getMethodName()).isEqualTo("projectOrderItemGroup_" + site.getRoot().getContentHash());
        assertThat(site.getRoot().getHintName()).isEqualTo("OrderItemGroup");
        assertThat(site.isReverseSupported()).isFalse();
    }

    @Test
    void testCapturesDisablePrebuiltTransform() {
        AnalyzedCallSite plain = ShapeFixtures.analyze(PREBUILT, "projection Row from Order o => { o.id };");
        AnalyzedCallSite captured = ShapeFixtures.analyze(PREBUILT,
                "projection Row (String prefix) from Order o => { label: prefix + o.number };");

        assertThat(plain.getEmissionStrategy()).isEqualTo(EmissionStrategy.PREBUILT_TRANSFORM);
        assertThat(captured.getEmissionStrategy()).isEqualTo(EmissionStrategy.INLINE_CLOSURE);
        assertThat(captured.getCaptureTypes()).containsOnlyKeys("prefix");
        assertThat(captured.getCaptureTypes().get("prefix").isString()).isTrue();
    }

    @Test
    void testRecordSourceHasNoReverse() {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection SnapshotView from Snapshot s => { s.value };");

        assertThat(site.isFailed()).isFalse();
        assertThat(site.isReverseSupported()).isFalse();
        assertThat(site.getDiagnostics().has(DiagnosticCode.REVERSE_UNAVAILABLE)).isTrue();
        assertThat(site.getDiagnostics().hasErrors()).isFalse();
    }

    @Test
    void testUnknownSourceTypeFails() {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection Lost from Invoice i => { i.id };");

        assertThat(site.isFailed()).isTrue();
        assertThat(site.getRoot()).isNull();
        assertThat(site.getStructures()).isEmpty();
        assertThat(site.getDiagnostics().has(DiagnosticCode.UNRESOLVED_TYPE)).isTrue();
        assertThat(site.getDiagnostics().getErrors().get(0).getLocation()).isEqualTo("orders.shape:3:1");
    }

    @Test
    void testBodyMustBeShape() {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection Bare from Order o => o.number;");

        assertThat(site.isFailed()).isTrue();
        assertThat(site.getDiagnostics().has(DiagnosticCode.UNSUPPORTED_EXPRESSION_SHAPE)).isTrue();
    }

    @Test
    void testEmptyShapeFails() {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection Nothing from Order o => { };");

        assertThat(site.isFailed()).isTrue();
        assertThat(site.getDiagnostics().has(DiagnosticCode.EMPTY_STRUCTURE)).isTrue();
    }

    @Test
    void testShapeWithOnlyUnresolvedFieldsFails() {
        AnalyzedCallSite site = ShapeFixtures.analyze(
                "projection Bad from Order o => { a: o.nope, b: o.missing.deeper };");

        assertThat(site.isFailed()).isTrue();
        assertThat(site.getRoot()).isNull();
        assertThat(site.getDiagnostics().has(DiagnosticCode.EMPTY_STRUCTURE)).isTrue();
        assertThat(site.getDiagnostics().has(DiagnosticCode.UNRESOLVED_TYPE)).isTrue();
    }

    @Test
    void testDuplicateAndUnnamedEntriesAreSkipped() {
        AnalyzedCallSite site = ShapeFixtures.analyze(
                "projection Dups from Order o => { id: o.id, id: o.total, o.id + 1, o.number };");

        assertThat(site.isFailed()).isFalse();
        assertThat(site.getRoot().getFields()).extracting(StructureField::getName).containsExactly("id", "number");
        assertThat(site.getDiagnostics().has(DiagnosticCode.DUPLICATE_FIELD)).isTrue();
        assertThat(site.getDiagnostics().has(DiagnosticCode.MISSING_FIELD_NAME)).isTrue();
    }

    @Test
    void testAnalysisIsRepeatable() {
        String projection = """
            projection Repeat from Order o => {
                o.id,
                lines: o.items.map(i => { i.sku, i.quantity }).toList()
            };
            """;

        AnalyzedCallSite first = ShapeFixtures.analyze(projection);
        AnalyzedCallSite second = ShapeFixtures.analyze(projection);

        assertThat(first.getRoot().getContentHash()).isEqualTo(second.getRoot().getContentHash());
        assertThat(first.getRoot().getSignature()).isEqualTo(second.getRoot().getSignature());
        assertThat(first.getStructures()).hasSameSizeAs(second.getStructures());
    }
}
