package com.shapecraft.generator.codegen.dedup;

import com.shapecraft.generator.ShapeFixtures;
import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.exception.IdentityCollisionException;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.shape.ProjectionAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StructureRegistry.
 */
class StructureRegistryTest {

    @Test
    void testAnonymousSitesWithSameShapeShareOneType() {
        List<AnalyzedCallSite> sites = analyzeAll(GeneratorConfig.defaults(), """
            projection from Order o => { o.id, o.number };
            projection from Order x => { id: x.id, number: x.number };
            """);
        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());
        sites.forEach(registry::register);
        registry.seal();

        String hash = sites.get(0).getRoot().getContentHash();
        assertThat(sites.get(1).getRoot().getContentHash()).isEqualTo(hash);
        assertThat(registry.generatedTypes()).hasSize(1);

        GeneratedType type = registry.typeFor(hash);
        assertThat(type.getPackageName()).isEqualTo("com.acme.views");
        assertThat(type.getSimpleName()).isEqualTo("OrderDto_" + hash);
        assertThat(type.isExplicit()).isFalse();
    }

    @Test
    void testNestedShapesAreSharedAcrossExplicitProjections() {
        List<AnalyzedCallSite> sites = analyzeAll(GeneratorConfig.defaults(), """
            projection Home from Order o => { o.id, place: { city: o.customer?.address?.city } };
            projection Ship from Order o => { o.number, place: { city: o.shipping?.city } };
            """);
        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());
        sites.forEach(registry::register);
        registry.seal();

        assertThat(registry.generatedTypes()).extracting(GeneratedType::getSimpleName)
                .hasSize(3)
                .contains("Home", "Ship");
        Structure place = sites.get(0).getRoot().field("place").orElseThrow().getNestedStructure();
        assertThat(registry.typeFor(place.getContentHash()).getSimpleName())
                .isEqualTo("PlaceDto_" + place.getContentHash());
    }

    @Test
    void testExplicitNamesWithSameShapeCollapse() {
        List<AnalyzedCallSite> sites = analyzeAll(GeneratorConfig.defaults(), """
            projection Zeta from Order o => { o.id };
            projection Alpha from Order o => { o.id };
            """);
        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());
        sites.forEach(site -> assertThat(registry.register(site)).isTrue());
        registry.seal();

        GeneratedType type = registry.typeFor(sites.get(0).getRoot().getContentHash());
        assertThat(type.getSimpleName()).isEqualTo("Alpha");
        assertThat(type.isExplicit()).isTrue();
        assertThat(type.getAliases()).containsExactly("Zeta");
        assertThat(registry.getDiagnostics().getWarnings()).singleElement()
                .satisfies(d -> assertThat(d.getCode()).isEqualTo(DiagnosticCode.NAME_CONFLICT));
    }

    @Test
    void testSameNameWithDifferentShapeIsRejected() {
        List<AnalyzedCallSite> sites = analyzeAll(GeneratorConfig.defaults(), """
            projection Row from Order o => { o.id };
            projection Row from Order o => { o.number };
            """);
        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());

        assertThat(registry.register(sites.get(0))).isTrue();
        assertThat(registry.register(sites.get(1))).isFalse();
        assertThat(registry.getDiagnostics().getErrors()).singleElement()
                .satisfies(d -> {
                    assertThat(d.getCode()).isEqualTo(DiagnosticCode.NAME_CONFLICT);
                    assertThat(d.getMessage()).contains("com.acme.views.Row");
                });

        registry.seal();
        assertThat(registry.generatedTypes()).extracting(GeneratedType::getSimpleName).containsExactly("Row");
    }

    @Test
    void testHashCollisionIsFatal() {
        AnalyzedCallSite real = ShapeFixtures.analyze("projection Row from Order o => { o.id };");
        Structure forged = real.getRoot().toBuilder().signature("forged|false|long\n").build();
        AnalyzedCallSite clash = AnalyzedCallSite.builder()
                .callSite(real.getCallSite())
                .variant(real.getVariant())
                .root(forged)
                .structure(forged)
                .diagnostics(new ToolDiagnostics())
                .build();

        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());
        registry.register(real);

        assertThatThrownBy(() -> registry.register(clash))
                .isInstanceOf(IdentityCollisionException.class)
                .hasMessageContaining(real.getRoot().getContentHash())
                .hasMessageContaining("forged");
    }

    @Test
    void testHashPackageLayout() {
        GeneratorConfig config = GeneratorConfig.builder().nestedDtoHashPackage(true).build();
        List<AnalyzedCallSite> sites = analyzeAll(config, "projection from Order o => { o.id };");
        StructureRegistry registry = new StructureRegistry(config);
        registry.register(sites.get(0));
        registry.seal();

        String hash = sites.get(0).getRoot().getContentHash();
        GeneratedType type = registry.typeFor(hash);
        assertThat(type.getPackageName()).isEqualTo("com.acme.views.shape_" + hash.toLowerCase(Locale.ROOT));
        assertThat(type.getSimpleName()).isEqualTo("OrderDto");
    }

    @Test
    void testFailedSitesAreNotRegistered() {
        List<AnalyzedCallSite> sites = analyzeAll(GeneratorConfig.defaults(), "projection Bad from Nowhere n => { n.x };");
        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());

        assertThat(registry.register(sites.get(0))).isFalse();
        registry.seal();
        assertThat(registry.generatedTypes()).isEmpty();
    }

    @Test
    void testSealedStateIsEnforced() {
        AnalyzedCallSite site = ShapeFixtures.analyze("projection Row from Order o => { o.id };");
        StructureRegistry registry = new StructureRegistry(GeneratorConfig.defaults());

        assertThatThrownBy(() -> registry.typeFor("ABCD"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not sealed");

        registry.seal();
        assertThatThrownBy(() -> registry.register(site))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sealed");
        assertThat(registry.findType("ABCD")).isEmpty();
    }

    private static List<AnalyzedCallSite> analyzeAll(GeneratorConfig config, String projections) {
        List<CallSite> callSites = ShapeFixtures.callSites(ShapeFixtures.orderShapes(projections));
        ProjectionAnalyzer analyzer = new ProjectionAnalyzer(ShapeFixtures.orderSchema(), config);
        return callSites.stream().map(analyzer::analyze).collect(Collectors.toList());
    }
}
