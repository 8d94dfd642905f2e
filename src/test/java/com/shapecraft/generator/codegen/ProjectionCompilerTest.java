package com.shapecraft.generator.codegen;

import com.shapecraft.generator.ShapeFixtures;
import com.shapecraft.generator.codegen.cache.CompilationCache;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;
import com.shapecraft.generator.codegen.model.output.GeneratedFileType;
import com.shapecraft.generator.model.ShapeFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProjectionCompiler.
 */
class ProjectionCompilerTest {

    private static final String ORDERS = """
        projection OrderRow from Order o => {
            o.id,
            customerName: o.customer?.name,
            city: o.customer?.address?.city
        };
        projection from Order o => { o.number, o.total };
        projection Labeled (String prefix) from Order o => { label: prefix + o.number };
        """;

    @Test
    void testGeneratesDtosAndProjectionsClass() {
        CompilationOutput output = compile(GeneratorConfig.defaults(), ShapeFixtures.orderShapes(ORDERS));

        assertThat(output.getDiagnostics().hasErrors()).isFalse();
        assertThat(output.getCallSites()).isEqualTo(3);
        assertThat(output.getFailedCallSites()).isZero();
        assertThat(output.count(GeneratedFileType.DTO)).isEqualTo(3);
        assertThat(output.count(GeneratedFileType.PROJECTIONS)).isEqualTo(1);

        Map<String, String> files = byTypeName(output);
        assertThat(files).containsKeys("com.acme.views.OrderRow", "com.acme.views.Labeled",
                "com.acme.views.OrdersProjections");

        String dto = files.get("com.acme.views.OrderRow");
        assertThat(dto)
                .startsWith("package com.acme.views;")
                .contains("public class OrderRow {")
                .contains("private long id;")
                .contains("private String customerName;")
                .contains("public OrderRow(long id, String customerName, String city)")
                .contains("/** From {@code Order.customer?.name}. */");

        String projections = files.get("com.acme.views.OrdersProjections");
        assertThat(projections)
                .contains("public final class OrdersProjections {")
                .contains("import com.acme.Order;")
                .contains("public static Function<Order, OrderRow> orderRow() {")
                .contains("public static List<OrderRow> orderRowAll(Collection<? extends Order> source)")
                .contains("o.getCustomer() != null ? o.getCustomer().getName() : null")
                .contains("public static Order orderRowReverse(OrderRow dto)")
                .contains("public static Function<Order, Labeled> labeled(String prefix) {");
    }

    @Test
    void testGeneratedFilePaths() {
        CompilationOutput output = compile(GeneratorConfig.defaults(), ShapeFixtures.orderShapes(ORDERS));

        assertThat(output.getFiles()).extracting(GeneratedFile::getPath)
                .contains(Path.of("com/acme/views/OrderRow.java"), Path.of("com/acme/views/OrdersProjections.java"));
    }

    @Test
    void testPrebuiltTransformIsSharedConstant() {
        GeneratorConfig config = GeneratorConfig.builder().prebuiltTransforms(true).build();
        CompilationOutput output = compile(config, ShapeFixtures.orderShapes(ORDERS));

        String projections = byTypeName(output).get("com.acme.views.OrdersProjections");
        assertThat(projections)
                .contains("private static final Function<Order, OrderRow> ORDER_ROW_TRANSFORM =")
                .contains("return ORDER_ROW_TRANSFORM;")
                .contains("public static Function<Order, Labeled> labeled(String prefix) {");
    }

    @Test
    void testRecordStyleDtos() {
        GeneratorConfig config = GeneratorConfig.builder().dtoStyle(DtoStyle.RECORD).build();
        CompilationOutput output = compile(config, ShapeFixtures.orderShapes(ORDERS));

        Map<String, String> files = byTypeName(output);
        assertThat(files.get("com.acme.views.OrderRow")).contains("public record OrderRow(");
        assertThat(files.get("com.acme.views.OrdersProjections")).contains("dto.customerName()");
    }

    @Test
    void testOutputIsDeterministic() {
        ShapeFile file = ShapeFixtures.orderShapes(ORDERS);

        CompilationOutput first = compile(GeneratorConfig.defaults(), file);
        CompilationOutput second = compile(GeneratorConfig.defaults(), file);
        CompilationOutput parallel = compile(GeneratorConfig.builder().parallel(true).build(), file);

        assertThat(second.getFiles()).isEqualTo(first.getFiles());
        assertThat(parallel.getFiles()).isEqualTo(first.getFiles());
    }

    @Test
    void testSharedShapeAcrossFilesIsGeneratedOnce() {
        ShapeFile views = ShapeFixtures.shapeFile("views.shape", """
            package com.acme.views;
            import com.acme.*;
            projection from Order o => { o.id, o.number };
            """);
        ShapeFile reports = ShapeFixtures.shapeFile("reports.shape", """
            package com.acme.reports;
            import com.acme.*;
            projection from Order o => { o.id, o.number };
            """);

        CompilationOutput output = compile(GeneratorConfig.defaults(), views, reports);

        assertThat(output.count(GeneratedFileType.DTO)).isEqualTo(1);
        assertThat(output.count(GeneratedFileType.PROJECTIONS)).isEqualTo(2);
        assertThat(output.getStructures()).isEqualTo(2);
        String reportsClass = byTypeName(output).get("com.acme.reports.ReportsProjections");
        assertThat(reportsClass).contains("import com.acme.views.OrderDto_");
    }

    @Test
    void testGroupedProjectionReadsKeyAndElements() {
        CompilationOutput output = compile(GeneratorConfig.defaults(), ShapeFixtures.orderShapes("""
            projection SkuTotals from group<{ sku: String, city: String }, OrderItem> g => {
                sku: g.key.sku,
                lines: g.count(),
                amount: g.sum(i => i.price * i.quantity)
            };
            """));

        assertThat(output.getDiagnostics().hasErrors()).isFalse();
        String projections = byTypeName(output).get("com.acme.views.OrdersProjections");
        assertThat(projections)
                .contains("private static String groupKey_")
                .contains(".getValue().size()")
                .contains(".getValue().stream()")
                .doesNotContain("@SuppressWarnings")
                .doesNotContain("skuTotalsReverse");
    }

    @Test
    void testFailedSiteIsReportedAndSkipped() {
        CompilationOutput output = compile(GeneratorConfig.defaults(), ShapeFixtures.orderShapes("""
            projection Good from Order o => { o.id };
            projection Bad from Order o => { };
            """));

        assertThat(output.getFailedCallSites()).isEqualTo(1);
        assertThat(output.getDiagnostics().has(DiagnosticCode.EMPTY_STRUCTURE)).isTrue();
        assertThat(byTypeName(output).get("com.acme.views.OrdersProjections"))
                .contains("good()")
                .doesNotContain("bad()");
    }

    @Test
    void testFileWithOnlyFailedSitesGetsNoProjectionsClass() {
        CompilationOutput output = compile(GeneratorConfig.defaults(),
                ShapeFixtures.orderShapes("projection Bad from Invoice i => { i.id };"));

        assertThat(output.getFiles()).isEmpty();
        assertThat(output.getDiagnostics().hasErrors()).isTrue();
    }

    @Test
    void testUnresolvableShapeEmitsNothing() {
        CompilationOutput output = compile(GeneratorConfig.defaults(), ShapeFixtures.orderShapes("""
            projection Bad from Order o => { a: o.nope, b: o.missing.deeper };
            """));

        assertThat(output.getFailedCallSites()).isEqualTo(1);
        assertThat(output.getFiles()).isEmpty();
        assertThat(output.getDiagnostics().has(DiagnosticCode.EMPTY_STRUCTURE)).isTrue();
    }

    @Test
    void testCacheServesUnchangedSites() {
        CompilationCache cache = new CompilationCache();
        ProjectionCompiler compiler = new ProjectionCompiler(GeneratorConfig.defaults(), ShapeFixtures.orderSchema(),
                cache);

        CompilationOutput first = compiler.compile(List.of(ShapeFixtures.orderShapes(ORDERS)));
        assertThat(cache.getMisses()).isEqualTo(3);
        assertThat(cache.getHits()).isZero();

        CompilationOutput second = compiler.compile(List.of(ShapeFixtures.orderShapes(ORDERS)));
        assertThat(cache.getHits()).isEqualTo(3);
        assertThat(cache.size()).isEqualTo(3);
        assertThat(second.getFiles()).isEqualTo(first.getFiles());

        compiler.compile(List.of(ShapeFixtures.orderShapes(ORDERS.replace("o.total", "o.note"))));
        assertThat(cache.getMisses()).isEqualTo(4);
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void testCacheIsKeyedByGeneratorSettings() {
        CompilationCache cache = new CompilationCache();
        GeneratorConfig shortHashes = GeneratorConfig.defaults();
        GeneratorConfig longHashes = GeneratorConfig.builder().hashLength(16).build();
        ShapeFile file = ShapeFixtures.orderShapes(ORDERS);

        CompilationOutput first = new ProjectionCompiler(shortHashes, ShapeFixtures.orderSchema(), cache)
                .compile(List.of(file));
        CompilationOutput second = new ProjectionCompiler(longHashes, ShapeFixtures.orderSchema(), cache)
                .compile(List.of(file));

        assertThat(cache.getHits()).isZero();
        assertThat(cache.getMisses()).isEqualTo(6);
        assertThat(second.getFiles()).isEqualTo(compile(longHashes, file).getFiles());
        assertThat(second.getFiles()).isNotEqualTo(first.getFiles());
        assertThat(second.getFiles()).extracting(GeneratedFile::getTypeName)
                .anyMatch(name -> name.matches(".*Dto_[0-9A-F]{16}"));
    }

    @Test
    void testCacheDropsSitesNoLongerCompiled() {
        CompilationCache cache = new CompilationCache();
        ProjectionCompiler compiler = new ProjectionCompiler(GeneratorConfig.defaults(), ShapeFixtures.orderSchema(),
                cache);

        for (int i = 0; i < 5; i++) {
            compiler.compile(List.of(ShapeFixtures.orderShapes(ORDERS.replace("o.total", "t" + i + ": o.total"))));
        }
        assertThat(cache.size()).isEqualTo(3);

        compiler.compile(List.of(ShapeFixtures.orderShapes("projection Only from Order o => { o.id };")));
        assertThat(cache.size()).isEqualTo(1);
    }

    private static CompilationOutput compile(GeneratorConfig config, ShapeFile... files) {
        return new ProjectionCompiler(config, ShapeFixtures.orderSchema()).compile(List.of(files));
    }

    private static Map<String, String> byTypeName(CompilationOutput output) {
        return output.getFiles().stream()
                .collect(Collectors.toMap(GeneratedFile::getTypeName, GeneratedFile::getContents));
    }
}
