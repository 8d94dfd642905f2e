package com.shapecraft.generator.codegen.generator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.dedup.StructureRegistry;
import com.shapecraft.generator.codegen.forward.ForwardCodeGenerator;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;
import com.shapecraft.generator.codegen.model.output.GeneratedFileType;
import com.shapecraft.generator.codegen.reverse.ReverseCodeGenerator;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.util.FileWriteUtil;
import com.shapecraft.generator.codegen.util.TemplateRenderer;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Generates the {@code <ShapeFile>Projections} class holding the transforms of
 * every call site declared in one shape file.
 */
public class ProjectionsClassGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProjectionsClassGenerator.class);

    private final GeneratorConfig config;
    private final TypeSchema schema;
    private final StructureRegistry registry;
    private final TemplateRenderer templates;

    public ProjectionsClassGenerator(GeneratorConfig config, TypeSchema schema, StructureRegistry registry,
                                     TemplateRenderer templates) {
        this.config = config;
        this.schema = schema;
        this.registry = registry;
        this.templates = templates;
    }

    /**
     * @param sites       registered call sites of the file, in declaration order
     * @param diagnostics receives what the generators report while emitting
     */
    public GeneratedFile generate(String packageName, String className, String sourceFile,
                                  List<AnalyzedCallSite> sites, ToolDiagnostics diagnostics) {
        log.info("Generating projections class: {}.{} ({} call site(s))", packageName, className, sites.size());
        EmissionContext ctx = new EmissionContext(packageName, className, config, schema, registry);
        ForwardCodeGenerator forward = new ForwardCodeGenerator(ctx);
        ReverseCodeGenerator reverse = new ReverseCodeGenerator(ctx);

        for (AnalyzedCallSite site : sites) {
            String method = forward.generate(site);
            if (site.isReverseSupported()) {
                reverse.generate(site, method);
            }
        }
        diagnostics.addAll(ctx.getDiagnostics());

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("packageName", packageName);
        model.put("className", className);
        model.put("sourceFile", sourceFile);
        model.put("members", ctx.getPublicMembers());
        model.put("helpers", new ArrayList<>(ctx.getHelpers().values()));
        model.put("imports", new ArrayList<>(ctx.getImports().getImports()));

        String qualifiedName = packageName.isEmpty() ? className : packageName + "." + className;
        return GeneratedFile.builder()
                .path(FileWriteUtil.sourcePath(packageName, className))
                .contents(templates.render("projections.ftl", model))
                .type(GeneratedFileType.PROJECTIONS)
                .typeName(qualifiedName)
                .build();
    }
}
