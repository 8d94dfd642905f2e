package com.shapecraft.generator.codegen;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.cache.CompilationCache;
import com.shapecraft.generator.codegen.dedup.GeneratedType;
import com.shapecraft.generator.codegen.dedup.StructureRegistry;
import com.shapecraft.generator.codegen.dto.DtoClassGenerator;
import com.shapecraft.generator.codegen.exception.IdentityCollisionException;
import com.shapecraft.generator.codegen.generator.ProjectionsClassGenerator;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.CallSiteKey;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.shape.ProjectionAnalyzer;
import com.shapecraft.generator.codegen.util.TemplateRenderer;
import com.shapecraft.generator.model.ShapeFile;
import com.shapecraft.generator.schema.TypeSchema;

/**
 * Compiles parsed shape files into generated sources without touching the
 * file system.
 *
 * Call sites are analysed independently, in parallel when configured, then
 * registered one by one in declaration order, so the output does not depend
 * on scheduling.
 */
public class ProjectionCompiler {
    private static final Logger log = LoggerFactory.getLogger(ProjectionCompiler.class);

    private final GeneratorConfig config;
    private final TypeSchema schema;
    private final CompilationCache cache;
    private final TemplateRenderer templates = new TemplateRenderer();

    public ProjectionCompiler(GeneratorConfig config, TypeSchema schema) {
        this(config, schema, null);
    }

    /**
     * @param cache memo table reused across compilations, or null to analyse everything
     */
    public ProjectionCompiler(GeneratorConfig config, TypeSchema schema, CompilationCache cache) {
        this.config = config;
        this.schema = schema;
        this.cache = cache;
    }

    /**
     * @throws IdentityCollisionException when two different structures share a content hash
     */
    public CompilationOutput compile(List<ShapeFile> shapeFiles) {
        CallSiteFactory factory = new CallSiteFactory(config.getDefaultPackage());
        Map<ShapeFile, List<CallSite>> sitesByFile = new LinkedHashMap<>();
        List<CallSite> allSites = new ArrayList<>();
        for (ShapeFile file : shapeFiles) {
            List<CallSite> sites = factory.callSites(file);
            sitesByFile.put(file, sites);
            allSites.addAll(sites);
        }
        log.info("Analysing {} call site(s) from {} shape file(s)", allSites.size(), shapeFiles.size());

        List<AnalyzedCallSite> analyzed = analyzeAll(allSites);

        ToolDiagnostics diagnostics = new ToolDiagnostics();
        StructureRegistry registry = new StructureRegistry(config);
        Map<CallSite, AnalyzedCallSite> accepted = new LinkedHashMap<>();
        int failed = 0;
        int structures = 0;
        for (AnalyzedCallSite site : analyzed) {
            diagnostics.addAll(site.getDiagnostics());
            if (registry.register(site)) {
                accepted.put(site.getCallSite(), site);
                structures += site.getStructures().size();
            } else {
                failed++;
            }
        }
        registry.seal();
        diagnostics.addAll(registry.getDiagnostics());

        CompilationOutput.CompilationOutputBuilder output = CompilationOutput.builder();
        DtoClassGenerator dtoGenerator = new DtoClassGenerator(config, registry, templates);
        for (GeneratedType type : registry.generatedTypes()) {
            output.file(dtoGenerator.generate(type));
        }

        ProjectionsClassGenerator projectionsGenerator =
                new ProjectionsClassGenerator(config, schema, registry, templates);
        for (Map.Entry<ShapeFile, List<CallSite>> entry : sitesByFile.entrySet()) {
            List<AnalyzedCallSite> fileSites = entry.getValue().stream()
                    .filter(accepted::containsKey)
                    .map(accepted::get)
                    .collect(Collectors.toList());
            if (fileSites.isEmpty()) {
                log.warn("No projection of {} could be generated", entry.getKey().getSourceFile());
                continue;
            }
            CallSite first = fileSites.get(0).getCallSite();
            output.file(projectionsGenerator.generate(first.getPackageName(), first.getProjectionsClassName(),
                    entry.getKey().getSourceFile(), fileSites, diagnostics));
        }

        return output
                .diagnostics(diagnostics)
                .callSites(allSites.size())
                .failedCallSites(failed)
                .structures(structures)
                .build();
    }

    private List<AnalyzedCallSite> analyzeAll(List<CallSite> sites) {
        ProjectionAnalyzer analyzer = new ProjectionAnalyzer(schema, config);
        Stream<CallSite> stream = config.isParallel() ? sites.parallelStream() : sites.stream();
        if (cache == null) {
            return stream.map(analyzer::analyze).collect(Collectors.toList());
        }

        String schemaFingerprint = schema.fingerprint();
        String configFingerprint = config.analysisFingerprint();
        Map<CallSite, CallSiteKey> keys = new IdentityHashMap<>();
        sites.forEach(site -> keys.put(site, site.key(schemaFingerprint, configFingerprint)));
        List<AnalyzedCallSite> analyzed = stream
                .map(site -> cache.computeIfAbsent(keys.get(site), site, analyzer::analyze))
                .collect(Collectors.toList());
        int evicted = cache.retainOnly(keys.values());
        log.debug("Compilation cache: {} hit(s), {} miss(es), {} evicted, {} entr(ies)", cache.getHits(),
                cache.getMisses(), evicted, cache.size());
        return analyzed;
    }
}
