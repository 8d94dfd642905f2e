package com.shapecraft.generator.codegen.generator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.StructuralSignatureCalculator;
import com.shapecraft.generator.codegen.dedup.StructureRegistry;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.util.ImportManager;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.schema.TypeSchema;

import lombok.Getter;

/**
 * State shared by everything emitted into one projections class: imports,
 * member names already taken and private helpers requested so far.
 */
@Getter
public class EmissionContext {
    private final String packageName;
    private final String className;
    private final GeneratorConfig config;
    private final TypeSchema schema;
    private final StructureRegistry registry;
    private final StructuralSignatureCalculator calculator;
    private final ImportManager imports;
    private final TypeRenderer types;
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    private final List<String> publicMembers = new ArrayList<>();
    private final Map<String, String> helpers = new LinkedHashMap<>();
    private final Set<String> memberNames = new HashSet<>();

    public EmissionContext(String packageName, String className, GeneratorConfig config, TypeSchema schema,
                           StructureRegistry registry) {
        this.packageName = packageName;
        this.className = className;
        this.config = config;
        this.schema = schema;
        this.registry = registry;
        this.calculator = new StructuralSignatureCalculator(config.getHashLength());
        this.imports = new ImportManager(packageName);
        this.imports.reserve(className);
        this.types = new TypeRenderer(imports, registry);
    }

    /**
     * {@code base}, or {@code base} with a numeric suffix when a member of that name exists.
     */
    public String claimMemberName(String base) {
        String name = NamingUtil.disambiguate(base, memberNames);
        memberNames.add(name);
        return name;
    }

    public boolean hasHelper(String name) {
        return helpers.containsKey(name);
    }

    public void addHelper(String name, String source) {
        helpers.putIfAbsent(name, source);
        memberNames.add(name);
    }

    public void addPublicMember(String source) {
        publicMembers.add(source);
    }

    public String reference(String qualifiedName) {
        return imports.reference(qualifiedName);
    }
}
