package com.shapecraft.generator.codegen.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.DtoStyle;
import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.dedup.GeneratedType;
import com.shapecraft.generator.codegen.dedup.StructureRegistry;
import com.shapecraft.generator.codegen.generator.TypeRenderer;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.codegen.model.output.GeneratedFile;
import com.shapecraft.generator.codegen.model.output.GeneratedFileType;
import com.shapecraft.generator.codegen.util.FileWriteUtil;
import com.shapecraft.generator.codegen.util.ImportManager;
import com.shapecraft.generator.codegen.util.TemplateRenderer;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Generates the source of a DTO type from its interned structure.
 */
public class DtoClassGenerator {
    private static final Logger log = LoggerFactory.getLogger(DtoClassGenerator.class);

    private final GeneratorConfig config;
    private final StructureRegistry registry;
    private final TemplateRenderer templates;

    public DtoClassGenerator(GeneratorConfig config, StructureRegistry registry, TemplateRenderer templates) {
        this.config = config;
        this.registry = registry;
        this.templates = templates;
    }

    public GeneratedFile generate(GeneratedType type) {
        log.info("Generating DTO: {}", type.qualifiedName());
        Structure structure = type.getStructure();
        ImportManager imports = new ImportManager(type.getPackageName());
        imports.reserve(type.getSimpleName());
        TypeRenderer types = new TypeRenderer(imports, registry);

        boolean record = config.getDtoStyle() == DtoStyle.RECORD;
        List<DtoFieldView> fields = new ArrayList<>();
        for (StructureField field : structure.getFields()) {
            fields.add(view(field, types));
        }
        String hashUtil = record ? null : imports.reference("java.util.Objects");

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("packageName", type.getPackageName());
        model.put("className", type.getSimpleName());
        model.put("sourceName", structure.getSourceType().simpleName());
        model.put("hash", structure.getContentHash());
        model.put("aliases", type.getAliases());
        model.put("lineageComments", config.isLineageComments());
        model.put("fields", fields);
        if (hashUtil != null) {
            model.put("hashUtil", hashUtil);
        }
        // every type reference is resolved before the import list is read
        model.put("imports", new ArrayList<>(imports.getImports()));

        String contents = templates.render(record ? "dto-record.ftl" : "dto-class.ftl", model);
        return GeneratedFile.builder()
                .path(FileWriteUtil.sourcePath(type.getPackageName(), type.getSimpleName()))
                .contents(contents)
                .type(GeneratedFileType.DTO)
                .typeName(type.qualifiedName())
                .build();
    }

    private DtoFieldView view(StructureField field, TypeRenderer types) {
        TypeRef type = field.getResolvedType();
        String name = DtoNaming.fieldName(field.getName());
        String equalsExpression;
        String hashExpression = name;
        String toStringExpression = name;
        if (type.isArray()) {
            String arrays = types.reference("java.util.Arrays");
            equalsExpression = arrays + ".equals(this." + name + ", that." + name + ")";
            hashExpression = arrays + ".hashCode(" + name + ")";
            toStringExpression = arrays + ".toString(" + name + ")";
        } else if (type.isPrimitive()) {
            equalsExpression = switch (type.getName()) {
                case "double" -> "Double.compare(this." + name + ", that." + name + ") == 0";
                case "float" -> "Float.compare(this." + name + ", that." + name + ") == 0";
                default -> "this." + name + " == that." + name;
            };
        } else {
            equalsExpression = types.reference("java.util.Objects") + ".equals(this." + name + ", that." + name + ")";
        }
        return DtoFieldView.builder()
                .name(name)
                .type(types.render(type))
                .getter(DtoNaming.getterName(field.getName(), type))
                .setter(DtoNaming.setterName(field.getName()))
                .lineage(field.getLineage())
                .equalsExpression(equalsExpression)
                .hashExpression(hashExpression)
                .toStringExpression(toStringExpression)
                .build();
    }
}
