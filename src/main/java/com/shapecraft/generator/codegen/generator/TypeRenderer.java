package com.shapecraft.generator.codegen.generator;

import com.shapecraft.generator.codegen.dedup.StructureRegistry;
import com.shapecraft.generator.codegen.util.ImportManager;
import com.shapecraft.generator.schema.AnonymousOrigin;
import com.shapecraft.generator.schema.CollectionKind;
import com.shapecraft.generator.schema.TypeKind;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Writes {@link TypeRef}s as Java source, registering the imports they need.
 */
public class TypeRenderer {

    private final ImportManager imports;
    private final StructureRegistry registry;

    public TypeRenderer(ImportManager imports, StructureRegistry registry) {
        this.imports = imports;
        this.registry = registry;
    }

    public String render(TypeRef type) {
        return switch (type.getKind()) {
            case PRIMITIVE -> type.getName();
            case NAMED -> imports.reference(type.getName());
            case COLLECTION -> type.getCollectionKind() == CollectionKind.ARRAY
                    ? render(type.getElementType()) + "[]"
                    : imports.reference(type.getName()) + "<" + render(type.getElementType().boxed()) + ">";
            case GROUP -> imports.reference("java.util.Map") + ".Entry<" + render(type.getKeyType()) + ", "
                    + imports.reference("java.util.List") + "<" + render(type.getElementType()) + ">>";
            case ANONYMOUS -> type.getOrigin() == AnonymousOrigin.DTO
                    ? imports.reference(registry.typeFor(type.getName()).qualifiedName())
                    : imports.reference("java.util.Map") + "<String, Object>";
            case UNRESOLVED, NULL -> "Object";
        };
    }

    public String renderBoxed(TypeRef type) {
        return render(type.boxed());
    }

    /**
     * Type usable in a generic array creation such as {@code T[]::new}.
     */
    public String renderErased(TypeRef type) {
        if (type.getKind() == TypeKind.COLLECTION
                && type.getCollectionKind() != CollectionKind.ARRAY) {
            return imports.reference(type.getName());
        }
        if (type.isGroup()) {
            return imports.reference("java.util.Map") + ".Entry";
        }
        if (type.isAnonymous() && type.getOrigin() == AnonymousOrigin.MAP) {
            return imports.reference("java.util.Map");
        }
        return render(type);
    }

    /**
     * Fully qualified name or simple name, whichever is importable.
     */
    public String reference(String qualifiedName) {
        return imports.reference(qualifiedName);
    }

    public ImportManager getImports() {
        return imports;
    }
}
