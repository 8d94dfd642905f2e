package com.shapecraft.generator.codegen.util;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Manages import statements for generated Java classes. A simple name is
 * imported at most once; later types sharing it are written fully qualified.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final Map<String, String> bySimpleName = new HashMap<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Claims a simple name for a type declared in the generated file itself.
     */
    public void reserve(String simpleName) {
        bySimpleName.putIfAbsent(simpleName, currentPackage + "." + simpleName);
    }

    /**
     * Name to write for {@code fullQualifiedName} in the generated source:
     * the simple name when it could be imported, the qualified name otherwise.
     */
    public String reference(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return fullQualifiedName;
        }
        String canonical = fullQualifiedName.replace('$', '.');
        int lastDot = canonical.lastIndexOf('.');
        if (lastDot < 0) {
            // primitives and default-package types
            return canonical;
        }
        String simpleName = canonical.substring(lastDot + 1);
        String owner = bySimpleName.get(simpleName);
        if (owner != null && !owner.equals(canonical)) {
            return canonical;
        }
        bySimpleName.put(simpleName, canonical);
        addImport(canonical);
        return simpleName;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips if in same package or java.lang.
     */
    public void addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return;
        }

        // Skip java.lang
        String packageName = getPackageName(fullQualifiedName);
        if (packageName.equals("java.lang")) {
            return;
        }

        // Skip same package
        if (packageName.equals(currentPackage)) {
            return;
        }

        imports.add(fullQualifiedName);
    }

    public Set<String> getImports() {
        return imports;
    }

    /**
     * Generates import statements as a string.
     */
    public String generateImports() {
        if (imports.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (String imp : imports) {
            sb.append("import ").append(imp).append(";\n");
        }
        return sb.toString();
    }

    private String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }
}
