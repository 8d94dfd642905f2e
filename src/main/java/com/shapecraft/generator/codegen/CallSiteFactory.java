package com.shapecraft.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.model.ProjectionDeclaration;
import com.shapecraft.generator.model.ShapeFile;

/**
 * Turns the declarations of a parsed shape file into call sites.
 */
public class CallSiteFactory {

    private final String defaultPackage;

    public CallSiteFactory(String defaultPackage) {
        this.defaultPackage = defaultPackage;
    }

    public List<CallSite> callSites(ShapeFile file) {
        String packageName = file.getPackageName() != null ? file.getPackageName() : defaultPackage;
        String className = projectionsClassName(file);
        List<CallSite> sites = new ArrayList<>();
        for (ProjectionDeclaration declaration : file.getProjections()) {
            sites.add(CallSite.builder()
                    .name(declaration.getName())
                    .sourceFile(file.getSourceFile())
                    .line(declaration.getPosition().getLine())
                    .column(declaration.getPosition().getColumn())
                    .packageName(packageName)
                    .projectionsClassName(className)
                    .imports(file.getImports())
                    .sourceType(declaration.getSourceType())
                    .parameterName(declaration.getParameterName())
                    .captures(declaration.getCaptures())
                    .body(declaration.getBody())
                    .build());
        }
        return sites;
    }

    public static String projectionsClassName(ShapeFile file) {
        return NamingUtil.toPascalCase(file.baseName()) + "Projections";
    }
}
