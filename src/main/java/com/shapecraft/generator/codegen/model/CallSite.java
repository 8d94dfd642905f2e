package com.shapecraft.generator.codegen.model;

import java.util.List;
import java.util.stream.Collectors;

import com.shapecraft.generator.codegen.StructuralSignatureCalculator;
import com.shapecraft.generator.model.CaptureDeclaration;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.TypeExpr;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One projection declaration together with the file context it was found in.
 */
@Value
@Builder
public class CallSite {
    /** Declared projection name, null for anonymous projections. */
    String name;
    @NonNull String sourceFile;
    int line;
    int column;
    @NonNull String packageName;
    /** Simple name of the generated class holding this site's projection methods. */
    @NonNull String projectionsClassName;
    @Singular("importEntry")
    List<String> imports;
    @NonNull TypeExpr sourceType;
    @NonNull String parameterName;
    @Singular
    List<CaptureDeclaration> captures;
    @NonNull ExprNode body;

    public boolean hasCaptures() {
        return !captures.isEmpty();
    }

    public String location() {
        return sourceFile + ":" + line + ":" + column;
    }

    /**
     * Value-based cache key: location plus a digest of everything the analysis
     * reads from the site, the schema fingerprint and the generator settings.
     */
    public CallSiteKey key(String schemaFingerprint, String configFingerprint) {
        String syntax = String.join("\n",
                String.valueOf(name),
                packageName,
                String.join(",", imports),
                sourceType.toString(),
                parameterName,
                captures.stream().map(c -> c.getType() + " " + c.getName()).collect(Collectors.joining(",")),
                body.toSource());
        return new CallSiteKey(sourceFile, line, column, StructuralSignatureCalculator.sha256Hex(syntax),
                schemaFingerprint, configFingerprint);
    }
}
