package com.shapecraft.generator.codegen;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

import com.shapecraft.generator.codegen.model.StructureField;
import com.shapecraft.generator.schema.CollectionKind;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Calculates the content hash of a structure. Two structures with the same
 * ordered (name, nullable, type-or-nested-hash) field sequence get the same hash,
 * whatever source type, package or file they come from.
 */
public class StructuralSignatureCalculator {

    private final int hashLength;

    public StructuralSignatureCalculator(int hashLength) {
        if (hashLength < 4 || hashLength > 64) {
            throw new IllegalArgumentException("Hash length must be between 4 and 64: " + hashLength);
        }
        this.hashLength = hashLength;
    }

    /**
     * Canonical signature text: the exact input of the hash, kept to tell real
     * duplicates from hash collisions.
     */
    public String signatureText(List<StructureField> fields, String targetType) {
        StringBuilder sb = new StringBuilder();
        if (targetType != null) {
            sb.append("named:").append(targetType).append('\n');
        }
        for (StructureField field : fields) {
            sb.append(fieldSignature(field)).append('\n');
        }
        return sb.toString();
    }

    public String contentHash(List<StructureField> fields, String targetType) {
        StringBuilder sb = new StringBuilder();
        if (targetType != null) {
            sb.append("named:").append(targetType).append('\n');
        }
        for (StructureField field : fields) {
            // per-field digest keeps field boundaries unambiguous
            sb.append(sha256Hex(fieldSignature(field))).append('\n');
        }
        return shortHash(sb.toString());
    }

    /**
     * Upper-case hex digest of {@code text}, truncated to the configured length.
     */
    public String shortHash(String text) {
        return sha256Hex(text).substring(0, hashLength).toUpperCase(Locale.ROOT);
    }

    public int getHashLength() {
        return hashLength;
    }

    static String fieldSignature(StructureField field) {
        return field.getName() + "|" + field.isNullable() + "|" + typeDescriptor(field);
    }

    private static String typeDescriptor(StructureField field) {
        if (!field.isNested()) {
            return field.getResolvedType().descriptor();
        }
        String nested = "#" + field.getNestedStructure().getContentHash();
        TypeRef type = field.getResolvedType();
        if (type.isCollection()) {
            return type.getCollectionKind() == CollectionKind.ARRAY
                    ? nested + "[]"
                    : type.getName() + "<" + nested + ">";
        }
        return nested;
    }

    /**
     * Full lower-case SHA-256 hex digest.
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
