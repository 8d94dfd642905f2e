package com.shapecraft.generator.codegen.shape;

import com.shapecraft.generator.codegen.model.FieldShape;
import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.codegen.model.Structure;

import lombok.Value;

@Value
public class NestedResolution {
    ParsedField parsed;
    FieldShape shape;
    /** Structure of the nested object or collection element, null for leaves. */
    Structure nested;
    /** Path the reverse transform writes the field back to, null when it cannot. */
    SourcePath reversePath;

    static NestedResolution leaf(ParsedField parsed) {
        return new NestedResolution(parsed, FieldShape.LEAF, null, parsed.getSourcePath());
    }
}
