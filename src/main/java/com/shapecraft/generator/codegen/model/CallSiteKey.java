package com.shapecraft.generator.codegen.model;

import lombok.Value;

/**
 * Memoization key of an analysed call site. Equal keys mean equal analysis
 * results, across passes and configurations.
 */
@Value
public class CallSiteKey {
    String file;
    int line;
    int column;
    String syntaxHash;
    String schemaFingerprint;
    String configFingerprint;
}
