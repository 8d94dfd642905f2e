package com.shapecraft.generator.codegen.model.core.context;

public enum DiagnosticSeverity {
    ERROR,
    WARNING,
    INFO
}
