package com.shapecraft.generator.codegen.model.core.context;

import lombok.NonNull;
import lombok.Value;

@Value
public class Diagnostic {
    @NonNull DiagnosticSeverity severity;
    @NonNull DiagnosticCode code;
    /** {@code file:line:column} or another human-readable location. */
    String location;
    @NonNull String message;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code).append("] ");
        if (location != null && !location.isEmpty()) {
            sb.append(location).append(": ");
        }
        return sb.append(message).toString();
    }
}
