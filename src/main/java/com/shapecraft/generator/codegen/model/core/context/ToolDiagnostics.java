package com.shapecraft.generator.codegen.model.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tool-wide diagnostics (errors/warnings/info) accumulated during a generation run.
 *
 * Pure structure only: no logging, no formatting, no IO. One instance per call
 * site while analysing; merged into the run's instance afterwards.
 */
public class ToolDiagnostics {
    private final List<Diagnostic> entries = new ArrayList<>();

    public void error(DiagnosticCode code, String location, String message) {
        entries.add(new Diagnostic(DiagnosticSeverity.ERROR, code, location, message));
    }

    public void warning(DiagnosticCode code, String location, String message) {
        entries.add(new Diagnostic(DiagnosticSeverity.WARNING, code, location, message));
    }

    public void info(DiagnosticCode code, String location, String message) {
        entries.add(new Diagnostic(DiagnosticSeverity.INFO, code, location, message));
    }

    public void addAll(ToolDiagnostics other) {
        entries.addAll(other.entries);
    }

    public List<Diagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Diagnostic> getErrors() {
        return bySeverity(DiagnosticSeverity.ERROR);
    }

    public List<Diagnostic> getWarnings() {
        return bySeverity(DiagnosticSeverity.WARNING);
    }

    public List<Diagnostic> getInfos() {
        return bySeverity(DiagnosticSeverity.INFO);
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(d -> d.getSeverity() == DiagnosticSeverity.ERROR);
    }

    public boolean has(DiagnosticCode code) {
        return entries.stream().anyMatch(d -> d.getCode() == code);
    }

    private List<Diagnostic> bySeverity(DiagnosticSeverity severity) {
        return entries.stream()
                .filter(d -> d.getSeverity() == severity)
                .collect(Collectors.toList());
    }
}
