package ai.treescan.scan;

import ai.treescan.finding.Diagnostic;
import ai.treescan.finding.Finding;
import java.util.List;

/** Findings and diagnostics of a scan, in input-file order. */
public record ScanResult(List<Finding> findings, List<Diagnostic> diagnostics) {

    public static final ScanResult EMPTY = new ScanResult(List.of(), List.of());

    public ScanResult {
        findings = List.copyOf(findings);
        diagnostics = List.copyOf(diagnostics);
    }

    public static ScanResult of(Diagnostic diagnostic) {
        return new ScanResult(List.of(), List.of(diagnostic));
    }

    public List<Finding> findingsInCategory(String category) {
        return findings.stream().filter(f -> f.category().equals(category)).toList();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
