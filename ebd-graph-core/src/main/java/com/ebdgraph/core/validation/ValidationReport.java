package com.ebdgraph.core.validation;

import java.util.List;
import java.util.Objects;

/**
 * Ordered findings of one validation run.
 *
 * @param findings findings in check order
 */
public record ValidationReport(List<Finding> findings) {

    /**
     * Compact constructor with validation.
     */
    public ValidationReport {
        Objects.requireNonNull(findings, "findings must not be null");
        findings = List.copyOf(findings);
    }

    public boolean hasFatal() {
        return findings.stream().anyMatch(Finding::isFatal);
    }

    public List<Finding> fatal() {
        return findings.stream().filter(Finding::isFatal).toList();
    }

    public List<Finding> warnings() {
        return findings.stream().filter(finding -> !finding.isFatal()).toList();
    }

    /**
     * Returns the findings of one kind.
     *
     * @param kind finding kind
     * @return matching findings in check order
     */
    public List<Finding> ofKind(FindingKind kind) {
        return findings.stream().filter(finding -> finding.kind() == kind).toList();
    }
}
