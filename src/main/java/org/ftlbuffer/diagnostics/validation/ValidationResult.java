package org.ftlbuffer.diagnostics.validation;

import java.util.List;

/**
 * The outcome of validating a resource. Only errors make a resource invalid; warnings are advisory.
 *
 * @param errors   The syntax errors, one per skipped entry.
 * @param warnings The semantic warnings.
 */
public record ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }
}
