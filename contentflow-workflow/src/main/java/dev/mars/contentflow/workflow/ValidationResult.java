/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.contentflow.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Every problem found in a workflow definition, each tied to the path of the
 * field it concerns ({@code workflow.name}, {@code steps[2].input_from}, or
 * the empty path for the document as a whole).
 *
 * <p>Errors make a definition unusable. Warnings, such as unknown step fields,
 * are reported and ignored.</p>
 */
public class ValidationResult {

    private final List<Violation> violations = new ArrayList<>();

    public void addError(String fieldPath, String message) {
        violations.add(new Violation(true, Violation.NO_LINE, fieldPath, message));
    }

    /**
     * Records an error at a line of the YAML source.
     */
    public void addError(int lineNumber, String fieldPath, String message) {
        violations.add(new Violation(true, lineNumber, fieldPath, message));
    }

    public void addWarning(String fieldPath, String message) {
        violations.add(new Violation(false, Violation.NO_LINE, fieldPath, message));
    }

    public void merge(ValidationResult other) {
        violations.addAll(other.violations);
    }

    public List<Violation> getErrors() {
        return select(true);
    }

    public List<Violation> getWarnings() {
        return select(false);
    }

    /**
     * @return the field paths of all errors, in the order they were found
     */
    public List<String> getErrorFieldPaths() {
        return getErrors().stream()
                .map(Violation::getFieldPath)
                .collect(Collectors.toList());
    }

    public boolean isValid() {
        return violations.stream().noneMatch(Violation::isError);
    }

    public boolean hasWarnings() {
        return violations.stream().anyMatch(violation -> !violation.isError());
    }

    public int getErrorCount() {
        return getErrors().size();
    }

    public int getWarningCount() {
        return getWarnings().size();
    }

    private List<Violation> select(boolean errors) {
        return violations.stream()
                .filter(violation -> violation.isError() == errors)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid()
                + ", errors=" + getErrorCount()
                + ", warnings=" + getWarningCount() + '}';
    }

    /**
     * One error or warning about a definition field.
     */
    public static final class Violation {
        static final int NO_LINE = -1;

        private final boolean error;
        private final int lineNumber;
        private final String fieldPath;
        private final String message;

        Violation(boolean error, int lineNumber, String fieldPath, String message) {
            this.error = error;
            this.lineNumber = lineNumber;
            this.fieldPath = fieldPath != null ? fieldPath : "";
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public boolean isError() {
            return error;
        }

        /**
         * @return the 1-based source line, or -1 when the violation is not tied to a line
         */
        public int getLineNumber() {
            return lineNumber;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Violation that = (Violation) o;
            return error == that.error &&
                   lineNumber == that.lineNumber &&
                   fieldPath.equals(that.fieldPath) &&
                   message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(error, lineNumber, fieldPath, message);
        }

        @Override
        public String toString() {
            String location = fieldPath.isEmpty() ? "<document>" : fieldPath;
            if (lineNumber > 0) {
                location += " (line " + lineNumber + ")";
            }
            return (error ? "error " : "warning ") + location + ": " + message;
        }
    }
}
