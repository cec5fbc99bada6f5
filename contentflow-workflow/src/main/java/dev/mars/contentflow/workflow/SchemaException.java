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

import dev.mars.contentflow.exceptions.ContentFlowException;

import java.util.List;

/**
 * Exception thrown when a workflow definition is malformed. Carries every
 * violation found, not just the first one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class SchemaException extends ContentFlowException {

    private final String workflowName;
    private final ValidationResult validationResult;

    public SchemaException(String workflowName, ValidationResult validationResult) {
        super(buildMessage(workflowName, validationResult));
        this.workflowName = workflowName;
        this.validationResult = validationResult;
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.workflowName = null;
        this.validationResult = new ValidationResult();
        this.validationResult.addError("", message);
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    public List<ValidationResult.Violation> getViolations() {
        return validationResult.getErrors();
    }

    private static String buildMessage(String workflowName, ValidationResult result) {
        StringBuilder sb = new StringBuilder();
        if (workflowName != null) {
            sb.append("Workflow '").append(workflowName).append("': ");
        }
        sb.append("definition has ").append(result.getErrorCount()).append(" error(s)");
        for (ValidationResult.Violation error : result.getErrors()) {
            sb.append("\n  - ").append(error);
        }
        return sb.toString();
    }
}
