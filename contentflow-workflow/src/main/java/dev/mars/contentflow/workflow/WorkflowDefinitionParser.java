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

import java.nio.file.Path;

public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path definitionFile) throws SchemaException;

    WorkflowDefinition parseFromString(String content) throws SchemaException;

    /**
     * Validates a definition that was built in code rather than parsed.
     * Declaration order is not enforced here so that cycles reach the
     * dependency resolver, which names their members.
     *
     * @param definition the definition to validate
     * @return validation result
     */
    ValidationResult validate(WorkflowDefinition definition);

    /**
     * Renders a definition in the format this parser reads, used as the run
     * snapshot of definitions that carry no source text.
     */
    String render(WorkflowDefinition definition);
}
