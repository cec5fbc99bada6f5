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

import dev.mars.contentflow.model.StepStatus;

import java.util.*;

/**
 * The steps of a workflow in an order where every step comes after all of its
 * upstream steps, with the dependency edges kept for queries.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public final class ExecutionOrder {

    private final List<StepSpec> orderedSteps;
    private final Map<String, List<String>> upstream;
    private final Map<String, List<String>> dependents;

    ExecutionOrder(List<StepSpec> orderedSteps, Map<String, List<String>> upstream,
                   Map<String, List<String>> dependents) {
        this.orderedSteps = List.copyOf(orderedSteps);
        this.upstream = copyOf(upstream);
        this.dependents = copyOf(dependents);
    }

    public List<StepSpec> getOrderedSteps() {
        return orderedSteps;
    }

    public List<String> getOrderedStepIds() {
        List<String> ids = new ArrayList<>();
        for (StepSpec step : orderedSteps) {
            ids.add(step.getId());
        }
        return ids;
    }

    public int size() {
        return orderedSteps.size();
    }

    /**
     * @return the ids of the steps the given step waits for directly
     */
    public List<String> upstreamOf(String stepId) {
        return upstream.getOrDefault(stepId, List.of());
    }

    /**
     * @return the ids of every step that directly or transitively depends on
     *         the given step, in execution order
     */
    public List<String> downstreamOf(String stepId) {
        Set<String> reached = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(dependents.getOrDefault(stepId, List.of()));
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (reached.add(current)) {
                pending.addAll(dependents.getOrDefault(current, List.of()));
            }
        }
        List<String> ordered = new ArrayList<>();
        for (StepSpec step : orderedSteps) {
            if (reached.contains(step.getId())) {
                ordered.add(step.getId());
            }
        }
        return ordered;
    }

    /**
     * Returns the pending steps whose upstream steps have all succeeded, in
     * execution order. Steps missing from {@code statuses} count as pending.
     */
    public List<StepSpec> readySteps(Map<String, StepStatus> statuses) {
        List<StepSpec> ready = new ArrayList<>();
        for (StepSpec step : orderedSteps) {
            StepStatus status = statuses.getOrDefault(step.getId(), StepStatus.PENDING);
            if (status != StepStatus.PENDING) {
                continue;
            }
            boolean upstreamDone = upstreamOf(step.getId()).stream()
                    .allMatch(id -> statuses.get(id) == StepStatus.SUCCESS);
            if (upstreamDone) {
                ready.add(step);
            }
        }
        return ready;
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> edges) {
        Map<String, List<String>> copy = new HashMap<>();
        edges.forEach((id, ids) -> copy.put(id, List.copyOf(ids)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "ExecutionOrder" + getOrderedStepIds();
    }
}
