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

import java.util.*;

/**
 * Orders the steps of a workflow so every step runs after the steps it takes
 * input from or depends on. Edges come from {@code input_from} and
 * {@code depends_on}; steps with a static input have no incoming data edge.
 *
 * <p>Ordering uses Kahn's algorithm with ties broken by declaration order, so
 * the same definition always yields the same order. The resolver holds no
 * state and may be shared.</p>
 */
public class DependencyResolver {

    /**
     * Computes the execution order of a workflow.
     *
     * @param definition the workflow
     * @return the steps in dependency order
     * @throws CycleException if steps depend on each other in a cycle
     * @throws IllegalArgumentException if a step references an undeclared step
     *         or two steps share an id
     */
    public ExecutionOrder resolve(WorkflowDefinition definition) throws CycleException {
        List<StepSpec> steps = definition.getSteps();
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            if (position.put(steps.get(i).getId(), i) != null) {
                throw new IllegalArgumentException("Duplicate step id: " + steps.get(i).getId());
            }
        }

        Map<String, List<String>> upstream = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (StepSpec step : steps) {
            dependents.putIfAbsent(step.getId(), new ArrayList<>());
        }
        for (StepSpec step : steps) {
            List<String> ids = step.getUpstreamIds();
            for (String id : ids) {
                if (!position.containsKey(id)) {
                    throw new IllegalArgumentException("Step '" + step.getId()
                            + "' references unknown step '" + id + "'");
                }
                dependents.get(id).add(step.getId());
            }
            upstream.put(step.getId(), ids);
        }

        // Kahn's algorithm, ready steps taken in declaration order
        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<StepSpec> ready = new PriorityQueue<>(
                Comparator.comparingInt(step -> position.get(step.getId())));
        for (StepSpec step : steps) {
            int degree = upstream.get(step.getId()).size();
            inDegree.put(step.getId(), degree);
            if (degree == 0) {
                ready.offer(step);
            }
        }

        List<StepSpec> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            StepSpec current = ready.poll();
            ordered.add(current);
            for (String dependent : dependents.get(current.getId())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.offer(steps.get(position.get(dependent)));
                }
            }
        }

        if (ordered.size() != steps.size()) {
            throw new CycleException(definition.getName(), findCycleMembers(steps, upstream));
        }
        return new ExecutionOrder(ordered, upstream, dependents);
    }

    /**
     * Finds the steps that lie on a cycle: members of strongly connected
     * components with more than one step, and steps that reference themselves.
     * Steps that only sit downstream of a cycle are not included.
     */
    static List<String> findCycleMembers(List<StepSpec> steps, Map<String, List<String>> upstream) {
        Tarjan tarjan = new Tarjan(upstream);
        for (StepSpec step : steps) {
            if (!tarjan.index.containsKey(step.getId())) {
                tarjan.connect(step.getId());
            }
        }
        List<String> members = new ArrayList<>();
        for (StepSpec step : steps) {
            if (tarjan.cyclic.contains(step.getId())) {
                members.add(step.getId());
            }
        }
        return members;
    }

    private static final class Tarjan {
        private final Map<String, List<String>> edges;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final Set<String> cyclic = new HashSet<>();
        private int counter;

        private Tarjan(Map<String, List<String>> edges) {
            this.edges = edges;
        }

        private void connect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : edges.getOrDefault(node, List.of())) {
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));

                if (component.size() > 1 || edges.getOrDefault(node, List.of()).contains(node)) {
                    cyclic.addAll(component);
                }
            }
        }
    }
}
