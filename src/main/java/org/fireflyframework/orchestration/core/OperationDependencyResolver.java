/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.orchestration.core;

import org.fireflyframework.orchestration.exception.GraphValidationException;
import org.fireflyframework.orchestration.model.ExecutionPlan;
import org.fireflyframework.orchestration.model.OperationDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves an operation set into an {@link ExecutionPlan}.
 * <p>
 * Validation reports every problem at once:
 * <ul>
 *   <li>duplicate operation types</li>
 *   <li>dependencies on undeclared operations</li>
 *   <li>dependency cycles, each named by its path</li>
 *   <li>required operations depending, even transitively, on non-required ones</li>
 * </ul>
 * <p>
 * <b>Stages:</b>
 * A valid graph is layered with Kahn's algorithm. Stage 0 holds the operations
 * without dependencies; every later stage holds the operations whose
 * dependencies all sit in earlier stages. Within a stage operations keep their
 * declaration order, so the same input always yields the same plan.
 */
@Slf4j
public class OperationDependencyResolver {

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    /**
     * Builds the dependency graph without validating it.
     *
     * @param descriptors the declared operations
     * @return the graph
     */
    public DependencyGraph buildGraph(List<OperationDescriptor> descriptors) {
        return DependencyGraph.of(descriptors);
    }

    /**
     * Validates an operation set without throwing.
     *
     * @param descriptors the declared operations
     * @return the validation outcome with every error found
     */
    public DependencyValidationResult validate(List<OperationDescriptor> descriptors) {
        return DependencyValidationResult.of(collectErrors(buildGraph(descriptors)));
    }

    /**
     * Resolves an operation set into stages.
     *
     * @param descriptors the declared operations
     * @return the execution plan
     * @throws GraphValidationException if the set cannot be resolved; no partial plan is produced
     */
    public ExecutionPlan resolve(List<OperationDescriptor> descriptors) {
        DependencyGraph graph = buildGraph(descriptors);
        List<DependencyError> errors = collectErrors(graph);
        if (!errors.isEmpty()) {
            log.warn("OPERATION_GRAPH_INVALID: operations={}, errors={}", graph.size(), errors.size());
            throw new GraphValidationException(errors);
        }

        ExecutionPlan plan = ExecutionPlan.of(buildStages(graph));
        log.debug("OPERATIONS_RESOLVED: planId={}, operations={}, stages={}",
                plan.planId(), plan.size(), plan.stages().size());
        return plan;
    }

    /**
     * Resolves only what is needed to run the goal operation: the goal plus its
     * transitive dependencies.
     *
     * @param descriptors the declared operations
     * @param goal the operation type to reach
     * @return the execution plan of the minimal set
     * @throws GraphValidationException if the goal is undeclared or its set cannot be resolved
     */
    public ExecutionPlan resolve(List<OperationDescriptor> descriptors, String goal) {
        DependencyGraph graph = buildGraph(descriptors);
        int goalIndex = graph.indexOf(goal);
        if (goalIndex < 0) {
            throw new GraphValidationException(List.of(DependencyError.missingGoal(goal)));
        }

        BitSet closure = closureOf(graph, goalIndex);
        List<OperationDescriptor> subset = new ArrayList<>();
        for (int i = closure.nextSetBit(0); i >= 0; i = closure.nextSetBit(i + 1)) {
            subset.add(graph.node(i));
        }
        return resolve(subset);
    }

    /**
     * Gets the goal plus its transitive dependencies in resolved order.
     *
     * @param descriptors the declared operations
     * @param goal the operation type to reach
     * @return the minimal operation set, empty if the goal is not declared
     */
    public List<OperationDescriptor> minimalOperationSet(List<OperationDescriptor> descriptors, String goal) {
        if (!buildGraph(descriptors).contains(goal)) {
            return List.of();
        }
        return resolve(descriptors, goal).order();
    }

    private List<DependencyError> collectErrors(DependencyGraph graph) {
        List<DependencyError> errors = new ArrayList<>();

        new LinkedHashSet<>(graph.duplicates()).forEach(type -> errors.add(DependencyError.duplicate(type)));

        for (Map.Entry<String, List<String>> entry : graph.missing().entrySet()) {
            for (String dependency : entry.getValue()) {
                errors.add(DependencyError.missing(entry.getKey(), dependency));
            }
        }

        findCycles(graph).forEach(path -> errors.add(DependencyError.cycle(path)));
        errors.addAll(findRequiredOnOptional(graph));
        return errors;
    }

    private List<List<String>> findCycles(DependencyGraph graph) {
        int[] color = new int[graph.size()];
        List<Integer> stack = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();

        for (int i = 0; i < graph.size(); i++) {
            if (color[i] == WHITE) {
                visit(graph, i, color, stack, seen, cycles);
            }
        }
        return cycles;
    }

    private void visit(DependencyGraph graph, int index, int[] color, List<Integer> stack,
                       Set<Set<String>> seen, List<List<String>> cycles) {
        color[index] = GRAY;
        stack.add(index);

        for (int dependency : graph.dependencyIndexes(index)) {
            if (color[dependency] == GRAY) {
                List<String> path = new ArrayList<>();
                for (int i = stack.indexOf(dependency); i < stack.size(); i++) {
                    path.add(graph.node(stack.get(i)).type());
                }
                if (seen.add(new TreeSet<>(path))) {
                    path.add(graph.node(dependency).type());
                    log.debug("CIRCULAR_DEPENDENCY: path={}", String.join(" -> ", path));
                    cycles.add(Collections.unmodifiableList(path));
                }
            } else if (color[dependency] == WHITE) {
                visit(graph, dependency, color, stack, seen, cycles);
            }
        }

        stack.remove(stack.size() - 1);
        color[index] = BLACK;
    }

    private List<DependencyError> findRequiredOnOptional(DependencyGraph graph) {
        List<DependencyError> errors = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            OperationDescriptor operation = graph.node(i);
            if (!operation.required()) {
                continue;
            }
            BitSet closure = closureOf(graph, i);
            for (int j = closure.nextSetBit(0); j >= 0; j = closure.nextSetBit(j + 1)) {
                if (j != i && !graph.node(j).required()) {
                    errors.add(DependencyError.requiredOnOptional(operation.type(), graph.node(j).type()));
                }
            }
        }
        return errors;
    }

    private BitSet closureOf(DependencyGraph graph, int start) {
        BitSet reached = new BitSet(graph.size());
        List<Integer> pending = new ArrayList<>(List.of(start));
        while (!pending.isEmpty()) {
            int index = pending.remove(pending.size() - 1);
            if (reached.get(index)) {
                continue;
            }
            reached.set(index);
            pending.addAll(graph.dependencyIndexes(index));
        }
        return reached;
    }

    private List<List<OperationDescriptor>> buildStages(DependencyGraph graph) {
        int[] inDegree = new int[graph.size()];
        List<Integer> current = new ArrayList<>();
        for (int i = 0; i < graph.size(); i++) {
            inDegree[i] = graph.dependencyIndexes(i).size();
            if (inDegree[i] == 0) {
                current.add(i);
            }
        }

        List<List<OperationDescriptor>> stages = new ArrayList<>();
        int processed = 0;
        while (!current.isEmpty()) {
            stages.add(current.stream().map(graph::node).toList());
            processed += current.size();

            List<Integer> next = new ArrayList<>();
            for (int index : current) {
                for (int dependent : graph.dependentIndexes(index)) {
                    if (--inDegree[dependent] == 0) {
                        next.add(dependent);
                    }
                }
            }
            Collections.sort(next);
            current = next;
        }

        if (processed < graph.size()) {
            // unreachable once validation passed
            throw new IllegalStateException("Unable to build execution stages - possible cycle");
        }
        return stages;
    }
}
