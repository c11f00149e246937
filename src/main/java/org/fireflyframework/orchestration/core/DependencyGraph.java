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

import org.fireflyframework.orchestration.model.OperationDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dependency graph of an operation set.
 * <p>
 * Operations are stored in an arena indexed by declaration position; edges are
 * lists of arena indexes. {@code dependencies[i]} holds the operations node
 * {@code i} waits for, {@code dependents[i]} the operations waiting for it.
 * <p>
 * The graph is built from any input. Duplicate types keep their first
 * declaration, and references to undeclared types are kept aside as missing
 * edges so validation can report them.
 */
public final class DependencyGraph {

    private final List<OperationDescriptor> nodes;
    private final Map<String, Integer> indexByType;
    private final List<List<Integer>> dependencies;
    private final List<List<Integer>> dependents;
    private final List<String> duplicates;
    private final Map<String, List<String>> missing;

    private DependencyGraph(List<OperationDescriptor> nodes,
                            Map<String, Integer> indexByType,
                            List<List<Integer>> dependencies,
                            List<List<Integer>> dependents,
                            List<String> duplicates,
                            Map<String, List<String>> missing) {
        this.nodes = nodes;
        this.indexByType = indexByType;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.duplicates = duplicates;
        this.missing = missing;
    }

    static DependencyGraph of(List<OperationDescriptor> descriptors) {
        List<OperationDescriptor> nodes = new ArrayList<>();
        Map<String, Integer> indexByType = new HashMap<>();
        List<String> duplicates = new ArrayList<>();

        for (OperationDescriptor descriptor : descriptors) {
            if (indexByType.containsKey(descriptor.type())) {
                duplicates.add(descriptor.type());
                continue;
            }
            indexByType.put(descriptor.type(), nodes.size());
            nodes.add(descriptor);
        }

        List<List<Integer>> dependencies = new ArrayList<>(nodes.size());
        List<List<Integer>> dependents = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            dependencies.add(new ArrayList<>());
            dependents.add(new ArrayList<>());
        }

        Map<String, List<String>> missing = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            OperationDescriptor node = nodes.get(i);
            for (String dependency : node.dependencies()) {
                Integer target = indexByType.get(dependency);
                if (target == null) {
                    missing.computeIfAbsent(node.type(), k -> new ArrayList<>()).add(dependency);
                    continue;
                }
                dependencies.get(i).add(target);
                dependents.get(target).add(i);
            }
        }

        return new DependencyGraph(List.copyOf(nodes), indexByType, dependencies, dependents,
                List.copyOf(duplicates), missing);
    }

    /**
     * Gets the distinct operations in declaration order.
     */
    public List<OperationDescriptor> operations() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public Optional<OperationDescriptor> find(String type) {
        Integer index = indexByType.get(type);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public boolean contains(String type) {
        return indexByType.containsKey(type);
    }

    /**
     * Gets the declared operations the given one depends on.
     *
     * @param type the operation type
     * @return the dependency types in declaration order of the edge, empty if unknown
     */
    public List<String> dependencies(String type) {
        return typesOf(dependencies, type);
    }

    /**
     * Gets the operations that depend on the given one.
     *
     * @param type the operation type
     * @return the dependent types, empty if unknown
     */
    public List<String> dependents(String type) {
        return typesOf(dependents, type);
    }

    List<String> duplicates() {
        return duplicates;
    }

    Map<String, List<String>> missing() {
        return missing;
    }

    int indexOf(String type) {
        return indexByType.getOrDefault(type, -1);
    }

    OperationDescriptor node(int index) {
        return nodes.get(index);
    }

    List<Integer> dependencyIndexes(int index) {
        return Collections.unmodifiableList(dependencies.get(index));
    }

    List<Integer> dependentIndexes(int index) {
        return Collections.unmodifiableList(dependents.get(index));
    }

    private List<String> typesOf(List<List<Integer>> edges, String type) {
        Integer index = indexByType.get(type);
        if (index == null) {
            return List.of();
        }
        return edges.get(index).stream().map(i -> nodes.get(i).type()).toList();
    }
}
