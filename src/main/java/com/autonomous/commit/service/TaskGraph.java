package com.autonomous.commit.service;

import com.autonomous.commit.exception.TaskGraphException;
import com.autonomous.commit.model.ScheduledTask;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Tasks of one submission batch indexed by position, with dependency edges kept as index
 * lists in both directions. Construction rejects batches that could never finish.
 */
final class TaskGraph<T> {

    private final List<ScheduledTask<T>> tasks;
    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<List<Integer>> dependencies = new ArrayList<>();
    private final List<List<Integer>> dependents = new ArrayList<>();

    TaskGraph(List<ScheduledTask<T>> tasks) {
        this.tasks = List.copyOf(tasks);

        for (int i = 0; i < this.tasks.size(); i++) {
            String id = this.tasks.get(i).getId();
            if (id == null || id.isBlank()) {
                throw new TaskGraphException("Task at position " + i + " has no id");
            }
            if (indexById.putIfAbsent(id, i) != null) {
                throw new TaskGraphException("Duplicate task id: " + id);
            }
            dependencies.add(new ArrayList<>());
            dependents.add(new ArrayList<>());
        }

        for (int i = 0; i < this.tasks.size(); i++) {
            ScheduledTask<T> task = this.tasks.get(i);
            for (String dependencyId : task.getMetadata().getDependencies()) {
                Integer dependency = indexById.get(dependencyId);
                if (dependency == null) {
                    throw new TaskGraphException(
                        "Task " + task.getId() + " depends on unknown task " + dependencyId);
                }
                if (!dependencies.get(i).contains(dependency)) {
                    dependencies.get(i).add(dependency);
                    dependents.get(dependency).add(i);
                }
            }
        }

        checkAcyclic();
    }

    int size() {
        return tasks.size();
    }

    ScheduledTask<T> task(int index) {
        return tasks.get(index);
    }

    List<Integer> dependenciesOf(int index) {
        return dependencies.get(index);
    }

    List<Integer> dependentsOf(int index) {
        return dependents.get(index);
    }

    private void checkAcyclic() {
        int[] remaining = new int[tasks.size()];
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < tasks.size(); i++) {
            remaining[i] = dependencies.get(i).size();
            if (remaining[i] == 0) {
                queue.add(i);
            }
        }

        int visited = 0;
        while (!queue.isEmpty()) {
            int next = queue.poll();
            visited++;
            for (int dependent : dependents.get(next)) {
                if (--remaining[dependent] == 0) {
                    queue.add(dependent);
                }
            }
        }

        if (visited < tasks.size()) {
            String involved = IntStream.range(0, tasks.size())
                .filter(i -> remaining[i] > 0)
                .mapToObj(i -> tasks.get(i).getId())
                .collect(Collectors.joining(", "));
            throw new TaskGraphException("Dependency cycle among tasks: " + involved);
        }
    }
}
