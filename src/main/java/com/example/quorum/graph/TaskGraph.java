package com.example.quorum.graph;

import com.example.quorum.model.FailureReason;
import com.example.quorum.model.TaskResult;
import com.example.quorum.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Directed acyclic graph of tasks with their dependencies.
 *
 * <p>Acyclicity is enforced as tasks are added. Dependencies may name tasks that are added later;
 * {@link #validate()} rejects ids that never appear. Status transitions are checked against
 * {@link TaskStatus#canTransitionTo(TaskStatus)} and guarded by a read-write lock so that reports
 * may be read while the orchestrator mutates the graph.
 */
public class TaskGraph {

    private static final Logger logger = LoggerFactory.getLogger(TaskGraph.class);

    /**
     * Scheduling order among ready tasks: descending priority, then ascending id.
     */
    public static final Comparator<Task> SCHEDULING_ORDER =
        Comparator.comparingInt(Task::getPriority).reversed().thenComparing(Task::getId);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private boolean scheduled;

    public void addTask(Task task) {
        addTask(task, List.of());
    }

    /**
     * Adds a task with the given dependency ids.
     *
     * @throws DuplicateTaskIdException if the id is already present
     * @throws CycleException if the new edges would close a cycle
     * @throws IllegalStateException if the graph has already been handed to a run
     */
    public void addTask(Task task, Collection<String> dependencies) {
        if (task == null) {
            throw new IllegalArgumentException("Task must not be null");
        }
        Set<String> deps = new LinkedHashSet<>();
        if (dependencies != null) {
            for (String dependency : dependencies) {
                if (dependency == null || dependency.trim().isEmpty()) {
                    throw new IllegalArgumentException("Blank dependency id for task " + task.getId());
                }
                deps.add(dependency);
            }
        }

        lock.writeLock().lock();
        try {
            if (scheduled) {
                throw new IllegalStateException("Graph is already scheduled; tasks cannot be added");
            }
            if (tasks.containsKey(task.getId())) {
                throw new DuplicateTaskIdException(task.getId());
            }
            List<String> cycle = findCycle(task.getId(), deps);
            if (cycle != null) {
                throw new CycleException(cycle);
            }

            task.setDependencies(deps);
            tasks.put(task.getId(), task);
            for (String dependency : deps) {
                dependents.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(task.getId());
            }
            logger.debug("Added task {} with dependencies {}", task.getId(), deps);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Checks that every dependency id names a task in the graph.
     *
     * @throws UnknownDependencyException on the first dangling dependency
     */
    public void validate() {
        lock.readLock().lock();
        try {
            for (Task task : tasks.values()) {
                for (String dependency : task.getDependencies()) {
                    if (!tasks.containsKey(dependency)) {
                        throw new UnknownDependencyException(task.getId(), dependency);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Validates the graph, freezes its structure and promotes root tasks to READY.
     * A graph can be prepared once; its status fields then belong to the run.
     *
     * @throws IllegalStateException if the graph was already prepared for a run
     */
    public void prepareForRun() {
        validate();
        lock.writeLock().lock();
        try {
            if (scheduled) {
                throw new IllegalStateException("Graph has already been run");
            }
            scheduled = true;
            for (Task task : tasks.values()) {
                if (task.getStatus() == TaskStatus.PENDING && dependenciesSucceeded(task)) {
                    transition(task, TaskStatus.READY);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Tasks eligible for dispatch, ordered by {@link #SCHEDULING_ORDER}.
     */
    public List<Task> readyTasks() {
        lock.readLock().lock();
        try {
            return tasks.values().stream()
                .filter(task -> task.getStatus() == TaskStatus.READY
                    || (task.getStatus() == TaskStatus.PENDING && dependenciesSucceeded(task)))
                .sorted(SCHEDULING_ORDER)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void markRunning(String id) {
        updateStatus(id, TaskStatus.RUNNING);
    }

    public void markAwaitingConsensus(String id) {
        updateStatus(id, TaskStatus.AWAITING_CONSENSUS);
    }

    /**
     * Records a failed attempt that will be retried. A task collecting consensus returns to RUNNING.
     *
     * @return the new retry count
     */
    public int recordRetry(String id) {
        lock.writeLock().lock();
        try {
            Task task = require(id);
            if (!task.getStatus().isInFlight()) {
                throw new IllegalStateException("Cannot retry task " + id + " in state " + task.getStatus());
            }
            if (task.getStatus() == TaskStatus.AWAITING_CONSENSUS) {
                transition(task, TaskStatus.RUNNING);
            }
            task.incrementRetryCount();
            return task.getRetryCount();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks a task succeeded and promotes dependents whose dependencies have now all succeeded.
     *
     * @return ids of dependents that became READY
     */
    public List<String> markSucceeded(String id, TaskResult result) {
        lock.writeLock().lock();
        try {
            Task task = require(id);
            transition(task, TaskStatus.SUCCEEDED);
            task.setResult(result);

            List<String> unlocked = new ArrayList<>();
            for (String dependentId : dependents.getOrDefault(id, Set.of())) {
                Task dependent = tasks.get(dependentId);
                if (dependent != null && dependent.getStatus() == TaskStatus.PENDING
                        && dependenciesSucceeded(dependent)) {
                    transition(dependent, TaskStatus.READY);
                    unlocked.add(dependentId);
                }
            }
            return unlocked;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> markFailed(String id, FailureReason reason) {
        return markFailed(id, reason, null);
    }

    /**
     * Marks a task failed and every non-terminal transitive dependent failed with
     * {@link FailureReason#UPSTREAM_FAILURE}.
     *
     * @return ids of dependents the failure propagated to, in breadth-first order
     */
    public List<String> markFailed(String id, FailureReason reason, String detail) {
        lock.writeLock().lock();
        try {
            Task task = require(id);
            transition(task, TaskStatus.FAILED);
            task.setFailure(reason, detail);

            List<String> propagated = new ArrayList<>();
            Deque<String> queue = new ArrayDeque<>(dependents.getOrDefault(id, Set.of()));
            Set<String> visited = new HashSet<>();
            while (!queue.isEmpty()) {
                String dependentId = queue.poll();
                if (!visited.add(dependentId)) {
                    continue;
                }
                Task dependent = tasks.get(dependentId);
                if (dependent == null || dependent.getStatus().isTerminal()) {
                    continue;
                }
                transition(dependent, TaskStatus.FAILED);
                dependent.setFailure(FailureReason.UPSTREAM_FAILURE, "Dependency " + id + " failed");
                propagated.add(dependentId);
                queue.addAll(dependents.getOrDefault(dependentId, Set.of()));
            }
            if (!propagated.isEmpty()) {
                logger.debug("Failure of {} propagated to {}", id, propagated);
            }
            return propagated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Fails every task that is not yet terminal with the given reason.
     *
     * @return ids of the tasks failed
     */
    public List<String> failRemaining(FailureReason reason, String detail) {
        lock.writeLock().lock();
        try {
            List<String> failed = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (!task.getStatus().isTerminal()) {
                    transition(task, TaskStatus.FAILED);
                    task.setFailure(reason, detail);
                    failed.add(task.getId());
                }
            }
            return failed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Task> find(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tasks.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws NoSuchElementException if no task has the id
     */
    public Task get(String id) {
        return find(id).orElseThrow(() -> new NoSuchElementException("Unknown task: " + id));
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tasks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All tasks in insertion order.
     */
    public List<Task> tasks() {
        lock.readLock().lock();
        try {
            return List.copyOf(tasks.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Ids of tasks that directly depend on the given task.
     */
    public Set<String> dependentsOf(String id) {
        lock.readLock().lock();
        try {
            return Set.copyOf(dependents.getOrDefault(id, Set.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A full execution order consistent with dependencies, choosing among available tasks by
     * {@link #SCHEDULING_ORDER}.
     */
    public List<Task> topologicalOrder() {
        validate();
        lock.readLock().lock();
        try {
            Map<String, Integer> remaining = new HashMap<>();
            PriorityQueue<Task> available = new PriorityQueue<>(SCHEDULING_ORDER);
            for (Task task : tasks.values()) {
                remaining.put(task.getId(), task.getDependencies().size());
                if (task.getDependencies().isEmpty()) {
                    available.add(task);
                }
            }
            List<Task> order = new ArrayList<>(tasks.size());
            while (!available.isEmpty()) {
                Task next = available.poll();
                order.add(next);
                for (String dependentId : dependents.getOrDefault(next.getId(), Set.of())) {
                    int left = remaining.merge(dependentId, -1, Integer::sum);
                    if (left == 0) {
                        available.add(tasks.get(dependentId));
                    }
                }
            }
            return order;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * True when every task is SUCCEEDED or FAILED.
     */
    public boolean isComplete() {
        lock.readLock().lock();
        try {
            return tasks.values().stream().allMatch(task -> task.getStatus().isTerminal());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Task> nonTerminalTasks() {
        lock.readLock().lock();
        try {
            return tasks.values().stream()
                .filter(task -> !task.getStatus().isTerminal())
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Point-in-time view of every task's status.
     */
    public Map<String, TaskStatus> statusSnapshot() {
        lock.readLock().lock();
        try {
            Map<String, TaskStatus> snapshot = new LinkedHashMap<>();
            tasks.values().forEach(task -> snapshot.put(task.getId(), task.getStatus()));
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void updateStatus(String id, TaskStatus target) {
        lock.writeLock().lock();
        try {
            transition(require(id), target);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void transition(Task task, TaskStatus target) {
        TaskStatus current = task.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Invalid transition for task " + task.getId() + ": " + current + " -> " + target);
        }
        task.setStatus(target);
    }

    private Task require(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new NoSuchElementException("Unknown task: " + id);
        }
        return task;
    }

    private boolean dependenciesSucceeded(Task task) {
        for (String dependency : task.getDependencies()) {
            Task upstream = tasks.get(dependency);
            if (upstream == null || upstream.getStatus() != TaskStatus.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    /**
     * Searches for a path from any of the new task's dependencies back to the new task.
     * Returns the cycle as a list of ids, or null if none exists.
     */
    private List<String> findCycle(String newId, Set<String> deps) {
        if (deps.contains(newId)) {
            return List.of(newId, newId);
        }
        // only an earlier forward reference to newId can close a cycle
        if (!dependents.containsKey(newId)) {
            return null;
        }
        // parent links point back towards the new task so the cycle can be reported
        Map<String, String> parent = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String dependency : deps) {
            parent.put(dependency, newId);
            stack.push(dependency);
        }
        while (!stack.isEmpty()) {
            String current = stack.pop();
            Task task = tasks.get(current);
            if (task == null) {
                continue;
            }
            for (String next : task.getDependencies()) {
                if (next.equals(newId)) {
                    return cyclePath(newId, current, parent);
                }
                if (!parent.containsKey(next)) {
                    parent.put(next, current);
                    stack.push(next);
                }
            }
        }
        return null;
    }

    private static List<String> cyclePath(String newId, String last, Map<String, String> parent) {
        Deque<String> path = new ArrayDeque<>();
        path.push(newId);
        for (String node = last; !node.equals(newId); node = parent.get(node)) {
            path.push(node);
        }
        path.push(newId);
        return new ArrayList<>(path);
    }
}
