package com.autonomous.tasks.store;

import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskChanges;
import com.autonomous.tasks.model.TaskStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

@Slf4j
public class InMemoryTaskStore implements TaskStore {

    // records are copied in and out
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public Optional<Task> findById(String id) {
        return Optional.ofNullable(tasks.get(id)).map(Task::copy);
    }

    @Override
    public Task insert(Task task) {
        tasks.put(task.getId(), task.copy());
        log.debug("Tarea almacenada en memoria (ID: {})", task.getId());
        return task.copy();
    }

    @Override
    public Optional<Task> mergeUpdate(String id, TaskChanges changes, String updatedAt) {
        Task merged = tasks.computeIfPresent(id, (key, current) -> changes.applyTo(current, updatedAt));
        return Optional.ofNullable(merged).map(Task::copy);
    }

    @Override
    public void deleteById(String id) {
        tasks.remove(id);
    }

    @Override
    public List<Task> scan(Integer limit) {
        return select(task -> true, limit);
    }

    @Override
    public List<Task> scanByStatus(TaskStatus status, Integer limit) {
        return select(task -> task.getEstado() == status, limit);
    }

    private List<Task> select(Predicate<Task> filter, Integer limit) {
        Stream<Task> matching = tasks.values().stream().filter(filter);
        if (limit != null && limit > 0) {
            matching = matching.limit(limit);
        }
        return matching.map(Task::copy).toList();
    }
}
