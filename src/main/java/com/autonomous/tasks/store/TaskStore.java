package com.autonomous.tasks.store;

import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskChanges;
import com.autonomous.tasks.model.TaskStatus;

import java.util.List;
import java.util.Optional;

public interface TaskStore {

    Optional<Task> findById(String id);

    Task insert(Task task);

    /**
     * Writes only the changed attributes plus {@code actualizado_en} and returns the whole
     * record as stored afterwards. Empty when no record with this id exists.
     */
    Optional<Task> mergeUpdate(String id, TaskChanges changes, String updatedAt);

    void deleteById(String id); // no-op when missing

    // null limit means every record
    List<Task> scan(Integer limit);

    List<Task> scanByStatus(TaskStatus status, Integer limit);
}
