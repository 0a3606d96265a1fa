package com.autonomous.tasks.query;

import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.model.TaskStatus;
import com.autonomous.tasks.store.TaskStore;
import com.autonomous.tasks.store.TaskStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class TaskQueryService {

    private final TaskStore taskStore;

    public TaskQueryService(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    public TaskResult<Task> getById(String id) {
        Optional<Task> task;
        try {
            task = taskStore.findById(id);
        } catch (TaskStoreException e) {
            log.error("Error al obtener tarea por ID {}", id, e);
            return TaskResult.storeFailed();
        }
        return task.map(TaskResult::success).orElseGet(() -> TaskResult.notFound(id));
    }

    public TaskResult<List<Task>> listAll(Integer limit) {
        try {
            return TaskResult.success(taskStore.scan(limit));
        } catch (TaskStoreException e) {
            log.error("Error al obtener tareas", e);
            return TaskResult.storeFailed();
        }
    }

    public TaskResult<List<Task>> listByStatus(String estado, Integer limit) {
        Optional<TaskStatus> status = TaskStatus.parse(estado);
        if (status.isEmpty()) {
            return TaskResult.validationFailed(TaskResult.INVALID_PARAMETER,
                "Estado no válido. Debe ser uno de: " + TaskStatus.allowedValues());
        }
        try {
            return TaskResult.success(taskStore.scanByStatus(status.get(), limit));
        } catch (TaskStoreException e) {
            log.error("Error al filtrar tareas por estado {}", estado, e);
            return TaskResult.storeFailed();
        }
    }
}
