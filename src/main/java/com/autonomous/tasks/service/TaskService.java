package com.autonomous.tasks.service;

import com.autonomous.tasks.model.NewTask;
import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskChanges;
import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.query.TaskQueryService;
import com.autonomous.tasks.store.TaskStore;
import com.autonomous.tasks.store.TaskStoreException;
import com.autonomous.tasks.util.TaskIds;
import com.autonomous.tasks.util.Timestamps;
import com.autonomous.tasks.validation.CreateTaskValidator;
import com.autonomous.tasks.validation.UpdateTaskValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class TaskService {

    static final String ID_MISSING = "El ID de la tarea es obligatorio";
    static final String ID_NOT_UUID = "El ID proporcionado no tiene formato UUID válido";

    private final CreateTaskValidator createValidator;
    private final UpdateTaskValidator updateValidator;
    private final TaskStore taskStore;
    private final TaskQueryService queries;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TaskService(CreateTaskValidator createValidator,
                       UpdateTaskValidator updateValidator,
                       TaskStore taskStore,
                       TaskQueryService queries,
                       ObjectMapper objectMapper,
                       Clock clock) {
        this.createValidator = createValidator;
        this.updateValidator = updateValidator;
        this.taskStore = taskStore;
        this.queries = queries;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TaskResult<Task> create(String body) {
        TaskResult<Object> payload = parseBody(body, TaskResult.INVALID_DATA,
            "El cuerpo de la petición no es un JSON válido");
        if (!payload.isSuccess()) {
            return payload.failure();
        }

        TaskResult<NewTask> validated = createValidator.validate(payload.getValue());
        if (!validated.isSuccess()) {
            return validated.failure();
        }

        Task task = validated.getValue().toTask(TaskIds.newId(), Timestamps.now(clock));
        try {
            Task stored = taskStore.insert(task);
            log.info("Tarea creada correctamente (ID: {})", stored.getId());
            return TaskResult.success(stored);
        } catch (TaskStoreException e) {
            log.error("Error al insertar tarea", e);
            return TaskResult.storeFailed();
        }
    }

    public TaskResult<Task> get(String id) {
        TaskResult<String> checked = checkId(id);
        if (!checked.isSuccess()) {
            return checked.failure();
        }
        return queries.getById(id);
    }

    public TaskResult<List<Task>> listAll(Integer limit) {
        return queries.listAll(limit);
    }

    public TaskResult<List<Task>> listByStatus(String estado, Integer limit) {
        return queries.listByStatus(estado, limit);
    }

    /**
     * The task must exist before the body is looked at, so an unknown id is reported as
     * not found even when the body is also invalid.
     */
    public TaskResult<Task> update(String id, String body) {
        TaskResult<Task> existing = get(id);
        if (!existing.isSuccess()) {
            return existing;
        }

        TaskResult<Object> payload = parseBody(body, "Formato inválido",
            "El cuerpo de la petición debe ser JSON válido");
        if (!payload.isSuccess()) {
            return payload.failure();
        }

        TaskResult<TaskChanges> validated = updateValidator.validate(payload.getValue());
        if (!validated.isSuccess()) {
            return validated.failure();
        }

        try {
            Optional<Task> updated = taskStore.mergeUpdate(id, validated.getValue(), Timestamps.now(clock));
            if (updated.isEmpty()) {
                return TaskResult.notFound(id);
            }
            log.info("Tarea actualizada correctamente (ID: {})", id);
            return TaskResult.success(updated.get());
        } catch (TaskStoreException e) {
            log.error("Error al actualizar tarea {}", id, e);
            return TaskResult.storeFailed();
        }
    }

    public TaskResult<String> delete(String id) {
        TaskResult<Task> existing = get(id);
        if (!existing.isSuccess()) {
            return existing.failure();
        }
        try {
            taskStore.deleteById(id);
            log.info("Tarea eliminada correctamente (ID: {})", id);
            return TaskResult.success(id);
        } catch (TaskStoreException e) {
            log.error("Error al eliminar tarea {}", id, e);
            return TaskResult.storeFailed();
        }
    }

    public String timestamp() {
        return Timestamps.now(clock);
    }

    private TaskResult<String> checkId(String id) {
        if (id == null || id.isEmpty()) {
            return TaskResult.malformed("Parámetro faltante", ID_MISSING);
        }
        if (!TaskIds.isValid(id)) {
            return TaskResult.malformed(TaskResult.INVALID_PARAMETER, ID_NOT_UUID);
        }
        return TaskResult.success(id);
    }

    private TaskResult<Object> parseBody(String body, String error, String message) {
        if (body == null || body.isBlank()) {
            return TaskResult.malformed(error, message);
        }
        try {
            return TaskResult.success(objectMapper.readValue(body, Object.class));
        } catch (JsonProcessingException e) {
            log.debug("Cuerpo no JSON: {}", e.getOriginalMessage());
            return TaskResult.malformed(error, message);
        }
    }
}
