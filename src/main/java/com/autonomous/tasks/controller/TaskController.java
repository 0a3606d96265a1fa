package com.autonomous.tasks.controller;

import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.service.TaskService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class TaskController {

    @Autowired
    private TaskService taskService;

    @PostMapping("/tareas")
    public ResponseEntity<Map<String, Object>> createTask(@RequestBody(required = false) String body) {
        TaskResult<Task> result = taskService.create(body);
        if (!result.isSuccess()) {
            return failure(result);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("mensaje", "Tarea creada correctamente");
        response.put("tarea", result.getValue());
        response.put("timestamp", taskService.timestamp());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/tareas")
    public ResponseEntity<Map<String, Object>> listTasks(
            @RequestParam(required = false) String id,
            @RequestParam(required = false) String estado,
            @RequestParam(required = false) String limite) {
        Integer limit = null;
        if (limite != null) {
            limit = parseLimit(limite);
            if (limit == null) {
                return failure(TaskResult.validationFailed(TaskResult.INVALID_PARAMETER,
                    "El parámetro \"limite\" debe ser un número entero positivo"));
            }
        }

        if (StringUtils.hasLength(id)) {
            log.info("Buscando tarea con ID: {}", id);
            return getTask(id);
        }

        TaskResult<List<Task>> result;
        if (StringUtils.hasLength(estado)) {
            log.info("Filtrando tareas por estado: {}", estado);
            result = taskService.listByStatus(estado, limit);
        } else {
            log.info("Listando todas las tareas{}", limit != null ? " (limite: " + limit + ")" : "");
            result = taskService.listAll(limit);
        }
        if (!result.isSuccess()) {
            return failure(result);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tareas", result.getValue());
        response.put("total", result.getValue().size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/tareas/{id}")
    public ResponseEntity<Map<String, Object>> getTask(@PathVariable String id) {
        TaskResult<Task> result = taskService.get(id);
        if (!result.isSuccess()) {
            return failure(result);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tarea", result.getValue());
        return ResponseEntity.ok(response);
    }

    @RequestMapping(value = {"/tareas", "/tareas/{id}"}, method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ResponseEntity<Map<String, Object>> updateTask(
            @PathVariable(required = false) String id,
            @RequestBody(required = false) String body) {
        TaskResult<Task> result = taskService.update(id, body);
        if (!result.isSuccess()) {
            return failure(result);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("mensaje", "Tarea actualizada correctamente");
        response.put("tarea", result.getValue());
        response.put("timestamp", taskService.timestamp());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping({"/tareas", "/tareas/{id}"})
    public ResponseEntity<Map<String, Object>> deleteTask(@PathVariable(required = false) String id) {
        TaskResult<String> result = taskService.delete(id);
        if (!result.isSuccess()) {
            return failure(result);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("mensaje", "Tarea eliminada correctamente");
        response.put("id", result.getValue());
        response.put("timestamp", taskService.timestamp());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    private Integer parseLimit(String limite) {
        try {
            int limit = Integer.parseInt(limite.trim());
            return limit > 0 ? limit : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private ResponseEntity<Map<String, Object>> failure(TaskResult<?> result) {
        HttpStatus status = switch (result.getOutcome()) {
            case VALIDATION_FAILED, MALFORMED_REQUEST -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STORE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case SUCCESS -> throw new IllegalStateException("Successful result passed to failure()");
        };
        if (result.getOutcome() == TaskResult.Outcome.VALIDATION_FAILED) {
            log.warn("Error de validación: {}", result.getMessage());
        }
        return ResponseEntity.status(status).body(ApiExceptionHandler.errorBody(result.getError(), result.getMessage()));
    }
}
