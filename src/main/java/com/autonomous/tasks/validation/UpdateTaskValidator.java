package com.autonomous.tasks.validation;

import com.autonomous.tasks.model.TaskAttributes;
import com.autonomous.tasks.model.TaskChanges;
import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.model.TaskStatus;
import com.autonomous.tasks.util.Timestamps;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@Component
public class UpdateTaskValidator {

    static final String NO_UPDATABLE_FIELDS = "Debe proporcionar al menos un campo válido para actualizar";
    static final String TITULO_EMPTY = "El campo 'titulo' debe ser una cadena no vacía";

    private final Clock clock;

    public UpdateTaskValidator(Clock clock) {
        this.clock = clock;
    }

    public TaskResult<TaskChanges> validate(Object payload) {
        if (!(payload instanceof Map<?, ?> data)) {
            return TaskResult.validationFailed(TaskFieldRules.NOT_AN_OBJECT);
        }
        if (TaskAttributes.MUTABLE.stream().noneMatch(data::containsKey)) {
            return TaskResult.validationFailed(NO_UPDATABLE_FIELDS);
        }

        TaskChanges.TaskChangesBuilder changes = TaskChanges.builder();

        if (data.containsKey(TaskAttributes.TITULO)) {
            TaskResult<String> titulo = TaskFieldRules.titulo(data.get(TaskAttributes.TITULO), TITULO_EMPTY);
            if (!titulo.isSuccess()) {
                return titulo.failure();
            }
            changes.titulo(titulo.getValue());
        }

        if (data.containsKey(TaskAttributes.DESCRIPCION)) {
            TaskResult<String> descripcion = TaskFieldRules.descripcion(data.get(TaskAttributes.DESCRIPCION));
            if (!descripcion.isSuccess()) {
                return descripcion.failure();
            }
            changes.descripcion(descripcion.getValue());
        }

        if (data.containsKey(TaskAttributes.FECHA)) {
            Object rawFecha = data.get(TaskAttributes.FECHA);
            if (TaskFieldRules.isEmptyFecha(rawFecha)) {
                changes.fecha(Timestamps.now(clock));
            } else {
                TaskResult<Instant> parsed = TaskFieldRules.fecha(rawFecha);
                if (!parsed.isSuccess()) {
                    return parsed.failure();
                }
                changes.fecha(((String) rawFecha).strip());
            }
        }

        if (data.containsKey(TaskAttributes.ESTADO)) {
            TaskResult<TaskStatus> estado = TaskFieldRules.estado(data.get(TaskAttributes.ESTADO));
            if (!estado.isSuccess()) {
                return estado.failure();
            }
            changes.estado(estado.getValue());
        }

        return TaskResult.success(changes.build());
    }
}
