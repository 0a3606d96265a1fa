package com.autonomous.tasks.validation;

import com.autonomous.tasks.model.NewTask;
import com.autonomous.tasks.model.TaskAttributes;
import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.model.TaskStatus;
import com.autonomous.tasks.util.Timestamps;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

@Component
public class CreateTaskValidator {

    static final String TITULO_REQUIRED = "El campo 'titulo' es obligatorio y debe ser una cadena";
    static final String FECHA_IN_PAST = "La fecha no puede ser anterior al momento actual";

    private final Clock clock;

    public CreateTaskValidator(Clock clock) {
        this.clock = clock;
    }

    public TaskResult<NewTask> validate(Object payload) {
        if (!(payload instanceof Map<?, ?> data)) {
            return TaskResult.validationFailed(TaskFieldRules.NOT_AN_OBJECT);
        }

        TaskResult<String> titulo = TaskFieldRules.titulo(data.get(TaskAttributes.TITULO), TITULO_REQUIRED);
        if (!titulo.isSuccess()) {
            return titulo.failure();
        }

        TaskResult<String> descripcion = TaskFieldRules.descripcion(data.get(TaskAttributes.DESCRIPCION));
        if (!descripcion.isSuccess()) {
            return descripcion.failure();
        }

        Object rawFecha = data.get(TaskAttributes.FECHA);
        String fecha;
        if (TaskFieldRules.isEmptyFecha(rawFecha)) {
            fecha = Timestamps.now(clock);
        } else {
            TaskResult<Instant> parsed = TaskFieldRules.fecha(rawFecha);
            if (!parsed.isSuccess()) {
                return parsed.failure();
            }
            if (parsed.getValue().isBefore(Instant.now(clock))) {
                return TaskResult.validationFailed(FECHA_IN_PAST);
            }
            fecha = ((String) rawFecha).strip();
        }

        TaskStatus estado = TaskStatus.PENDIENTE;
        if (data.containsKey(TaskAttributes.ESTADO)) {
            TaskResult<TaskStatus> parsed = TaskFieldRules.estado(data.get(TaskAttributes.ESTADO));
            if (!parsed.isSuccess()) {
                return parsed.failure();
            }
            estado = parsed.getValue();
        }

        return TaskResult.success(NewTask.builder()
            .titulo(titulo.getValue())
            .descripcion(descripcion.getValue())
            .fecha(fecha)
            .estado(estado)
            .build());
    }
}
