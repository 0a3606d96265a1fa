package com.autonomous.tasks.validation;

import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.model.TaskStatus;
import com.autonomous.tasks.util.Timestamps;

import java.time.Instant;

final class TaskFieldRules {

    static final int MAX_TITULO_LENGTH = 100;
    static final int MAX_DESCRIPCION_LENGTH = 500;

    static final String NOT_AN_OBJECT = "Los datos deben ser un objeto JSON válido";
    static final String TITULO_TOO_LONG = "El campo 'titulo' no puede superar los 100 caracteres";
    static final String DESCRIPCION_NOT_TEXT = "El campo 'descripcion' debe ser una cadena";
    static final String DESCRIPCION_TOO_LONG = "El campo 'descripcion' no puede superar los 500 caracteres";
    static final String FECHA_NOT_ISO = "El campo 'fecha' debe tener formato ISO 8601 (YYYY-MM-DDTHH:MM:SS)";

    private TaskFieldRules() {}

    static TaskResult<String> titulo(Object raw, String missingMessage) {
        if (!(raw instanceof String text) || text.isBlank()) {
            return TaskResult.validationFailed(missingMessage);
        }
        String trimmed = text.strip();
        if (characters(trimmed) > MAX_TITULO_LENGTH) {
            return TaskResult.validationFailed(TITULO_TOO_LONG);
        }
        return TaskResult.success(trimmed);
    }

    static TaskResult<String> descripcion(Object raw) {
        if (raw == null) { // cleared
            return TaskResult.success("");
        }
        if (!(raw instanceof String text)) {
            return TaskResult.validationFailed(DESCRIPCION_NOT_TEXT);
        }
        String trimmed = text.strip();
        if (characters(trimmed) > MAX_DESCRIPCION_LENGTH) {
            return TaskResult.validationFailed(DESCRIPCION_TOO_LONG);
        }
        return TaskResult.success(trimmed);
    }

    static boolean isEmptyFecha(Object raw) {
        return raw == null || (raw instanceof String text && text.isEmpty());
    }

    static TaskResult<Instant> fecha(Object raw) {
        if (!(raw instanceof String text)) {
            return TaskResult.validationFailed(FECHA_NOT_ISO);
        }
        return Timestamps.parse(text.strip())
            .map(TaskResult::success)
            .orElseGet(() -> TaskResult.validationFailed(FECHA_NOT_ISO));
    }

    // code points, so a character outside the BMP counts once
    private static int characters(String text) {
        return text.codePointCount(0, text.length());
    }

    static TaskResult<TaskStatus> estado(Object raw) {
        return TaskStatus.parse(raw)
            .map(TaskResult::success)
            .orElseGet(() -> TaskResult.validationFailed(
                "El campo 'estado' debe ser uno de: " + TaskStatus.allowedValues()));
    }
}
