package com.autonomous.tasks.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TaskResult<T> {

    public enum Outcome {
        SUCCESS,
        VALIDATION_FAILED,
        NOT_FOUND,
        MALFORMED_REQUEST,
        STORE_FAILED
    }

    public static final String INVALID_DATA = "Datos inválidos";
    public static final String INVALID_PARAMETER = "Parámetro inválido";
    public static final String INTERNAL_ERROR = "Error interno del servidor";
    public static final String INTERNAL_ERROR_MESSAGE = "Ha ocurrido un error al procesar la solicitud";

    private final Outcome outcome;
    private final T value;
    private final String error;
    private final String message;

    public static <T> TaskResult<T> success(T value) {
        return new TaskResult<>(Outcome.SUCCESS, value, null, null);
    }

    public static <T> TaskResult<T> validationFailed(String message) {
        return validationFailed(INVALID_DATA, message);
    }

    public static <T> TaskResult<T> validationFailed(String error, String message) {
        return new TaskResult<>(Outcome.VALIDATION_FAILED, null, error, message);
    }

    public static <T> TaskResult<T> notFound(String id) {
        return new TaskResult<>(Outcome.NOT_FOUND, null, "Tarea no encontrada",
            "No existe una tarea con el ID: " + id);
    }

    public static <T> TaskResult<T> malformed(String error, String message) {
        return new TaskResult<>(Outcome.MALFORMED_REQUEST, null, error, message);
    }

    public static <T> TaskResult<T> storeFailed() {
        return new TaskResult<>(Outcome.STORE_FAILED, null, INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public <U> TaskResult<U> failure() {
        if (isSuccess()) {
            throw new IllegalStateException("Not a failed result");
        }
        return new TaskResult<>(outcome, null, error, message);
    }
}
