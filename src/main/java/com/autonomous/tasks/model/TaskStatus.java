package com.autonomous.tasks.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

public enum TaskStatus {
    PENDIENTE,
    EN_PROGRESO,
    COMPLETADA,
    CANCELADA;

    public static Optional<TaskStatus> parse(Object value) {
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(status -> status.name().equals(text))
            .findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));
    }
}
