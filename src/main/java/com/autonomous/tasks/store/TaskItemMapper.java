package com.autonomous.tasks.store;

import com.autonomous.tasks.model.Task;
import com.autonomous.tasks.model.TaskAttributes;
import com.autonomous.tasks.model.TaskStatus;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class TaskItemMapper {

    private TaskItemMapper() {}

    static Map<String, AttributeValue> key(String id) {
        return Map.of(TaskAttributes.ID, string(id));
    }

    static AttributeValue string(String value) {
        return AttributeValue.builder().s(value).build();
    }

    static Map<String, AttributeValue> toItem(Task task) {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put(TaskAttributes.ID, string(task.getId()));
        item.put(TaskAttributes.TITULO, string(task.getTitulo()));
        item.put(TaskAttributes.DESCRIPCION, string(task.getDescripcion()));
        item.put(TaskAttributes.FECHA, string(task.getFecha()));
        item.put(TaskAttributes.ESTADO, string(task.getEstado().name()));
        item.put(TaskAttributes.CREADO_EN, string(task.getCreadoEn()));
        item.put(TaskAttributes.ACTUALIZADO_EN, string(task.getActualizadoEn()));
        return item;
    }

    static Task fromItem(Map<String, AttributeValue> item) {
        String id = text(item, TaskAttributes.ID);
        String estado = text(item, TaskAttributes.ESTADO);
        TaskStatus status = TaskStatus.parse(estado)
            .orElseThrow(() -> new TaskStoreException("La tarea " + id + " tiene un estado no válido: " + estado));

        Task task = Task.builder()
            .id(id)
            .titulo(text(item, TaskAttributes.TITULO))
            .descripcion(text(item, TaskAttributes.DESCRIPCION))
            .fecha(text(item, TaskAttributes.FECHA))
            .estado(status)
            .creadoEn(text(item, TaskAttributes.CREADO_EN))
            .actualizadoEn(text(item, TaskAttributes.ACTUALIZADO_EN))
            .build();

        item.forEach((name, value) -> {
            if (!TaskAttributes.KNOWN.contains(name)) {
                task.putOtherAttribute(name, toJava(value));
            }
        });
        return task;
    }

    private static String text(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        return value == null ? null : value.s();
    }

    static Object toJava(AttributeValue value) {
        return switch (value.type()) {
            case S -> value.s();
            case N -> TaskAttributes.normalizeNumber(new BigDecimal(value.n()));
            case BOOL -> value.bool();
            case NUL -> null;
            case B -> value.b().asByteArray();
            case SS -> new ArrayList<>(value.ss());
            case NS -> value.ns().stream()
                .map(n -> TaskAttributes.normalizeNumber(new BigDecimal(n)))
                .toList();
            case BS -> value.bs().stream()
                .map(bytes -> bytes.asByteArray())
                .toList();
            case L -> {
                List<Object> list = new ArrayList<>();
                value.l().forEach(element -> list.add(toJava(element)));
                yield list;
            }
            case M -> {
                Map<String, Object> map = new LinkedHashMap<>();
                value.m().forEach((name, element) -> map.put(name, toJava(element)));
                yield map;
            }
            default -> throw new TaskStoreException("Tipo de atributo no soportado: " + value.type());
        };
    }
}
