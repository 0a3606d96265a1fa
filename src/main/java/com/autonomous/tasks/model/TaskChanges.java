package com.autonomous.tasks.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class TaskChanges {
    String titulo;
    String descripcion;
    String fecha;
    TaskStatus estado;

    public boolean isEmpty() {
        return titulo == null && descripcion == null && fecha == null && estado == null;
    }

    public Map<String, String> toAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (titulo != null) attributes.put(TaskAttributes.TITULO, titulo);
        if (descripcion != null) attributes.put(TaskAttributes.DESCRIPCION, descripcion);
        if (fecha != null) attributes.put(TaskAttributes.FECHA, fecha);
        if (estado != null) attributes.put(TaskAttributes.ESTADO, estado.name());
        return attributes;
    }

    public Task applyTo(Task current, String updatedAt) {
        Task.TaskBuilder merged = current.copy().toBuilder();
        if (titulo != null) merged.titulo(titulo);
        if (descripcion != null) merged.descripcion(descripcion);
        if (fecha != null) merged.fecha(fecha);
        if (estado != null) merged.estado(estado);
        return merged.actualizadoEn(updatedAt).build();
    }
}
