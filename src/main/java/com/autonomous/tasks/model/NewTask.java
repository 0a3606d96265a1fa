package com.autonomous.tasks.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NewTask {
    String titulo;
    String descripcion;
    String fecha;
    TaskStatus estado;

    public Task toTask(String id, String timestamp) {
        return Task.builder()
            .id(id)
            .titulo(titulo)
            .descripcion(descripcion)
            .fecha(fecha)
            .estado(estado)
            .creadoEn(timestamp)
            .actualizadoEn(timestamp)
            .build();
    }
}
