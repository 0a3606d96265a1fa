package com.autonomous.tasks.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "titulo", "descripcion", "fecha", "estado", "creado_en", "actualizado_en"})
public class Task {
    private String id;
    private String titulo;
    private String descripcion;
    private String fecha;
    private TaskStatus estado;

    @JsonProperty("creado_en")
    private String creadoEn;

    @JsonProperty("actualizado_en")
    private String actualizadoEn;

    @Builder.Default
    private Map<String, Object> otherAttributes = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getOtherAttributes() {
        return otherAttributes;
    }

    @JsonAnySetter
    public void putOtherAttribute(String name, Object value) {
        otherAttributes.put(name, value);
    }

    public Task copy() {
        return toBuilder()
            .otherAttributes(new LinkedHashMap<>(otherAttributes))
            .build();
    }
}
