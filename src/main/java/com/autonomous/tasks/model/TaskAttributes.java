package com.autonomous.tasks.model;

import java.math.BigDecimal;
import java.util.Set;

public final class TaskAttributes {

    public static final String ID = "id";
    public static final String TITULO = "titulo";
    public static final String DESCRIPCION = "descripcion";
    public static final String FECHA = "fecha";
    public static final String ESTADO = "estado";
    public static final String CREADO_EN = "creado_en";
    public static final String ACTUALIZADO_EN = "actualizado_en";

    public static final Set<String> MUTABLE = Set.of(TITULO, DESCRIPCION, FECHA, ESTADO);

    public static final Set<String> KNOWN = Set.of(ID, TITULO, DESCRIPCION, FECHA, ESTADO, CREADO_EN, ACTUALIZADO_EN);

    private TaskAttributes() {}

    public static Number normalizeNumber(BigDecimal value) {
        if (value.signum() == 0 || value.stripTrailingZeros().scale() <= 0) {
            try {
                return value.longValueExact();
            } catch (ArithmeticException tooLarge) {
                return value.toBigIntegerExact();
            }
        }
        return value.doubleValue();
    }
}
