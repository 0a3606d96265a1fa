package com.autonomous.tasks.validation;

import com.autonomous.tasks.model.NewTask;
import com.autonomous.tasks.model.TaskResult;
import com.autonomous.tasks.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CreateTaskValidatorTest {

    private CreateTaskValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CreateTaskValidator(Clock.fixed(Instant.parse("2026-10-19T10:00:00.250Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldApplyDefaults() {
        TaskResult<NewTask> result = validator.validate(Map.of("titulo", "Buy milk"));

        assertTrue(result.isSuccess());
        NewTask task = result.getValue();
        assertEquals("Buy milk", task.getTitulo());
        assertEquals("", task.getDescripcion());
        assertEquals("2026-10-19T10:00:00Z", task.getFecha());
        assertEquals(TaskStatus.PENDIENTE, task.getEstado());
    }

    @Test
    void shouldTrimTextFields() {
        TaskResult<NewTask> result = validator.validate(Map.of(
            "titulo", "  Buy milk ",
            "descripcion", "\tsemi-skimmed  ",
            "fecha", " 2026-11-01T08:00:00 "));

        assertEquals("Buy milk", result.getValue().getTitulo());
        assertEquals("semi-skimmed", result.getValue().getDescripcion());
        assertEquals("2026-11-01T08:00:00", result.getValue().getFecha());
    }

    @Test
    void shouldRejectNonObjectPayload() {
        TaskResult<NewTask> result = validator.validate(List.of("titulo"));

        assertEquals(TaskResult.Outcome.VALIDATION_FAILED, result.getOutcome());
        assertEquals("Los datos deben ser un objeto JSON válido", result.getMessage());
    }

    @Test
    void shouldRequireTitulo() {
        assertEquals(CreateTaskValidator.TITULO_REQUIRED, validator.validate(Map.of()).getMessage());
        assertEquals(CreateTaskValidator.TITULO_REQUIRED, validator.validate(Map.of("titulo", "   ")).getMessage());
        assertEquals(CreateTaskValidator.TITULO_REQUIRED, validator.validate(Map.of("titulo", 42)).getMessage());
    }

    @Test
    void shouldMeasureTituloAfterTrimming() {
        assertTrue(validator.validate(Map.of("titulo", " " + "a".repeat(100) + " ")).isSuccess());
        assertEquals(TaskFieldRules.TITULO_TOO_LONG, validator.validate(Map.of("titulo", "a".repeat(101))).getMessage());
    }

    @Test
    void shouldTrimUnicodeWhitespace() {
        assertEquals(CreateTaskValidator.TITULO_REQUIRED, validator.validate(Map.of("titulo", "\u3000")).getMessage());

        TaskResult<NewTask> result = validator.validate(Map.of(
            "titulo", "\u2003Buy milk\u2003",
            "descripcion", "\u3000semi-skimmed\u2003"));

        assertEquals("Buy milk", result.getValue().getTitulo());
        assertEquals("semi-skimmed", result.getValue().getDescripcion());
    }

    @Test
    void shouldCountCharactersNotCodeUnits() {
        String emoji = "\uD83D\uDED2";

        assertTrue(validator.validate(Map.of("titulo", emoji.repeat(100))).isSuccess());
        assertEquals(TaskFieldRules.TITULO_TOO_LONG, validator.validate(Map.of("titulo", emoji.repeat(101))).getMessage());
        assertTrue(validator.validate(Map.of("titulo", "t", "descripcion", emoji.repeat(500))).isSuccess());
        assertEquals(TaskFieldRules.DESCRIPCION_TOO_LONG,
            validator.validate(Map.of("titulo", "t", "descripcion", emoji.repeat(501))).getMessage());
    }

    @Test
    void shouldNormalizeNullDescripcion() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("titulo", "Buy milk");
        payload.put("descripcion", null);

        assertEquals("", validator.validate(payload).getValue().getDescripcion());
    }

    @Test
    void shouldValidateDescripcion() {
        assertEquals(TaskFieldRules.DESCRIPCION_NOT_TEXT,
            validator.validate(Map.of("titulo", "t", "descripcion", 5)).getMessage());
        assertEquals(TaskFieldRules.DESCRIPCION_TOO_LONG,
            validator.validate(Map.of("titulo", "t", "descripcion", "d".repeat(501))).getMessage());
        assertTrue(validator.validate(Map.of("titulo", "t", "descripcion", "d".repeat(500))).isSuccess());
    }

    @Test
    void shouldRejectUnparseableFecha() {
        assertEquals(TaskFieldRules.FECHA_NOT_ISO,
            validator.validate(Map.of("titulo", "t", "fecha", "tomorrow")).getMessage());
        assertEquals(TaskFieldRules.FECHA_NOT_ISO,
            validator.validate(Map.of("titulo", "t", "fecha", 20261019)).getMessage());
    }

    @Test
    void shouldRejectFechaInThePast() {
        TaskResult<NewTask> result = validator.validate(Map.of("titulo", "t", "fecha", "2026-10-19T09:59:59Z"));

        assertEquals(TaskResult.Outcome.VALIDATION_FAILED, result.getOutcome());
        assertEquals(CreateTaskValidator.FECHA_IN_PAST, result.getMessage());
    }

    @Test
    void shouldAcceptFutureFechaAsSupplied() {
        TaskResult<NewTask> result = validator.validate(Map.of("titulo", "t", "fecha", "2026-10-20T09:00:00+02:00"));

        assertEquals("2026-10-20T09:00:00+02:00", result.getValue().getFecha());
    }

    @Test
    void shouldDefaultEmptyFechaToNow() {
        assertEquals("2026-10-19T10:00:00Z",
            validator.validate(Map.of("titulo", "t", "fecha", "")).getValue().getFecha());
    }

    @Test
    void shouldRejectBlankFecha() {
        assertEquals(TaskFieldRules.FECHA_NOT_ISO,
            validator.validate(Map.of("titulo", "t", "fecha", "   ")).getMessage());
    }

    @Test
    void shouldValidateEstado() {
        assertEquals(TaskStatus.EN_PROGRESO,
            validator.validate(Map.of("titulo", "t", "estado", "EN_PROGRESO")).getValue().getEstado());

        TaskResult<NewTask> invalid = validator.validate(Map.of("titulo", "t", "estado", "DONE"));
        assertEquals("El campo 'estado' debe ser uno de: PENDIENTE, EN_PROGRESO, COMPLETADA, CANCELADA",
            invalid.getMessage());

        Map<String, Object> nullEstado = new HashMap<>();
        nullEstado.put("titulo", "t");
        nullEstado.put("estado", null);
        assertFalse(validator.validate(nullEstado).isSuccess());
    }

    @Test
    void shouldReportFirstViolationInFieldOrder() {
        Map<String, Object> payload = Map.of(
            "titulo", "a".repeat(101),
            "descripcion", 5,
            "fecha", "nope",
            "estado", "DONE");
        assertEquals(TaskFieldRules.TITULO_TOO_LONG, validator.validate(payload).getMessage());

        payload = Map.of("titulo", "ok", "descripcion", 5, "fecha", "nope", "estado", "DONE");
        assertEquals(TaskFieldRules.DESCRIPCION_NOT_TEXT, validator.validate(payload).getMessage());

        payload = Map.of("titulo", "ok", "fecha", "nope", "estado", "DONE");
        assertEquals(TaskFieldRules.FECHA_NOT_ISO, validator.validate(payload).getMessage());
    }
}
