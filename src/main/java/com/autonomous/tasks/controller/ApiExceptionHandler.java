package com.autonomous.tasks.controller;

import com.autonomous.tasks.model.TaskResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse && errorResponse.getStatusCode().is4xxClientError()) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("HTTP_ERROR path={}, method={}, status={}, errorType={}",
                request.getRequestURI(), request.getMethod(), status.value(), ex.getClass().getSimpleName());
            return ResponseEntity.status(status).body(errorBody("Solicitud inválida", ex.getMessage()));
        }
        log.error("Error inesperado path={}, method={}, errorType={}",
            request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex);
        return ResponseEntity.internalServerError()
            .body(errorBody(TaskResult.INTERNAL_ERROR, TaskResult.INTERNAL_ERROR_MESSAGE));
    }

    static Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("mensaje", message);
        return body;
    }
}
