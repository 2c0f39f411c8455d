package com.recbench.evaluation.controller;

import com.recbench.evaluation.exception.ServiceUnavailableException;
import com.recbench.evaluation.exception.TaskNotFoundException;
import com.recbench.evaluation.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class EvaluationExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(EvaluationExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return new ResponseEntity<>(new ErrorResponse("validation_failed", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(new ErrorResponse("malformed_request", "request body could not be read"),
                HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleTaskNotFound(TaskNotFoundException ex) {
        return new ResponseEntity<>(new ErrorResponse("task_not_found", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.warn("service_id={} event=service_unavailable reason=\"{}\"", ex.getServiceId(), ex.getMessage());
        return new ResponseEntity<>(new ErrorResponse("service_unavailable", ex.getMessage()),
                HttpStatus.SERVICE_UNAVAILABLE);
    }
}
