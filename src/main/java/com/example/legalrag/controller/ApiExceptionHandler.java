package com.example.legalrag.controller;

import com.example.legalrag.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.common.util.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@Slf4j
@RestControllerAdvice
class ApiExceptionHandler {

    private static final int MAX_DETAIL_LENGTH = 200;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ErrorResponse(String error, List<String> details) {
        ErrorResponse(String error) {
            this(error, List.of());
        }
    }

    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ErrorResponse> validation(ValidationException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + ": " + f.getDefaultMessage())
            .toList();
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", details));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class})
    ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", List.of(e.getMessage())));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ErrorResponse> notFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("Not found"));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Internal error", List.of(causeSummary(e))));
    }

    /** First line of the failure message, capped, so provider bodies and stack details stay out of the response. */
    static String causeSummary(Throwable e) {
        String message = e.getMessage();
        if (StringUtils.isBlank(message)) return e.getClass().getSimpleName();
        return StringUtils.truncate(message.strip().lines().findFirst().orElse(""), MAX_DETAIL_LENGTH);
    }
}
