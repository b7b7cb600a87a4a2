package com.architecture.dotspace.web;

import com.architecture.dotspace.dto.ErrorResponse;
import com.architecture.dotspace.exception.DanglingReferenceException;
import com.architecture.dotspace.exception.DiagramSyntaxException;
import com.architecture.dotspace.exception.UnknownFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_FAILED")
                .message("Input validation failed")
                .details(Map.of("fields", fields))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorResponse error = ErrorResponse.builder()
                .code("MALFORMED_REQUEST")
                .message("Request body is missing or not valid JSON")
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(UnknownFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnknownFormat(UnknownFormatException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(syntaxError("UNKNOWN_FORMAT", ex));
    }

    @ExceptionHandler(DiagramSyntaxException.class)
    public ResponseEntity<ErrorResponse> handleSyntaxError(DiagramSyntaxException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(syntaxError("SYNTAX_ERROR", ex));
    }

    @ExceptionHandler(DanglingReferenceException.class)
    public ResponseEntity<ErrorResponse> handleDanglingReference(DanglingReferenceException ex) {
        log.error("Internal consistency failure", ex);
        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_CONSISTENCY")
                .message(ex.getMessage())
                .details(Map.of("nodeKey", ex.getNodeKey()))
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);

        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_SERVER_ERROR")
                .message("An unexpected error occurred")
                .details(Map.of("error", String.valueOf(ex.getMessage())))
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ErrorResponse syntaxError(String code, DiagramSyntaxException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", ex.getReason());
        details.put("line", ex.getLine());
        details.put("column", ex.getColumn());
        return ErrorResponse.builder()
                .code(code)
                .message(ex.getMessage())
                .details(details)
                .build();
    }
}
