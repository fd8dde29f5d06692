package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.exception.DocumentNotFoundException;
import com.nevis.pdfscan.exception.UploadProcessingException;
import com.nevis.pdfscan.exception.UploadValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UploadValidationException.class)
    public ResponseEntity<ErrorResponse> handleUploadValidation(UploadValidationException ex) {
        HttpStatus status = "FILE_TOO_LARGE".equals(ex.getCode())
            ? HttpStatus.PAYLOAD_TOO_LARGE
            : HttpStatus.BAD_REQUEST;
        return error(ex.getMessage(), ex.getCode(), status);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        return error("File exceeds the maximum allowed upload size", "FILE_TOO_LARGE", HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(UploadProcessingException.class)
    public ResponseEntity<ErrorResponse> handleUploadProcessing(UploadProcessingException ex) {
        return error(ex.getMessage(), "PROCESSING_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DocumentNotFoundException ex) {
        return error(ex.getMessage(), "NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(message, "INVALID_PARAMETER", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        return error(message, "INVALID_PARAMETER", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex) {
        String message = ex.getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request parameters");
        return error(message, "INVALID_PARAMETER", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled error", ex);
        return error("An unexpected error occurred", "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String code, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, code, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(body, status);
    }
}
