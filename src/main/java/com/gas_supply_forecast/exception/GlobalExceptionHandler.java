package com.gas_supply_forecast.exception;

import com.gas_supply_forecast.dto.response.GenericResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GenericResponse<Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        log.warn("⚠️ Validation failed: {}", ex.getMessage());

        String errorMessage = ex.getBindingResult()
                .getAllErrors()
                .stream()
                .map(DefaultMessageSourceResolvable::getDefaultMessage)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("Invalid input");

        return ResponseEntity
                .badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(GenericResponse.failure("VALIDATION_ERROR", errorMessage));
    }

    // query/path parameters
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<GenericResponse<?>> handleConstraintViolation(ConstraintViolationException ex) {
        String errorMessage = ex.getConstraintViolations()
                .stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining(", "));

        return new ResponseEntity<>(GenericResponse.failure("CONSTRAINT_VIOLATION", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GenericResponse<?>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(GenericResponse.failure("MALFORMED_JSON", "Request body is invalid or malformed"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<GenericResponse<?>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName();
        return new ResponseEntity<>(GenericResponse.failure("BAD_REQUEST", message), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DatasetFormatException.class)
    public ResponseEntity<GenericResponse<?>> handleDatasetFormat(DatasetFormatException ex) {
        log.error("❌ Dataset contract violation: {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("INPUT_CONTRACT_VIOLATION", ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<GenericResponse<?>> handleInsufficientData(InsufficientDataException ex) {
        log.warn("⚠️ {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("INSUFFICIENT_DATA", ex.getMessage()), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(MissingForecastInputException.class)
    public ResponseEntity<GenericResponse<?>> handleMissingForecastInput(MissingForecastInputException ex) {
        log.warn("⚠️ {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("MISSING_FORECAST_INPUT", ex.getMessage()), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(ModelNotAvailableException.class)
    public ResponseEntity<GenericResponse<?>> handleModelNotAvailable(ModelNotAvailableException ex) {
        log.warn("⚠️ {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("MODEL_NOT_AVAILABLE", ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({UnsupportedAlgorithmException.class, InvalidDateRangeException.class, BadRequestException.class})
    public ResponseEntity<GenericResponse<?>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.badRequest().body(GenericResponse.failure("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(WeatherApiException.class)
    public ResponseEntity<GenericResponse<?>> handleWeatherApi(WeatherApiException ex) {
        log.error("❌ Weather service failure: {}", ex.getMessage());
        return new ResponseEntity<>(GenericResponse.failure("WEATHER_API_ERROR", ex.getMessage()), HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(FileProcessingException.class)
    public ResponseEntity<GenericResponse<?>> handleFileProcessingException(FileProcessingException ex) {
        log.error("❌ File processing error: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure("FILE_ERROR", "File processing error"), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GenericResponse<?>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure("INTERNAL_SERVER_ERROR", "Something went wrong. Please try again later."),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
