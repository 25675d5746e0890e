/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.infrastructure.web;

import ch.admin.bj.swiyu.broker.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.broker.common.exception.*;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.springframework.http.HttpStatus.*;

@RestControllerAdvice
@Slf4j
public class DefaultExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler({ResourceNotFoundException.class, OrphanedVerificationException.class})
    public ResponseEntity<ApiErrorDto> handleResourceNotFoundException(final RuntimeException exception) {
        log.debug("Resource not found", exception);
        return toResponse(NOT_FOUND, exception.getMessage());
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiErrorDto> handleBadRequestException(final BadRequestException exception) {
        log.debug("Bad Request intercepted", exception);
        return toResponse(BAD_REQUEST, exception.getMessage());
    }

    @ExceptionHandler(MissingSimulationContextException.class)
    public ResponseEntity<ApiErrorDto> handleMissingSimulationContextException(final MissingSimulationContextException exception) {
        log.debug("Request without valid simulation token: {}", exception.getMessage());
        return toResponse(UNAUTHORIZED, exception.getMessage());
    }

    @ExceptionHandler(ResourceGoneException.class)
    public ResponseEntity<ApiErrorDto> handleResourceGoneException(final ResourceGoneException exception) {
        log.debug("Resource gone: {}", exception.getMessage());
        return toResponse(GONE, exception.getMessage());
    }

    @ExceptionHandler(SandboxApiException.class)
    public ResponseEntity<ApiErrorDto> handleSandboxApiException(final SandboxApiException exception) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(BAD_GATEWAY.getReasonPhrase())
                .errorDetails(exception.getMessage())
                .upstreamError(exception.getResponseBody())
                .status(BAD_GATEWAY)
                .build();
        log.error("Sandbox call failed with status {}", exception.getStatusCode(), exception);
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @ExceptionHandler({UpstreamContractException.class, RevocationUpstreamException.class})
    public ResponseEntity<ApiErrorDto> handleUpstreamException(final RuntimeException exception) {
        var upstreamError = exception.getCause() instanceof SandboxApiException sandboxApiException
                ? sandboxApiException.getResponseBody()
                : null;
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(BAD_GATEWAY.getReasonPhrase())
                .errorDetails(exception.getMessage())
                .upstreamError(upstreamError)
                .status(BAD_GATEWAY)
                .build();
        log.error("Upstream Exception intercepted", exception);
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @ExceptionHandler(RevocationInconsistencyException.class)
    public ResponseEntity<ApiErrorDto> handleRevocationInconsistencyException(final RevocationInconsistencyException exception) {
        log.error("Revocation left local and remote state inconsistent, revoked on sandbox: {}",
                exception.getRevokedCredentialIds(), exception);
        return toResponse(INTERNAL_SERVER_ERROR,
                exception.getMessage() + ". Revoked on the wallet sandbox: " + exception.getRevokedCredentialIds());
    }

    @ExceptionHandler
    public ResponseEntity<ApiErrorDto> handle(final Exception exception) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(INTERNAL_SERVER_ERROR.getReasonPhrase())
                .status(INTERNAL_SERVER_ERROR)
                .build();

        log.error("Unknown Exception occurred", exception);
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(@NonNull MethodArgumentNotValidException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {

        String errors = Stream.concat(
                        ex.getBindingResult().getFieldErrors()
                                .stream().map(error -> String.format("%s: %s", error.getField(), error.getDefaultMessage())),
                        ex.getBindingResult().getGlobalErrors().stream().map(error -> String.format("%s: %s", error.getObjectName(), error.getDefaultMessage()))
                ).sorted()
                .collect(Collectors.joining(", "));

        return handleInvalidRequest(errors);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(@NonNull HttpMessageNotReadableException ex,
                                                                  @NonNull HttpHeaders headers,
                                                                  @NonNull HttpStatusCode status,
                                                                  @NonNull WebRequest request) {
        return handleInvalidRequest("Request body is missing or malformed");
    }

    @Override
    protected ResponseEntity<Object> handleTypeMismatch(@NonNull TypeMismatchException ex,
                                                        @NonNull HttpHeaders headers,
                                                        @NonNull HttpStatusCode status,
                                                        @NonNull WebRequest request) {
        return handleInvalidRequest(String.format("%s has an invalid value", ex.getPropertyName()));
    }

    private ResponseEntity<Object> handleInvalidRequest(String errors) {
        log.info("Received bad request. Details: {}", errors);

        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(BAD_REQUEST.getReasonPhrase())
                .errorDetails(errors)
                .status(BAD_REQUEST)
                .build();

        return new ResponseEntity<>(apiError, HttpStatus.BAD_REQUEST);
    }

    private static ResponseEntity<ApiErrorDto> toResponse(HttpStatus status, String details) {
        final ApiErrorDto apiError = ApiErrorDto.builder()
                .errorDescription(status.getReasonPhrase())
                .errorDetails(details)
                .status(status)
                .build();
        return new ResponseEntity<>(apiError, apiError.getStatus());
    }
}
