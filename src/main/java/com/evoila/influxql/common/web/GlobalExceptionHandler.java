package com.evoila.influxql.common.web;

import com.evoila.influxql.common.model.GlobalErrorResponse;
import com.evoila.influxql.compiler.exception.QueryCompilationException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.webflux.error.ErrorWebExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.MethodNotAllowedException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.UnsupportedMediaTypeStatusException;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

@Slf4j
@Configuration
@Order(-2) // Higher priority than DefaultErrorWebExceptionHandler
@RequiredArgsConstructor
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

  private final JsonMapper jsonMapper;

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    logRequestDetails(exchange, ex);

    ErrorInfo errorInfo = determineErrorResponse(exchange, ex);

    log.debug(
        "Returning error response: {} {} - {}",
        errorInfo.status().value(),
        errorInfo.status().getReasonPhrase(),
        errorInfo.message());

    return writeErrorResponse(exchange, errorInfo);
  }

  /** Logs request and exception information */
  private void logRequestDetails(ServerWebExchange exchange, Throwable ex) {
    String path = exchange.getRequest().getPath().value();
    String method = exchange.getRequest().getMethod().name();

    if (ex instanceof QueryCompilationException || ex instanceof IllegalArgumentException) {
      log.warn("Rejected request {} {}: {}", method, path, ex.getMessage());
    } else {
      log.error("Request {} {} failed with {}", method, path, ex.getClass().getSimpleName(), ex);
    }
  }

  /** Determines the appropriate error response based on exception type */
  private ErrorInfo determineErrorResponse(ServerWebExchange exchange, Throwable ex) {
    if (ex instanceof QueryCompilationException e) {
      return handleQueryCompilationException(e);
    }
    if (ex instanceof MethodNotAllowedException e) {
      return handleMethodNotAllowedException(exchange, e);
    }
    if (ex instanceof UnsupportedMediaTypeStatusException e) {
      return handleUnsupportedMediaTypeException(e);
    }
    if (ex instanceof JacksonException e) {
      return handleJacksonException(e);
    }
    if (ex instanceof IllegalArgumentException e) {
      return handleIllegalArgumentException(e);
    }
    if (ex instanceof ResponseStatusException e) {
      return handleResponseStatusException(e);
    }
    return handleGenericException(ex);
  }

  /** Handles rejected query requests */
  private ErrorInfo handleQueryCompilationException(QueryCompilationException ex) {
    return new ErrorInfo(
        HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getError().code(), ex.getError().details());
  }

  /** Handles method not allowed exceptions */
  private ErrorInfo handleMethodNotAllowedException(
      ServerWebExchange exchange, MethodNotAllowedException ex) {
    log.warn(
        "Method not allowed: {} for {}",
        ex.getHttpMethod(),
        exchange.getRequest().getPath().value());
    return new ErrorInfo(
        HttpStatus.METHOD_NOT_ALLOWED,
        "Method " + ex.getHttpMethod() + " not allowed",
        "METHOD_NOT_ALLOWED");
  }

  /** Handles unsupported media type exceptions */
  private ErrorInfo handleUnsupportedMediaTypeException(UnsupportedMediaTypeStatusException ex) {
    log.warn("Unsupported media type: {}", ex.getMessage());
    return new ErrorInfo(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type", "UNSUPPORTED_MEDIA_TYPE");
  }

  /** Handles Jackson exceptions (JSON processing errors) */
  private ErrorInfo handleJacksonException(JacksonException ex) {
    log.warn("JSON processing error: {}", ex.getMessage());
    return new ErrorInfo(HttpStatus.BAD_REQUEST, "Invalid JSON format", "INVALID_JSON");
  }

  /** Handles illegal argument exceptions */
  private ErrorInfo handleIllegalArgumentException(IllegalArgumentException ex) {
    return new ErrorInfo(
        HttpStatus.BAD_REQUEST, "Invalid request parameters: " + ex.getMessage(), "INVALID_PARAMS");
  }

  /** Handles response status exceptions, including undecodable request bodies */
  private ErrorInfo handleResponseStatusException(ResponseStatusException ex) {
    String message = ex.getReason() != null ? ex.getReason() : "Request failed";
    log.warn("Response status exception: {} - {}", ex.getStatusCode(), message);
    return new ErrorInfo(
        HttpStatus.valueOf(ex.getStatusCode().value()), message, "RESPONSE_STATUS_ERROR");
  }

  private ErrorInfo handleGenericException(Throwable ex) {
    log.error("Unhandled internal server error: {}", ex.getMessage());
    return new ErrorInfo(
        HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "INTERNAL_ERROR");
  }

  /** Internal record for passing error info between methods */
  private record ErrorInfo(
      HttpStatus status, String message, String errorCode, List<String> details) {

    ErrorInfo(HttpStatus status, String message, String errorCode) {
      this(status, message, errorCode, List.of());
    }
  }

  private Mono<Void> writeErrorResponse(ServerWebExchange exchange, ErrorInfo errorInfo) {
    HttpStatus status = errorInfo.status();
    String errorCode = errorInfo.errorCode();
    exchange.getResponse().setStatusCode(status);
    exchange.getResponse().getHeaders().add("Content-Type", MediaType.APPLICATION_JSON_VALUE);

    String path = exchange.getRequest().getPath().value();
    GlobalErrorResponse errorResponse =
        new GlobalErrorResponse(
            status.getReasonPhrase(),
            errorInfo.message(),
            status.value(),
            errorCode,
            errorInfo.details(),
            Instant.now().toString(),
            path);

    String errorJson;
    try {
      errorJson = jsonMapper.writeValueAsString(errorResponse);
    } catch (JacksonException e) {
      log.error("Failed to serialize error response", e);
      errorJson =
          String.format(
              "{\"error\":\"%s\",\"errorCode\":\"%s\",\"status\":%d}",
              status.getReasonPhrase(), errorCode, status.value());
    }

    DataBuffer buffer =
        exchange.getResponse().bufferFactory().wrap(errorJson.getBytes(StandardCharsets.UTF_8));
    return exchange.getResponse().writeWith(Mono.just(buffer));
  }
}
