package com.soundledger.web.adapter.driving.http;

import com.soundledger.domain.error.ConfigurationMissingException;
import com.soundledger.domain.error.NotFoundException;
import com.soundledger.domain.error.PersistenceException;
import com.soundledger.web.adapter.driving.http.Response.ErrorResponse;
import jakarta.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.servlet.function.HandlerFilterFunction;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

public final class HttpErrorFilter implements HandlerFilterFunction<ServerResponse, ServerResponse> {

    private static final Logger log = LoggerFactory.getLogger(HttpErrorFilter.class);

    @Nonnull
    public ServerResponse filter(
            @Nonnull ServerRequest request,
            @Nonnull HandlerFunction<ServerResponse> next) {
        try {
            return next.handle(request);
        } catch (IllegalArgumentException e) {
            log.warn("400 Bad Request [{} {}]: {}", request.method(), request.uri(), e.getMessage());
            return ServerResponse
                    .status(HttpStatus.BAD_REQUEST)
                    .body(new ErrorResponse("Invalid request: %s".formatted(e.getMessage())));
        } catch (HttpMessageNotReadableException e) {
            log.warn("400 Unreadable body [{} {}]: {}", request.method(), request.uri(), e.getMessage());
            return ServerResponse
                    .status(HttpStatus.BAD_REQUEST)
                    .body(new ErrorResponse("Invalid request: malformed request body"));
        } catch (NotFoundException e) {
            log.info("404 Not Found [{} {}]: {}", request.method(), request.uri(), e.getMessage());
            return ServerResponse
                    .status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("Invalid resource identifier: %s".formatted(e.getMessage())));
        } catch (ConfigurationMissingException e) {
            log.error("503 Not configured [{} {}]: {}", request.method(), request.uri(), e.getMessage());
            return ServerResponse
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse(e.getMessage()));
        } catch (PersistenceException e) {
            log.error("500 Persistence error [{} {}]", request.method(), request.uri(), e);
            return ServerResponse
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse(e.getMessage()));
        } catch (Exception e) {
            log.error("500 Unexpected error [{} {}]", request.method(), request.uri(), e);
            return ServerResponse
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("Unexpected error"));
        }
    }
}
