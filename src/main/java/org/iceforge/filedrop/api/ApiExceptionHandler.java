package org.iceforge.filedrop.api;

import org.iceforge.filedrop.store.InvalidKeyException;
import org.iceforge.filedrop.store.ObjectNotFoundException;
import org.iceforge.filedrop.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

/**
 * Maps store and limit failures to status codes and JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ObjectNotFoundException.class)
    public ResponseEntity<ApiModels.ErrorResponse> notFound(ObjectNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiModels.ErrorResponse("File not found", "The requested file does not exist"));
    }

    @ExceptionHandler(InvalidKeyException.class)
    public ResponseEntity<ApiModels.ErrorResponse> invalidKey(InvalidKeyException e) {
        return ResponseEntity.badRequest()
                .body(new ApiModels.ErrorResponse("Invalid key", e.getMessage()));
    }

    @ExceptionHandler(TrafficLimitExceededException.class)
    public ResponseEntity<ApiModels.LimitExceededResponse> limitExceeded(TrafficLimitExceededException e) {
        String error = e.direction() == TrafficLimitExceededException.Direction.UPLOAD
                ? "Upload limit exceeded"
                : "Download limit exceeded";
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ApiModels.LimitExceededResponse(error, e.getMessage(), e.limit(), e.used()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiModels.ErrorResponse> tooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ApiModels.ErrorResponse("File too large", e.getMessage()));
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ApiModels.ErrorResponse> badMultipart(MultipartException e) {
        return ResponseEntity.badRequest()
                .body(new ApiModels.ErrorResponse("No file provided", e.getMessage()));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiModels.ErrorResponse> storeFailure(StoreException e) {
        log.error("Storage operation failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiModels.ErrorResponse("Storage failure", e.getMessage()));
    }
}
