package org.iceforge.filedrop.api;

import java.time.Instant;

public final class ApiModels {

    private ApiModels() {}

    public record UploadResponse(String publicKey, String privateKey) {}

    public record DeleteResponse(boolean success, String message) {}

    public record ErrorResponse(String error, String message) {}

    public record LimitExceededResponse(String error, String message, long limit, long used) {}

    public record HealthResponse(String status, Instant timestamp, String provider) {}
}
