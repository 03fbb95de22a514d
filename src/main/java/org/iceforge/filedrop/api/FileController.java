package org.iceforge.filedrop.api;

import jakarta.servlet.http.HttpServletRequest;
import org.iceforge.filedrop.store.ObjectNotFoundException;
import org.iceforge.filedrop.store.ObjectStore;
import org.iceforge.filedrop.store.StoreModels;
import org.iceforge.filedrop.traffic.TrafficLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.InvalidMimeTypeException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;

/**
 * HTTP surface: upload, download by public key, delete by private key. Traffic limits are
 * checked before each transfer and the transferred bytes recorded after it.
 */
@RestController
public class FileController {
    private static final Logger log = LoggerFactory.getLogger(FileController.class);

    private final ObjectStore store;
    private final TrafficLedger ledger;
    private final Clock clock;

    public FileController(ObjectStore store, TrafficLedger ledger, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.ledger = Objects.requireNonNull(ledger);
        this.clock = Objects.requireNonNull(clock);
    }

    @PostMapping("/files")
    public ResponseEntity<?> upload(@RequestParam(name = "file", required = false) MultipartFile file,
                                    HttpServletRequest request) throws IOException {
        String origin = origin(request);
        TrafficLedger.Admission admission = ledger.checkUploadAdmission(origin);
        if (!admission.allowed()) {
            throw new TrafficLimitExceededException(TrafficLimitExceededException.Direction.UPLOAD,
                    admission.limit(), admission.used());
        }
        if (file == null) {
            return ResponseEntity.badRequest().body(new ApiModels.ErrorResponse("No file provided",
                    "Please provide a file in the request body with the field name \"file\""));
        }

        byte[] content = file.getBytes();
        StoreModels.KeyPair keys = store.put(content, file.getOriginalFilename(), file.getContentType());
        ledger.recordUpload(origin, content.length);
        log.debug("Upload of {} bytes from {}", content.length, origin);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ApiModels.UploadResponse(keys.publicKey(), keys.privateKey()));
    }

    @GetMapping("/files/{publicKey}")
    public ResponseEntity<byte[]> download(@PathVariable String publicKey, HttpServletRequest request) {
        String origin = origin(request);
        TrafficLedger.Admission admission = ledger.checkDownloadAdmission(origin);
        if (!admission.allowed()) {
            throw new TrafficLimitExceededException(TrafficLimitExceededException.Direction.DOWNLOAD,
                    admission.limit(), admission.used());
        }

        StoreModels.StoredObject object = store.get(publicKey);
        byte[] content = object.content();
        ledger.recordDownload(origin, content.length);

        return ResponseEntity.ok()
                .contentType(mediaType(object.contentType()))
                .contentLength(content.length)
                .header(HttpHeaders.CONTENT_DISPOSITION, contentDisposition(object.originalName()))
                .body(content);
    }

    @DeleteMapping("/files/{privateKey}")
    public ApiModels.DeleteResponse delete(@PathVariable String privateKey) {
        if (!store.delete(privateKey)) {
            throw new ObjectNotFoundException(privateKey);
        }
        return new ApiModels.DeleteResponse(true, "File deleted successfully");
    }

    @GetMapping("/usage")
    public TrafficLedger.Usage usage(HttpServletRequest request) {
        return ledger.currentUsage(origin(request));
    }

    @GetMapping("/health")
    public ApiModels.HealthResponse health() {
        return new ApiModels.HealthResponse("ok", clock.instant(), store.describe());
    }

    private static String origin(HttpServletRequest request) {
        String addr = request.getRemoteAddr();
        return addr == null || addr.isBlank() ? "unknown" : addr;
    }

    private static MediaType mediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMimeTypeException e) {
            log.debug("Stored content type '{}' is not valid, serving as octet-stream", contentType);
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static String contentDisposition(String originalName) {
        String name = originalName == null || originalName.isBlank() ? "download" : originalName;
        ContentDisposition.Builder b = ContentDisposition.attachment();
        boolean ascii = StandardCharsets.US_ASCII.newEncoder().canEncode(name);
        return (ascii ? b.filename(name) : b.filename(name, StandardCharsets.UTF_8)).build().toString();
    }
}
