package com.scorebench.evaluator.api;

import com.scorebench.evaluator.storage.AccessPermission;
import com.scorebench.evaluator.storage.LocalStorageBackend;
import com.scorebench.evaluator.storage.StorageException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Serves the signed URLs of the local storage backend to compute workers.
 *
 * GET /files/{path}?method=GET&expires=...&signature=...   download
 * PUT /files/{path}?method=PUT&expires=...&signature=...   upload (request body = content)
 */
@RestController
@RequestMapping("/files")
@ConditionalOnProperty(name = "scorebench.storage.backend", havingValue = "local")
public class SignedFileController {

    private static final Logger log = LoggerFactory.getLogger(SignedFileController.class);

    private final LocalStorageBackend storage;

    public SignedFileController(LocalStorageBackend storage) {
        this.storage = storage;
    }

    @GetMapping("/**")
    public ResponseEntity<byte[]> download(HttpServletRequest request,
                                           @RequestParam long expires,
                                           @RequestParam String signature) {
        String path = storagePath(request);
        authorize(path, AccessPermission.READ, expires, signature);
        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .body(storage.read(path));
        } catch (StorageException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PutMapping("/**")
    public ResponseEntity<Void> upload(HttpServletRequest request,
                                       @RequestParam long expires,
                                       @RequestParam String signature,
                                       @RequestBody(required = false) byte[] content) {
        String path = storagePath(request);
        authorize(path, AccessPermission.WRITE, expires, signature);
        storage.save(path, content == null ? new byte[0] : content);
        return ResponseEntity.ok().build();
    }

    private void authorize(String path, AccessPermission permission, long expires, String signature) {
        if (!storage.verify(path, permission.httpMethod(), expires, signature)) {
            log.warn("Rejected {} of {}: bad or expired signature", permission.httpMethod(), path);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid or expired signature");
        }
    }

    // Path below /files/, decoded segment by segment.
    private static String storagePath(HttpServletRequest request) {
        String uri = request.getRequestURI().substring(request.getContextPath().length());
        String encoded = uri.substring("/files/".length());
        StringBuilder sb = new StringBuilder();
        for (String segment : encoded.split("/")) {
            if (segment.isEmpty()) continue;
            if (sb.length() > 0) sb.append('/');
            sb.append(URLDecoder.decode(segment, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
