package com.scorebench.evaluator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Turns internal storage paths into time-limited URLs for compute workers.
 *
 * Never throws: a blank path or a path the backend cannot sign yields "",
 * which callers treat as "not available". Required references (program,
 * results) are checked by the caller before anything is dispatched.
 */
@Component
public class SignedUrlService {

    private static final Logger log = LoggerFactory.getLogger(SignedUrlService.class);

    private final StorageBackend backend;
    private final Duration       defaultTtl;

    public SignedUrlService(StorageBackend backend,
                            @Value("${scorebench.storage.signed-url-ttl:PT24H}") Duration defaultTtl) {
        this.backend    = backend;
        this.defaultTtl = defaultTtl;
    }

    public String sign(String path, AccessPermission permission) {
        return sign(path, permission, defaultTtl);
    }

    public String sign(String path, AccessPermission permission, Duration duration) {
        if (path == null || path.isBlank()) {
            return "";
        }
        try {
            return backend.sign(path, permission, duration);
        } catch (StorageException e) {
            log.warn("Could not sign {} for {}: {}", path, permission, e.getMessage());
            return "";
        }
    }

    /** Read access, default lifetime. */
    public String read(String path) {
        return sign(path, AccessPermission.READ);
    }

    /** Write access, default lifetime. */
    public String write(String path) {
        return sign(path, AccessPermission.WRITE);
    }
}
