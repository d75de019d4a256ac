package com.scorebench.evaluator.storage;

import java.time.Duration;

/**
 * The private object store holding submission bundles and run artifacts.
 *
 * Paths are backend-relative keys such as
 * "submissions/12/1/alice/3/run.txt". Implementations throw
 * {@link StorageException} on every failure.
 */
public interface StorageBackend {

    /** Store bytes under path, replacing any previous content. Returns the stored path. */
    String save(String path, byte[] content);

    byte[] read(String path);

    /**
     * Produce a URL that grants {@code permission} on {@code path} for
     * {@code duration}, usable without any credentials of this service.
     */
    String sign(String path, AccessPermission permission, Duration duration);
}
