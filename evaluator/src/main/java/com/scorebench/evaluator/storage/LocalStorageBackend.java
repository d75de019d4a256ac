package com.scorebench.evaluator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * Filesystem storage for single-host deployments and development.
 *
 * Signed URLs point at SignedFileController:
 *   {base-url}/files/{path}?method=GET&expires=1718000000&signature=...
 * The signature is an HMAC-SHA256 over method, path and expiry, so the URL
 * can only be used for the one object, verb and time window it was made for.
 */
public class LocalStorageBackend implements StorageBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalStorageBackend.class);
    private static final String HMAC = "HmacSHA256";

    private final Path   root;
    private final String baseUrl;
    private final byte[] signingKey;
    private final Clock  clock;

    public LocalStorageBackend(Path root, String baseUrl, String signingKey, Clock clock) {
        if (signingKey == null || signingKey.isBlank()) {
            throw new IllegalArgumentException("scorebench.storage.local.signing-key must not be blank");
        }
        this.root       = root.toAbsolutePath().normalize();
        this.baseUrl    = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
        this.clock      = clock;
    }

    @Override
    public String save(String path, byte[] content) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
            return path;
        } catch (IOException e) {
            throw new StorageException("save failed for " + path, e);
        }
    }

    @Override
    public byte[] read(String path) {
        Path target = resolve(path);
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException e) {
            throw new StorageException("no such object: " + path, e);
        } catch (IOException e) {
            throw new StorageException("read failed for " + path, e);
        }
    }

    @Override
    public String sign(String path, AccessPermission permission, Duration duration) {
        Path target = resolve(path);
        if (permission == AccessPermission.READ && !Files.isRegularFile(target)) {
            throw new StorageException("no such object: " + path);
        }
        long expires = clock.instant().plus(duration).getEpochSecond();
        String method = permission.httpMethod();
        return baseUrl + "/files/" + encodePath(path)
                + "?method=" + method
                + "&expires=" + expires
                + "&signature=" + signature(method, path, expires);
    }

    /**
     * Check a signed request made by a worker.
     *
     * @return true if the signature matches and has not expired
     */
    public boolean verify(String path, String method, long expires, String signature) {
        if (signature == null || clock.instant().getEpochSecond() > expires) {
            return false;
        }
        byte[] expected = signature(method, path, expires).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }

    /** Map a storage path to a file under root; rejects paths that escape it. */
    Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new StorageException("blank storage path");
        }
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new StorageException("path escapes storage root: " + path);
        }
        return target;
    }

    private String signature(String method, String path, long expires) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(signingKey, HMAC));
            byte[] digest = mac.doFinal((method + "\n" + path + "\n" + expires).getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            log.error("HMAC unavailable", e);
            throw new StorageException("cannot sign " + path, e);
        }
    }

    private static String encodePath(String path) {
        StringBuilder sb = new StringBuilder();
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) continue;
            if (sb.length() > 0) sb.append('/');
            sb.append(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }
}
