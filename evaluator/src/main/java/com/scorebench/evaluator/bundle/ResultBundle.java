package com.scorebench.evaluator.bundle;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * An ordered list of named byte blobs, shipped between this service and the
 * compute workers as a zip archive.
 *
 * Workers write their scoring output this way (scores.txt plus anything else),
 * and the coopetition statistics travel to the scoring program in the same format.
 * All archive handling goes through this class.
 */
public final class ResultBundle {

    public record Entry(String name, byte[] content) {
        public String text() {
            return new String(content, StandardCharsets.UTF_8);
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public ResultBundle add(String name, byte[] content) {
        entries.add(new Entry(name, content));
        return this;
    }

    public ResultBundle add(String name, String text) {
        return add(name, text.getBytes(StandardCharsets.UTF_8));
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** First entry with exactly this name (root-level, no directory prefix). */
    public Optional<Entry> find(String name) {
        return entries.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public byte[] toZip() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (Entry entry : entries) {
                zip.putNextEntry(new ZipEntry(entry.name()));
                zip.write(entry.content());
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result bundle", e);
        }
        return buffer.toByteArray();
    }

    /**
     * Decode a zip archive. Directory entries are skipped. Input that is not a
     * zip at all (including an empty placeholder) decodes to an empty bundle.
     *
     * @throws IllegalArgumentException if the archive is truncated or corrupt
     */
    public static ResultBundle fromZip(byte[] archive) {
        ResultBundle bundle = new ResultBundle();
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    bundle.add(entry.getName(), zip.readAllBytes());
                }
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable result archive", e);
        }
        return bundle;
    }
}
