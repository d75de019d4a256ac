package com.scorebench.evaluator.bundle;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultBundleTest {

    @Test
    void zipArchive_keepsEntryOrderAndContent() {
        byte[] zip = new ResultBundle()
                .add("scores.txt", "accuracy: 0.9\n")
                .add("detail.html", "<p>ok</p>")
                .toZip();

        ResultBundle decoded = ResultBundle.fromZip(zip);

        assertThat(decoded.entries()).extracting(ResultBundle.Entry::name)
                .containsExactly("scores.txt", "detail.html");
        assertThat(decoded.find("scores.txt")).get()
                .extracting(ResultBundle.Entry::text).isEqualTo("accuracy: 0.9\n");
    }

    @Test
    void fromZip_skipsDirectoriesAndMatchesRootNamesOnly() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            zip.putNextEntry(new ZipEntry("nested/"));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("nested/scores.txt"));
            zip.write("accuracy: 1".getBytes());
            zip.closeEntry();
        }

        ResultBundle decoded = ResultBundle.fromZip(buffer.toByteArray());

        assertThat(decoded.entries()).hasSize(1);
        assertThat(decoded.find("scores.txt")).isEmpty();
    }

    @Test
    void fromZip_emptyPlaceholder_isEmptyBundle() {
        assertThat(ResultBundle.fromZip(new byte[0]).entries()).isEmpty();
    }

    @Test
    void fromZip_truncatedArchive_isRejected() {
        byte[] zip = new ResultBundle().add("scores.txt", "accuracy: 0.9\n".repeat(50)).toZip();
        byte[] truncated = java.util.Arrays.copyOf(zip, 40);

        assertThatThrownBy(() -> ResultBundle.fromZip(truncated))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
