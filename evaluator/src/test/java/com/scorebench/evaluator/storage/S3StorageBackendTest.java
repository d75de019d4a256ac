package com.scorebench.evaluator.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class S3StorageBackendTest {

    @Mock S3Client    s3;
    @Mock S3Presigner presigner;

    S3StorageBackend storage;

    @BeforeEach
    void setUp() {
        storage = new S3StorageBackend(s3, presigner, "scorebench-private");
    }

    @Test
    void objectKey_plainPath_isUnchanged() {
        assertThat(storage.objectKey("competition/7/1/submissions/42/run.txt"))
                .isEqualTo("competition/7/1/submissions/42/run.txt");
    }

    @Test
    void objectKey_fullUrl_dropsEverythingUpToBucket() {
        assertThat(storage.objectKey("https://s3.amazonaws.com/scorebench-private/uploads/42/my+file.zip"))
                .isEqualTo("uploads/42/my file.zip");
    }

    @Test
    void objectKey_leadingSlashes_areStripped() {
        assertThat(storage.objectKey("//uploads/a.zip")).isEqualTo("uploads/a.zip");
    }

    @Test
    void save_putsIntoConfiguredBucket() {
        storage.save("uploads/a.zip", new byte[]{1, 2, 3});

        ArgumentCaptor<PutObjectRequest> req = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(req.capture(), any(RequestBody.class));
        assertThat(req.getValue().bucket()).isEqualTo("scorebench-private");
        assertThat(req.getValue().key()).isEqualTo("uploads/a.zip");
    }

    @Test
    void save_sdkFailure_becomesStorageException() {
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("connection refused"));

        assertThatThrownBy(() -> storage.save("uploads/a.zip", new byte[0]))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("s3://scorebench-private/uploads/a.zip");
    }
}
