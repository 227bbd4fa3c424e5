package se.escrow_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;
import se.escrow_be.exception.BusinessLogicException;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalEvidenceStorageTest {

    @TempDir
    Path uploadDir;

    @Test
    @DisplayName("Files are stored per room and can be deleted by reference")
    void storeAndDelete() {
        LocalEvidenceStorage storage = new LocalEvidenceStorage(uploadDir.toString());

        String reference = storage.store("amber river", "delivery_photo",
                new MockMultipartFile("file", "door.JPG", "image/jpeg", new byte[]{9, 9}));

        assertThat(reference).startsWith("amber_river/delivery_photo-").endsWith(".jpg");
        assertThat(Files.exists(uploadDir.resolve(reference))).isTrue();

        storage.delete(reference);
        assertThat(Files.exists(uploadDir.resolve(reference))).isFalse();
    }

    @Test
    @DisplayName("Empty uploads are rejected")
    void emptyFile() {
        LocalEvidenceStorage storage = new LocalEvidenceStorage(uploadDir.toString());

        assertThatThrownBy(() -> storage.store("room", "delivery_photo",
                new MockMultipartFile("file", "a.png", "image/png", new byte[0])))
                .isInstanceOf(BusinessLogicException.class);
    }

    @Test
    @DisplayName("References that escape the upload directory are refused")
    void pathTraversal() {
        LocalEvidenceStorage storage = new LocalEvidenceStorage(uploadDir.toString());

        assertThatThrownBy(() -> storage.delete("../../etc/passwd")).isInstanceOf(BusinessLogicException.class);
    }
}
