package se.escrow_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import se.escrow_be.exception.BusinessLogicException;
import se.escrow_be.exception.EscrowStateException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores evidence on the local file system under {@code escrow.evidence.upload-dir}, one
 * directory per room.
 */
@Service
@Slf4j
public class LocalEvidenceStorage implements EvidenceStorage {

    private final Path root;

    public LocalEvidenceStorage(@Value("${escrow.evidence.upload-dir:uploads}") String uploadDir) {
        this.root = Paths.get(uploadDir).toAbsolutePath().normalize();
    }

    @Override
    public String store(String roomPhrase, String evidenceType, MultipartFile file) {
        validateFile(file);
        String reference = safeSegment(roomPhrase) + "/" + safeSegment(evidenceType) + "-"
                + UUID.randomUUID() + extensionOf(file.getOriginalFilename());
        Path target = resolve(reference);
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new EscrowStateException("Failed to store evidence for room '" + roomPhrase + "'", e);
        }
        log.info("Stored {} evidence for room '{}' at {}", evidenceType, roomPhrase, reference);
        return reference;
    }

    @Override
    public void delete(String payloadReference) {
        try {
            Files.deleteIfExists(resolve(payloadReference));
        } catch (IOException e) {
            log.error("Failed to delete evidence {}: {}", payloadReference, e.getMessage(), e);
        }
    }

    private Path resolve(String reference) {
        Path path = root.resolve(reference).normalize();
        if (!path.startsWith(root)) {
            throw new BusinessLogicException("Invalid evidence reference");
        }
        return path;
    }

    private void validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BusinessLogicException("Evidence file is empty");
        }
    }

    private static String safeSegment(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]+", "_");
    }

    private static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return extension.matches("[a-z0-9]{1,10}") ? "." + extension : "";
    }
}
