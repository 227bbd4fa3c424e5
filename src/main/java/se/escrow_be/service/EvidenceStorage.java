package se.escrow_be.service;

import org.springframework.web.multipart.MultipartFile;

/**
 * Where uploaded dispute evidence lives. The returned reference is what the room records.
 */
public interface EvidenceStorage {

    String store(String roomPhrase, String evidenceType, MultipartFile file);

    void delete(String payloadReference);
}
