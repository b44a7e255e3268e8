package uk.gegc.intellicode.features.assignment.infra.storage;

import uk.gegc.intellicode.shared.exception.StorageException;

import java.io.InputStream;

/**
 * Object storage for uploaded submission files.
 */
public interface AssignmentFileStorage {

    /**
     * Stores the content under the given key.
     *
     * @throws StorageException if the object could not be written
     */
    StoredObject store(String key, InputStream content, long size, String contentType);

    /**
     * Deletes the object. Deleting a missing key is not an error.
     *
     * @throws StorageException if the storage backend rejected the delete
     */
    void delete(String key);
}
