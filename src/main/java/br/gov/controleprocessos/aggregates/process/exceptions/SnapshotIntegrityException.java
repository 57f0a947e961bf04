package br.gov.controleprocessos.aggregates.process.exceptions;

/**
 * Thrown when a stored department snapshot cannot be read back: checksum mismatch or a
 * payload that no longer deserializes.
 */
public class SnapshotIntegrityException extends RuntimeException {

    public SnapshotIntegrityException(String message) {
        super(message);
    }

    public SnapshotIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
