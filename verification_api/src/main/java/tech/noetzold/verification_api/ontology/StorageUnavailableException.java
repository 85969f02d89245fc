package tech.noetzold.verification_api.ontology;

/**
 * The backing ontology store could not be reached or answered with an error.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
