package app.jira.catalogue;

/**
 * Raised when the operation catalogue is malformed. Registry construction fails as a whole.
 */
public class CatalogueException extends RuntimeException {

    public CatalogueException(String message) {
        super(message);
    }

    public CatalogueException(String message, Throwable cause) {
        super(message, cause);
    }
}
