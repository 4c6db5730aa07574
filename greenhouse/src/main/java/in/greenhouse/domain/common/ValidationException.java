package in.greenhouse.domain.common;

/**
 * Thrown when caller input is rejected at a boundary. Nothing is mutated when this is thrown.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(String.format("[%s] %s", field, message));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
