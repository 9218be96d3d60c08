package projectphoton.domain.exception;

/**
 * Geometría del apilamiento o rejillas de cálculo inválidas (espesores no positivos,
 * rejillas vacías, dimensiones inconsistentes...).
 */
public class InvalidGeometryException extends RuntimeException {

    public InvalidGeometryException(String message) {
        super(message);
    }

    public InvalidGeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
