package safecode.generation;

/**
 * Unchecked exception thrown by {@link CodeGenerationService} when the
 * generator call fails. Retrying is up to the caller.
 */
public class CodeGenerationException extends RuntimeException {

    public CodeGenerationException(String msg) {
        super(msg);
    }

    public CodeGenerationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
