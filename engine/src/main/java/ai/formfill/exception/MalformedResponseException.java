package ai.formfill.exception;

/** A classification response that could not be understood. The response is dropped; engine state is unchanged. */
public class MalformedResponseException extends Exception {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
