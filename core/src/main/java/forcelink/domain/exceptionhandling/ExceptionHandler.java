package forcelink.domain.exceptionhandling;

/**
 * Turns an exception into the message shown to a user.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
