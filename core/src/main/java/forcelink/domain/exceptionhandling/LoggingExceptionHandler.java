package forcelink.domain.exceptionhandling;

import forcelink.domain.exceptions.ExternalException;
import forcelink.domain.exceptions.RequestFailed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "fl.exceptions.printstacktrace", defaultValue = "false")
    private String printStackTrace;

    @Override
    public String getExceptionMessage(final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        if (Boolean.parseBoolean(printStackTrace) || e instanceof ExternalException) {
            return ExceptionUtils.getStackTrace(e) + getResponseBody(e);
        }

        if (StringUtils.isBlank(e.getMessage())) {
            return e.toString();
        }

        return e.getMessage();
    }

    private String getResponseBody(final Throwable e) {
        if (e instanceof RequestFailed && StringUtils.isNotBlank(((RequestFailed) e).getBody())) {
            return System.lineSeparator() + "Response body: " + ((RequestFailed) e).getBody();
        }

        return "";
    }
}
