package forcelink.domain.logger;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;
import org.jspecify.annotations.Nullable;

import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

@ApplicationScoped
public class Loggers {

    @Nullable
    private FileHandler fileHandler;

    @PostConstruct
    private void init() {
        System.setProperty("java.util.logging.SimpleFormatter.format", "%4$s: %5$s %n");
        final SimpleFormatter formatter = new SimpleFormatter();
        this.fileHandler = Try.of(() -> new FileHandler("ForceLink.log", true))
                .onSuccess(handler -> handler.setFormatter(formatter))
                .getOrNull();
    }

    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Logger logger = Logger.getLogger(
                injectionPoint.getMember().getDeclaringClass().getName());

        // Loggers are shared per name, so only attach the handler once.
        if (fileHandler != null && !hasHandler(logger, fileHandler)) {
            logger.addHandler(fileHandler);
        }

        return logger;
    }

    private boolean hasHandler(final Logger logger, final FileHandler handler) {
        for (final var existing : logger.getHandlers()) {
            if (existing == handler) {
                return true;
            }
        }
        return false;
    }
}
