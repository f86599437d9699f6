package quest.gekko.aspath.service.core;

/**
 * Base for lookups of a collector or snapshot that does not exist.
 * The message is safe to show to clients.
 */
public abstract class NotFoundException extends RuntimeException {
    protected NotFoundException(String message) {
        super(message);
    }
}
