package quest.gekko.aspath.service.ingestion;

public class RoutingTableFormatException extends RuntimeException {
    public RoutingTableFormatException(String message) {
        super(message);
    }
}
