package quest.gekko.aspath.service.core;

import lombok.Getter;

@Getter
public class CollectorNotFoundException extends NotFoundException {
    private final String collectorName;

    public CollectorNotFoundException(String collectorName) {
        super("Route Collector not found");
        this.collectorName = collectorName;
    }
}
