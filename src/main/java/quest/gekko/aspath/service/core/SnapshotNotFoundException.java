package quest.gekko.aspath.service.core;

import lombok.Getter;

@Getter
public class SnapshotNotFoundException extends NotFoundException {
    private final String collectorName;
    private final Long snapshotId;

    public SnapshotNotFoundException(String collectorName, Long snapshotId) {
        super("Routing snapshot not found");
        this.collectorName = collectorName;
        this.snapshotId = snapshotId;
    }
}
