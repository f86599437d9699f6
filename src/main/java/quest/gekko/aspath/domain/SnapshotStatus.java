package quest.gekko.aspath.domain;

public enum SnapshotStatus {
    PENDING, PARSED, FAILED
}
