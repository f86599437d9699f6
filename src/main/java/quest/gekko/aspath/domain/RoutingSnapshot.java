package quest.gekko.aspath.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One timestamped capture of a route collector's table.
 * <p>
 * {@code createdAt} is stored as UTC wall time and doubles as the partition key
 * copied onto every {@link RouteRow} of the snapshot.
 */
@Entity
@Table(name = "routing_snapshots", indexes = @Index(name = "idx_snapshots_collector", columnList = "route_collector_id, created_at"))
@Getter @Setter
public class RoutingSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "route_collector_id", nullable = false)
    Long routeCollectorId;

    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 16)
    SnapshotStatus status = SnapshotStatus.PENDING;

    @Column(name = "route_count")
    Long routeCount;

    @Column(name = "error_message", length = 1024)
    String errorMessage;
}
