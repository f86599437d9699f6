package quest.gekko.aspath.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

@Entity
@Table(name = "ip_routes", indexes = @Index(name = "idx_routes_partition", columnList = "created_at, snapshot_id"))
@Getter @Setter
public class RouteRow {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false, length = 64)
    String block;

    @Convert(converter = AsPathConverter.class)
    @Column(nullable = false, length = 2048)
    List<Long> path;

    // last element of path, kept as a column so the AS name join stays portable
    @Column(name = "origin_as")
    Long originAs;

    @Column(name = "snapshot_id", nullable = false)
    Long snapshotId;

    // same value as the owning snapshot's created_at
    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt;
}
