package quest.gekko.aspath.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Entity
@Table(name = "route_collectors", uniqueConstraints = @UniqueConstraint(columnNames = "name"))
@Getter @Setter
public class RouteCollector {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    // external key, used in URLs and in grab-<name> schedule entries
    @Column(nullable = false)
    String name;

    @Column(name = "ixp_id")
    Long exchangePointId;

    @Column(name = "created_at", nullable = false)
    LocalDateTime createdAt = LocalDateTime.now(ZoneOffset.UTC);
}
