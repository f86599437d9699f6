package quest.gekko.aspath.web.dto;

import quest.gekko.aspath.domain.RoutingSnapshot;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

public record SnapshotRoutesDTO(Metadata metadata, List<RouteDTO> routes) {

    public record Metadata(OffsetDateTime createdAt, Long snapshotId) {}

    public static SnapshotRoutesDTO of(RoutingSnapshot snapshot, List<RouteDTO> routes) {
        return new SnapshotRoutesDTO(
                new Metadata(snapshot.getCreatedAt().atOffset(ZoneOffset.UTC), snapshot.getId()),
                routes);
    }
}
