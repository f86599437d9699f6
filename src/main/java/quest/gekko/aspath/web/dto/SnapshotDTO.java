package quest.gekko.aspath.web.dto;

import quest.gekko.aspath.domain.RoutingSnapshot;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public record SnapshotDTO(Long id, OffsetDateTime createdAt) {

    public static SnapshotDTO of(RoutingSnapshot snapshot) {
        return new SnapshotDTO(snapshot.getId(), snapshot.getCreatedAt().atOffset(ZoneOffset.UTC));
    }
}
