package quest.gekko.aspath.web.dto;

import quest.gekko.aspath.domain.RouteCollector;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public record RouteCollectorDTO(Long id, String name, Long ixpId, OffsetDateTime createdAt) {

    public static RouteCollectorDTO of(RouteCollector collector) {
        return new RouteCollectorDTO(
                collector.getId(),
                collector.getName(),
                collector.getExchangePointId(),
                collector.getCreatedAt() == null ? null : collector.getCreatedAt().atOffset(ZoneOffset.UTC));
    }
}
