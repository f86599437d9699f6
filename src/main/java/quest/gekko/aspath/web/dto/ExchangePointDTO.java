package quest.gekko.aspath.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import quest.gekko.aspath.domain.ExchangePoint;

import java.time.LocalDate;

/**
 * Exchange point with its collector count and, when any of its collectors has
 * a snapshot, where the most recent one came from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExchangePointDTO(
        Long id,
        String name,
        String fullName,
        String country,
        String city,
        String website,
        int routeCollectors,

        // absent when no collector of this exchange point has a snapshot yet
        LocalDate lastSnapshotDate,
        Long lastSnapshotId,
        String lastSnapshotCollectorName
) {

    public static ExchangePointDTO withoutSnapshot(ExchangePoint ixp, int routeCollectors) {
        return new ExchangePointDTO(ixp.getId(), ixp.getName(), ixp.getFullName(), ixp.getCountry(),
                ixp.getCity(), ixp.getWebsite(), routeCollectors, null, null, null);
    }

    public static ExchangePointDTO withSnapshot(ExchangePoint ixp, int routeCollectors,
                                                LocalDate lastSnapshotDate, Long lastSnapshotId,
                                                String lastSnapshotCollectorName) {
        return new ExchangePointDTO(ixp.getId(), ixp.getName(), ixp.getFullName(), ixp.getCountry(),
                ixp.getCity(), ixp.getWebsite(), routeCollectors,
                lastSnapshotDate, lastSnapshotId, lastSnapshotCollectorName);
    }
}
