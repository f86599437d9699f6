package quest.gekko.aspath.web.dto;

public record StatisticsDTO(
        long routeCollectorCount,
        long snapshotsCount,
        long autonomousSystems,
        long ixpCount
) {}
