package quest.gekko.aspath.web.dto;

import java.util.List;

/**
 * One announced prefix with its AS path, origin AS and the origin's name
 * (null when the AS is unknown).
 */
public record RouteDTO(
        String block,
        List<Long> path,
        Long origin,
        String asName
) {}
