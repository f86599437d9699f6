package quest.gekko.aspath.service.ingestion;

import java.util.List;

/**
 * A prefix and the AS path a collector saw for it, origin last.
 */
public record AnnouncedRoute(String block, List<Long> path) {

    public AnnouncedRoute {
        path = List.copyOf(path);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("AS path of " + block + " is empty");
        }
    }

    public Long origin() {
        return path.get(path.size() - 1);
    }
}
