package quest.gekko.aspath.service.ingestion;

import java.io.IOException;
import java.util.List;

/**
 * Where a collector's current routing table is grabbed from.
 */
public interface RoutingTableSource {
    List<AnnouncedRoute> fetch(String collectorName) throws IOException;
}
