package quest.gekko.aspath.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.aspath.config.AspathProperties;
import quest.gekko.aspath.util.RouteLineParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code <dump-dir>/<collector>.txt}, one route per line, as written by
 * the collector's table export.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DumpFileRoutingTableSource implements RoutingTableSource {

    private final AspathProperties.Ingestion properties;

    @Override
    public List<AnnouncedRoute> fetch(String collectorName) throws IOException {
        if (collectorName.contains("/") || collectorName.contains("\\") || collectorName.contains("..")) {
            throw new IllegalArgumentException("Illegal collector name for a dump file: " + collectorName);
        }
        Path dump = properties.dumpDir().resolve(collectorName + ".txt");
        log.info("Reading routing table dump {}", dump);

        List<AnnouncedRoute> routes = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(dump, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                try {
                    RouteLineParser.parse(line).ifPresent(routes::add);
                } catch (IllegalArgumentException e) {
                    throw new RoutingTableFormatException(dump + ":" + lineNo + ": " + e.getMessage());
                }
            }
        }
        log.info("Read {} routes for {}", routes.size(), collectorName);
        return routes;
    }
}
