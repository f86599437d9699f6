package quest.gekko.aspath.util;

import quest.gekko.aspath.service.ingestion.AnnouncedRoute;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses one dump line: {@code <prefix> <asn> <asn> ...}, origin AS last.
 * Blank lines and {@code #} comments yield nothing.
 */
public class RouteLineParser {
    private static final Pattern PREFIX = Pattern.compile("^[0-9A-Fa-f:.]+/\\d{1,3}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static Optional<AnnouncedRoute> parse(String line) {
        if (line == null) return Optional.empty();
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) return Optional.empty();

        String[] fields = WHITESPACE.split(trimmed);
        if (fields.length < 2) {
            throw new IllegalArgumentException("expected a prefix followed by an AS path");
        }
        if (!PREFIX.matcher(fields[0]).matches()) {
            throw new IllegalArgumentException("not a CIDR prefix: " + fields[0]);
        }

        List<Long> path = new ArrayList<>(fields.length - 1);
        for (int i = 1; i < fields.length; i++) {
            String asn = fields[i].startsWith("AS") ? fields[i].substring(2) : fields[i];
            try {
                long number = Long.parseLong(asn);
                if (number < 0 || number > 4_294_967_295L) {
                    throw new IllegalArgumentException("AS number out of range: " + fields[i]);
                }
                path.add(number);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an AS number: " + fields[i]);
            }
        }
        return Optional.of(new AnnouncedRoute(fields[0], path));
    }
}
