package quest.gekko.aspath.service.ingestion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import quest.gekko.aspath.config.AspathProperties;
import quest.gekko.aspath.domain.RouteCollector;
import quest.gekko.aspath.domain.RoutingSnapshot;
import quest.gekko.aspath.domain.SnapshotStatus;
import quest.gekko.aspath.repository.RouteRowRepository;
import quest.gekko.aspath.repository.RoutingSnapshotRepository;
import quest.gekko.aspath.service.core.CollectorNotFoundException;
import quest.gekko.aspath.service.core.RouteCollectorService;
import quest.gekko.aspath.web.dto.RouteDTO;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({SnapshotWriter.class, RouteCollectorService.class})
class GrabAndIngestTaskTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T02:00:05.734Z"), ZoneOffset.UTC);
    private static final AspathProperties.Ingestion PROPS =
            new AspathProperties.Ingestion(Path.of("unused"), 3, Duration.ofMillis(1), 2, 1);

    @Autowired
    private TestEntityManager em;
    @Autowired
    private SnapshotWriter writer;
    @Autowired
    private RouteCollectorService collectorService;
    @Autowired
    private RoutingSnapshotRepository snapshotRepository;
    @Autowired
    private RouteRowRepository routeRepository;

    @BeforeEach
    void setUp() {
        RouteCollector rc = new RouteCollector();
        rc.setName("rc1.ams-ix.net");
        em.persist(rc);
    }

    private GrabAndIngestTask task(RoutingTableSource source) {
        return new GrabAndIngestTask(collectorService, source, writer, PROPS, CLOCK);
    }

    @Test
    void writesParsedSnapshotWithRowsSharingItsCreatedAt() {
        List<AnnouncedRoute> table = List.of(
                new AnnouncedRoute("1.1.1.0/24", List.of(6939L, 13335L)),
                new AnnouncedRoute("8.8.8.0/24", List.of(6939L, 15169L)),
                new AnnouncedRoute("9.9.9.0/24", List.of(19281L)));

        RoutingSnapshot snapshot = task(name -> table).ingest("rc1.ams-ix.net");

        assertEquals(SnapshotStatus.PARSED, snapshot.getStatus());
        assertEquals(3L, snapshot.getRouteCount());
        assertEquals(LocalDateTime.of(2024, 3, 1, 2, 0, 5), snapshot.getCreatedAt());
        assertEquals(3L, routeRepository.countBySnapshotId(snapshot.getId()));

        List<RouteDTO> routes = routeRepository.findRoutesWithOrigin(snapshot.getCreatedAt(), snapshot.getId());
        assertEquals(List.of(13335L, 15169L, 19281L), routes.stream().map(RouteDTO::origin).toList());
    }

    @Test
    void retriesTransientFetchFailures() {
        AtomicInteger calls = new AtomicInteger();
        RoutingSnapshot snapshot = task(name -> {
            if (calls.incrementAndGet() < 3) throw new IOException("connection reset");
            return List.of(new AnnouncedRoute("1.1.1.0/24", List.of(13335L)));
        }).ingest("rc1.ams-ix.net");

        assertEquals(3, calls.get());
        assertEquals(SnapshotStatus.PARSED, snapshot.getStatus());
    }

    @Test
    void marksSnapshotFailedWhenGrabKeepsFailing() {
        GrabAndIngestTask task = task(name -> { throw new IOException("collector unreachable"); });

        IngestionException ex = assertThrows(IngestionException.class, () -> task.ingest("rc1.ams-ix.net"));

        RoutingSnapshot failed = snapshotRepository.findAll().get(0);
        assertEquals(SnapshotStatus.FAILED, failed.getStatus());
        assertEquals("collector unreachable", failed.getErrorMessage());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    void formatErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        GrabAndIngestTask task = task(name -> {
            calls.incrementAndGet();
            throw new RoutingTableFormatException("dump:3: not a CIDR prefix: x");
        });

        assertThrows(IngestionException.class, () -> task.ingest("rc1.ams-ix.net"));
        assertEquals(1, calls.get());
    }

    @Test
    void unknownCollectorOpensNoSnapshot() {
        assertThrows(CollectorNotFoundException.class, () -> task(name -> List.of()).run(List.of("nope")));
        assertEquals(0, snapshotRepository.count());
    }

    @Test
    void runRequiresExactlyOneArgument() {
        GrabAndIngestTask task = task(name -> List.of());
        assertThrows(IllegalArgumentException.class, () -> task.run(List.of()));
        assertThrows(IllegalArgumentException.class, () -> task.run(List.of("a", "b")));
    }
}
