package quest.gekko.aspath.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import quest.gekko.aspath.domain.*;
import quest.gekko.aspath.web.dto.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({SnapshotQueryService.class, RouteCollectorService.class})
class SnapshotQueryServiceTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private SnapshotQueryService queryService;

    private ExchangePoint amsIx;
    private ExchangePoint emptyIx;
    private RouteCollector rc1;
    private RouteCollector rc2;

    @BeforeEach
    void setUp() {
        amsIx = exchangePoint("AMS-IX");
        emptyIx = exchangePoint("NO-COLLECTORS");
        rc1 = collector("rc1.ams-ix.net", amsIx);
        rc2 = collector("rc2.ams-ix.net", amsIx);
    }

    private ExchangePoint exchangePoint(String name) {
        ExchangePoint ixp = new ExchangePoint();
        ixp.setName(name);
        ixp.setCountry("NL");
        return em.persist(ixp);
    }

    private RouteCollector collector(String name, ExchangePoint ixp) {
        RouteCollector rc = new RouteCollector();
        rc.setName(name);
        rc.setExchangePointId(ixp.getId());
        return em.persist(rc);
    }

    private RoutingSnapshot snapshot(RouteCollector rc, LocalDateTime createdAt, SnapshotStatus status) {
        RoutingSnapshot s = new RoutingSnapshot();
        s.setRouteCollectorId(rc.getId());
        s.setCreatedAt(createdAt);
        s.setStatus(status);
        return em.persist(s);
    }

    private void route(RoutingSnapshot s, String block, Long... path) {
        RouteRow row = new RouteRow();
        row.setBlock(block);
        row.setPath(List.of(path));
        row.setOriginAs(path[path.length - 1]);
        row.setSnapshotId(s.getId());
        row.setCreatedAt(s.getCreatedAt());
        em.persist(row);
        em.flush();
    }

    private static LocalDateTime day(int d) {
        return LocalDateTime.of(2024, 3, d, 2, 0);
    }

    @Test
    void listsParsedSnapshotsNewestFirst() {
        RoutingSnapshot older = snapshot(rc1, day(1), SnapshotStatus.PARSED);
        RoutingSnapshot newer = snapshot(rc1, day(3), SnapshotStatus.PARSED);
        snapshot(rc1, day(4), SnapshotStatus.PENDING);
        snapshot(rc1, day(5), SnapshotStatus.FAILED);
        RoutingSnapshot middle = snapshot(rc1, day(2), SnapshotStatus.PARSED);
        snapshot(rc2, day(6), SnapshotStatus.PARSED);

        List<SnapshotDTO> snapshots = queryService.listSnapshots("rc1.ams-ix.net");

        assertEquals(List.of(newer.getId(), middle.getId(), older.getId()),
                snapshots.stream().map(SnapshotDTO::id).toList());
        for (int i = 1; i < snapshots.size(); i++) {
            assertFalse(snapshots.get(i).createdAt().isAfter(snapshots.get(i - 1).createdAt()));
        }
        assertEquals(OffsetDateTime.of(day(3), ZoneOffset.UTC), snapshots.get(0).createdAt());
    }

    @Test
    void latestRoutesUseHighestIdRegardlessOfStatus() {
        RoutingSnapshot parsed = snapshot(rc1, day(1), SnapshotStatus.PARSED);
        route(parsed, "1.1.1.0/24", 6939L, 13335L);
        RoutingSnapshot pending = snapshot(rc1, day(2), SnapshotStatus.PENDING);
        route(pending, "8.8.8.0/24", 6939L, 15169L);

        SnapshotRoutesDTO latest = queryService.getLatestRoutes("rc1.ams-ix.net");

        assertEquals(pending.getId(), latest.metadata().snapshotId());
        assertEquals(OffsetDateTime.of(day(2), ZoneOffset.UTC), latest.metadata().createdAt());
        assertEquals(List.of("8.8.8.0/24"), latest.routes().stream().map(RouteDTO::block).toList());
    }

    @Test
    void latestRoutesWithoutAnySnapshotIsNotFound() {
        assertThrows(SnapshotNotFoundException.class, () -> queryService.getLatestRoutes("rc2.ams-ix.net"));
    }

    @Test
    void snapshotRoutesByIdAreExactAndAnnotated() {
        AutonomousSystem cf = new AutonomousSystem();
        cf.setNumber(13335L);
        cf.setName("CLOUDFLARENET");
        em.persist(cf);

        RoutingSnapshot mine = snapshot(rc1, day(1), SnapshotStatus.PARSED);
        route(mine, "1.1.1.0/24", 6939L, 13335L);
        route(mine, "192.0.2.0/24", 64512L);
        RoutingSnapshot sameSecond = snapshot(rc2, day(1), SnapshotStatus.PARSED);
        route(sameSecond, "9.9.9.0/24", 19281L);

        SnapshotRoutesDTO result = queryService.getSnapshotRoutes("rc1.ams-ix.net", mine.getId());

        assertEquals(mine.getId(), result.metadata().snapshotId());
        assertEquals(2, result.routes().size());
        assertEquals("CLOUDFLARENET", result.routes().get(0).asName());
        assertNull(result.routes().get(1).asName());
        assertEquals(64512L, result.routes().get(1).origin());
    }

    @Test
    void snapshotOfAnotherCollectorIsNotFound() {
        RoutingSnapshot foreign = snapshot(rc2, day(1), SnapshotStatus.PARSED);

        SnapshotNotFoundException ex = assertThrows(SnapshotNotFoundException.class,
                () -> queryService.getSnapshotRoutes("rc1.ams-ix.net", foreign.getId()));
        assertEquals(foreign.getId(), ex.getSnapshotId());
    }

    @Test
    void unknownSnapshotIdIsNotFound() {
        assertThrows(SnapshotNotFoundException.class, () -> queryService.getSnapshotRoutes("rc1.ams-ix.net", 987654L));
    }

    @Test
    void unknownCollectorIsNotFoundOnEveryPerCollectorOperation() {
        snapshot(rc1, day(1), SnapshotStatus.PARSED);

        assertThrows(CollectorNotFoundException.class, () -> queryService.listSnapshots("nope"));
        assertThrows(CollectorNotFoundException.class, () -> queryService.getLatestRoutes("nope"));
        CollectorNotFoundException ex = assertThrows(CollectorNotFoundException.class,
                () -> queryService.getSnapshotRoutes("nope", 1L));
        assertEquals("nope", ex.getCollectorName());
        assertEquals("Route Collector not found", ex.getMessage());
    }

    @Test
    void exchangePointsCarryLatestSnapshotAcrossCollectors() {
        snapshot(rc1, day(1), SnapshotStatus.PARSED);
        RoutingSnapshot newest = snapshot(rc2, LocalDateTime.of(2024, 3, 7, 23, 59), SnapshotStatus.PENDING);
        snapshot(rc1, day(5), SnapshotStatus.PARSED);

        Map<Long, ExchangePointDTO> ixps = queryService.listExchangePoints();

        ExchangePointDTO ams = ixps.get(amsIx.getId());
        assertEquals(2, ams.routeCollectors());
        assertEquals(LocalDate.of(2024, 3, 7), ams.lastSnapshotDate());
        assertEquals(newest.getId(), ams.lastSnapshotId());
        assertEquals("rc2.ams-ix.net", ams.lastSnapshotCollectorName());

        ExchangePointDTO empty = ixps.get(emptyIx.getId());
        assertEquals(0, empty.routeCollectors());
        assertNull(empty.lastSnapshotId());
        assertNull(empty.lastSnapshotDate());
    }

    @Test
    void exchangePointTieOnCreatedAtPicksHighestId() {
        snapshot(rc1, day(2), SnapshotStatus.PARSED);
        RoutingSnapshot later = snapshot(rc2, day(2), SnapshotStatus.PARSED);

        assertEquals(later.getId(), queryService.listExchangePoints().get(amsIx.getId()).lastSnapshotId());
    }

    @Test
    void listsAllCollectors() {
        assertEquals(List.of("rc1.ams-ix.net", "rc2.ams-ix.net"),
                queryService.listCollectors().stream().map(RouteCollectorDTO::name).sorted().toList());
    }

    @Test
    void statisticsCountIndependentlyAndTrackNewCollector() {
        snapshot(rc1, day(1), SnapshotStatus.PARSED);
        StatisticsDTO before = queryService.getStatistics();

        assertEquals(2, before.routeCollectorCount());
        assertEquals(1, before.snapshotsCount());
        assertEquals(0, before.autonomousSystems());
        assertEquals(2, before.ixpCount());

        collector("rc3.ams-ix.net", amsIx);
        StatisticsDTO after = queryService.getStatistics();

        assertEquals(before.routeCollectorCount() + 1, after.routeCollectorCount());
        assertEquals(before.snapshotsCount(), after.snapshotsCount());
        assertEquals(before.autonomousSystems(), after.autonomousSystems());
        assertEquals(before.ixpCount(), after.ixpCount());
    }
}
