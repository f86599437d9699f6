package quest.gekko.aspath.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.aspath.domain.AsPathConverter;
import quest.gekko.aspath.domain.RouteRow;
import quest.gekko.aspath.web.dto.RouteDTO;

import java.time.LocalDateTime;
import java.util.List;

public interface RouteRowRepository extends JpaRepository<RouteRow, Long> {

    /**
     * Routes of one snapshot with the origin AS name attached.
     * <p>
     * Both filters are required: {@code created_at} prunes the partition and
     * {@code snapshot_id} separates snapshots that share a creation second.
     * Origins without a known AS come back with a null name.
     */
    @Query(value = """
        SELECT r.block, r.path, r.origin_as, a.name
        FROM ip_routes r
        LEFT JOIN autonomous_systems a ON a.number = r.origin_as
        WHERE r.created_at = :createdAt
          AND r.snapshot_id = :snapshotId
        ORDER BY r.id
        """, nativeQuery = true)
    List<Object[]> findRoutesWithOriginRaw(@Param("createdAt") final LocalDateTime createdAt,
                                           @Param("snapshotId") final Long snapshotId);

    default List<RouteDTO> findRoutesWithOrigin(LocalDateTime createdAt, Long snapshotId) {
        return findRoutesWithOriginRaw(createdAt, snapshotId).stream()
                .map(row -> new RouteDTO(
                        (String) row[0],
                        AsPathConverter.parse((String) row[1]),
                        row[2] == null ? null : ((Number) row[2]).longValue(),
                        (String) row[3]))
                .toList();
    }

    long countBySnapshotId(final Long snapshotId);
}
