package quest.gekko.aspath.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.aspath.service.core.SnapshotQueryService;
import quest.gekko.aspath.web.dto.RouteCollectorDTO;
import quest.gekko.aspath.web.dto.SnapshotDTO;
import quest.gekko.aspath.web.dto.SnapshotRoutesDTO;

import java.util.List;

@RestController
@RequestMapping("/route-collectors")
@RequiredArgsConstructor
public class RouteCollectorController {
    private final SnapshotQueryService queryService;

    @GetMapping({"", "/"})
    public List<RouteCollectorDTO> index() {
        return queryService.listCollectors();
    }

    @GetMapping({"/{collectorName}/snapshots", "/{collectorName}/snapshots/"})
    public List<SnapshotDTO> snapshots(@PathVariable String collectorName) {
        return queryService.listSnapshots(collectorName);
    }

    @GetMapping({"/{collectorName}/snapshots/latest/routes", "/{collectorName}/snapshots/latest/routes/"})
    public SnapshotRoutesDTO latestRoutes(@PathVariable String collectorName) {
        return queryService.getLatestRoutes(collectorName);
    }

    @GetMapping({"/{collectorName}/snapshots/{snapshotId}/routes", "/{collectorName}/snapshots/{snapshotId}/routes/"})
    public SnapshotRoutesDTO snapshotRoutes(@PathVariable String collectorName, @PathVariable Long snapshotId) {
        return queryService.getSnapshotRoutes(collectorName, snapshotId);
    }
}
