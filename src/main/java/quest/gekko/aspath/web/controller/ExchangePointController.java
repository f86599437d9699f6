package quest.gekko.aspath.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.aspath.service.core.SnapshotQueryService;
import quest.gekko.aspath.web.dto.ExchangePointDTO;
import quest.gekko.aspath.web.dto.StatisticsDTO;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ExchangePointController {
    private final SnapshotQueryService queryService;

    @GetMapping({"/exchange-points", "/exchange-points/"})
    public Map<Long, ExchangePointDTO> index() {
        return queryService.listExchangePoints();
    }

    @GetMapping({"/statistics", "/statistics/"})
    public StatisticsDTO statistics() {
        return queryService.getStatistics();
    }
}
