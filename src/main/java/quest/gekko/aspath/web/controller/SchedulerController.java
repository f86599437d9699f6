package quest.gekko.aspath.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.aspath.service.scheduling.ScheduleRegistry;
import quest.gekko.aspath.web.dto.ScheduleEntryDTO;

import java.util.Comparator;
import java.util.List;

@RestController
@RequiredArgsConstructor
public class SchedulerController {
    private final ScheduleRegistry registry;

    @GetMapping({"/scheduler", "/scheduler/"})
    public List<ScheduleEntryDTO> list() {
        return registry.list().stream()
                .map(ScheduleEntryDTO::of)
                .sorted(Comparator.comparing(ScheduleEntryDTO::name))
                .toList();
    }
}
