package quest.gekko.aspath.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.aspath.domain.ScheduledGrab;

public interface ScheduledGrabRepository extends JpaRepository<ScheduledGrab, String> {
}
