package quest.gekko.aspath.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.aspath.domain.AutonomousSystem;

public interface AutonomousSystemRepository extends JpaRepository<AutonomousSystem, Long> {
}
