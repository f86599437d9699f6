package quest.gekko.aspath.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.aspath.domain.ExchangePoint;

import java.util.List;

public interface ExchangePointRepository extends JpaRepository<ExchangePoint, Long> {
    List<ExchangePoint> findAllByOrderByIdAsc();
}
