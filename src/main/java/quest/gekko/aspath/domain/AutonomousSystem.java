package quest.gekko.aspath.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "autonomous_systems")
@Getter @Setter
public class AutonomousSystem {
    @Id
    Long number;

    String name;
}
