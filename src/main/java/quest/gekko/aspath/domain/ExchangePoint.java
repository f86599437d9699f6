package quest.gekko.aspath.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "internet_exchange_points")
@Getter @Setter
public class ExchangePoint {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false)
    String name;

    @Column(name = "full_name")
    String fullName;

    String country;
    String city;
    String website;
}
