package quest.gekko.aspath.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.util.List;

/**
 * Persistent row behind the database backed schedule registry.
 * <p>
 * Names are assigned, not generated, so new rows must be persisted rather than
 * merged or a concurrent duplicate would silently overwrite the existing row.
 */
@Entity
@Table(name = "schedule_entries")
@Getter @Setter
public class ScheduledGrab implements Persistable<String> {
    @Id
    @Column(length = 200)
    String name;

    @Column(name = "cron_hour", nullable = false)
    Integer hour;

    @Column(name = "cron_minute", nullable = false)
    Integer minute;

    @Column(nullable = false)
    String task;

    @Convert(converter = TaskArgsConverter.class)
    @Column(length = 1024)
    List<String> args;

    @Transient
    private boolean isNew = true;

    @Override
    public String getId() {
        return name;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }
}
