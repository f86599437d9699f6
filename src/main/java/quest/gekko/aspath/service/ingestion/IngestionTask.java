package quest.gekko.aspath.service.ingestion;

import java.util.List;

public interface IngestionTask {

    /** Reference used by schedule entries to name this task. */
    String taskName();

    /** Runs the task with the positional args stored in the schedule entry. */
    void run(List<String> args);
}
