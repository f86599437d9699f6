package quest.gekko.aspath.service.scheduling;

public class ReconcileInterruptedException extends RuntimeException {

    public ReconcileInterruptedException() {
        super("Schedule reconcile interrupted");
    }
}
