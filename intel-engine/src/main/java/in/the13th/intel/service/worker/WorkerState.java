package in.the13th.intel.service.worker;

public enum WorkerState {
    IDLE,
    DRAINING
}
