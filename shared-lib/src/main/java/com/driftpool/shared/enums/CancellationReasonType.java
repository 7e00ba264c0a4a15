package com.driftpool.shared.enums;

public enum CancellationReasonType {
    RIDER_CHANGED_PLANS(Fault.NONE),
    RIDER_NO_SHOW(Fault.RIDER),
    RIDER_UNRESPONSIVE(Fault.RIDER),
    RIDER_CANCELLED_AFTER_COMMIT(Fault.RIDER),
    DRIVER_EMERGENCY(Fault.DRIVER),
    VEHICLE_ISSUE(Fault.DRIVER),
    DRIVER_DECLINED(Fault.NONE),
    NO_DRIVERS_AVAILABLE(Fault.NONE),
    SAFETY_CONCERN(Fault.NONE),
    OTHER(Fault.NONE);

    private enum Fault { NONE, RIDER, DRIVER }

    private final Fault fault;

    CancellationReasonType(Fault fault) {
        this.fault = fault;
    }

    public boolean isRiderFault() {
        return fault == Fault.RIDER;
    }

    public boolean isDriverFault() {
        return fault == Fault.DRIVER;
    }
}
