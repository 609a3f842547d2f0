package io.github.drompincen.ledgersync.runtime.sync;

/**
 * Translates between ledger priorities (1 highest .. 5) and device ordinals (0 none, 1 high .. 9 low).
 * The device has only three levels, so ledger 4 and 5 both become "none" and come back as 4.
 */
public final class PriorityMapper {

    public static final int DEVICE_NONE = 0;
    public static final int LEDGER_DEFAULT = 4;

    private PriorityMapper() {}

    public static int toLedger(int devicePriority) {
        if (devicePriority >= 1 && devicePriority <= 4) return 1;
        if (devicePriority == 5) return 2;
        if (devicePriority >= 6 && devicePriority <= 9) return 3;
        return LEDGER_DEFAULT;
    }

    public static int toDevice(Integer ledgerPriority) {
        if (ledgerPriority == null) return DEVICE_NONE;
        switch (ledgerPriority) {
            case 1: return 1;
            case 2: return 5;
            case 3: return 9;
            default: return DEVICE_NONE;
        }
    }
}
