package scanagram.core.model.governor;

/**
 * States of one governed operation.
 *
 * <pre>
 * IDLE -> WAITING_FOR_ADMISSION -> EXECUTING -> SUCCESS
 *                                            -> TRANSIENT_FAILURE -> WAITING_FOR_ADMISSION
 *                                            -> FATAL_FAILURE
 *                                            -> RETRIES_EXHAUSTED
 * </pre>
 */
public enum GovernorState {
    IDLE(false),
    WAITING_FOR_ADMISSION(false),
    EXECUTING(false),
    TRANSIENT_FAILURE(false),
    SUCCESS(true),
    FATAL_FAILURE(true),
    RETRIES_EXHAUSTED(true);

    private final boolean terminal;

    GovernorState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
