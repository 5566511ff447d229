package com.questrail.kernel.api;

/**
 * Dotted type names emitted or interpreted by the kernel.
 */
public final class EventTypes {

    private EventTypes() {}

    // ---------------------------------------------------------------------
    // Injection lifecycle
    // ---------------------------------------------------------------------

    public static final String INJECT_REQUESTED = "inject.requested";
    public static final String INJECT_APPLIED = "inject.applied";
    public static final String INJECT_SUBMIT_SENT = "inject.submit.sent";
    public static final String INJECT_VERIFIED = "inject.verified";
    public static final String INJECT_FAILED = "inject.failed";
    public static final String INJECT_DEFERRED = "inject.deferred";
    public static final String INJECT_RESUMED = "inject.resumed";
    public static final String INJECT_DROPPED = "inject.dropped";

    public static final String RESIZE_REQUESTED = "resize.requested";
    public static final String RESIZE_COALESCED = "resize.coalesced";
    public static final String RESIZE_APPLIED = "resize.applied";

    // ---------------------------------------------------------------------
    // Contracts and pane state
    // ---------------------------------------------------------------------

    public static final String CONTRACT_VIOLATION = "contract.violation";
    public static final String CONTRACT_OVERRIDE = "contract.override";
    public static final String PANE_STATE_CHANGED = "pane.state.changed";
    public static final String PANE_FOCUS_LOCKED = "pane.focus.locked";
    public static final String PANE_FOCUS_RELEASED = "pane.focus.released";
    public static final String WORKER_RESTARTED = "worker.restarted";
    public static final String SAFEMODE_ENTERED = "safemode.entered";
    public static final String SAFEMODE_EXITED = "safemode.exited";

    // ---------------------------------------------------------------------
    // Terminal output and compaction
    // ---------------------------------------------------------------------

    public static final String TERMINAL_OUTPUT = "terminal.output";
    public static final String TERMINAL_UP = "terminal.up";
    public static final String TERMINAL_DOWN = "terminal.down";
    public static final String COMPACTION_SUSPECTED = "cli.compaction.suspected";
    public static final String COMPACTION_STARTED = "cli.compaction.started";
    public static final String COMPACTION_ENDED = "cli.compaction.ended";
    public static final String COMPACTION_CLEARED = "cli.compaction.cleared";

    // ---------------------------------------------------------------------
    // Ledger diagnostics
    // ---------------------------------------------------------------------

    public static final String EVENT_INVALID = "event.invalid";
    public static final String EVENT_DROPPED = "event.dropped";
    public static final String TRACE_ROOT_DUPLICATE = "trace.root.duplicate";
    public static final String SPAN_TIMEOUT = "span.timeout";

    // ---------------------------------------------------------------------
    // Bridge and command path
    // ---------------------------------------------------------------------

    public static final String BRIDGE_CONNECTED = "bridge.connected";
    public static final String BRIDGE_DISCONNECTED = "bridge.disconnected";
    public static final String BRIDGE_SEQUENCE_RESET = "bridge.sequence.reset";
    public static final String BRIDGE_STATS = "bridge.stats";
    public static final String COMMAND_REQUESTED = "command.requested";
    public static final String COMMAND_ACK = "command.ack";
    public static final String COMMAND_ACK_TIMEOUT = "command.ack.timeout";
}
