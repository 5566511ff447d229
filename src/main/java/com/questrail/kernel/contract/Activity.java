package com.questrail.kernel.contract;

/**
 * What a worker's pane is doing right now.
 */
public enum Activity {
    IDLE,
    INJECTING,
    RESIZING,
    RECOVERING,
    ERROR
}
