package com.partlog.partlogserver.services;

public enum FlushPhase {
    SCANNING,
    AWAITING_IDENTIFIERS,
    DRAINING_DEFERRED,
    DONE
}
