package com.swisspair.model;

public enum SessionState {
    NOT_STARTED,
    /** Players registered, first round not yet paired. */
    READY,
    ROUND_IN_PROGRESS,
    ROUND_COMPLETE,
    FINISHED
}
