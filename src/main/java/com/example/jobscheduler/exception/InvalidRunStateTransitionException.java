package com.example.jobscheduler.exception;

import com.example.jobscheduler.domain.enums.RunStateWriter;
import com.example.jobscheduler.domain.enums.RunStatus;
import lombok.Getter;

/**
 * Thrown when a component tries to write a run status it does not own
 */
@Getter
public class InvalidRunStateTransitionException extends RuntimeException {

    private final RunStateWriter writer;
    private final RunStatus requestedStatus;

    public InvalidRunStateTransitionException(RunStateWriter writer, RunStatus requestedStatus) {
        super(String.format("%s may not write run status %s", writer, requestedStatus));
        this.writer = writer;
        this.requestedStatus = requestedStatus;
    }
}
