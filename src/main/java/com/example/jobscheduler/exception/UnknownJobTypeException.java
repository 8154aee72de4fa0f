package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job type missing from the catalog
 */
@Getter
public class UnknownJobTypeException extends RuntimeException {

    private final String jobType;

    public UnknownJobTypeException(String jobType) {
        super("Unknown job type: " + jobType);
        this.jobType = jobType;
    }
}
