package com.project.coronal.tracking.exceptions;

/** Domain-specific exception for detection and tracking errors. */
public class TrackingException extends RuntimeException {
    public TrackingException(String message) { super(message); }
    public TrackingException(String message, Throwable cause) { super(message, cause); }
}
