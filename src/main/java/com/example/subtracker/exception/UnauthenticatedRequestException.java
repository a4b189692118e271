package com.example.subtracker.exception;

import com.example.subtracker.util.Constants;

/**
 * Raised when an inbound webhook fails signature verification. The message never
 * says which part of the comparison failed.
 */
public class UnauthenticatedRequestException extends RuntimeException {
    public UnauthenticatedRequestException() {
        super(Constants.ErrorMessages.INVALID_SIGNATURE);
    }
}
