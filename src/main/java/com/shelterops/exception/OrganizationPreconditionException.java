package com.shelterops.exception;

public class OrganizationPreconditionException extends RuntimeException {

    public OrganizationPreconditionException(String message) {
        super(message);
    }
}
