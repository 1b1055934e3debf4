package com.shelterops.availability;

public class MalformedTimeException extends IllegalArgumentException {

    public MalformedTimeException(String message) {
        super(message);
    }
}
