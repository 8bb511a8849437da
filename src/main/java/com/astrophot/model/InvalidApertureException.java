package com.astrophot.model;

public class InvalidApertureException extends IllegalArgumentException {

    public InvalidApertureException(String message) {
        super(message);
    }
}
