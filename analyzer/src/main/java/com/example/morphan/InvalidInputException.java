package com.example.morphan;

/**
 * Raised before any lattice work begins when the text handed to the analyser cannot be analysed,
 * for instance because it is empty.
 */
public class InvalidInputException extends MorphologyException {
    public InvalidInputException(String message) {
        super(message);
    }
}
