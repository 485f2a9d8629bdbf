package com.example.morphan;

/**
 * Signals that a lattice has no path from the beginning to the end of the sentence. This is never
 * a user error: it means the dictionary or the unknown-word fallback broke its contract of
 * producing at least one candidate at every reachable position.
 */
public class DisconnectedLatticeException extends MorphologyException {

    private final int position;

    public DisconnectedLatticeException(String message, int position) {
        super(message + " (position " + position + ")");
        this.position = position;
    }

    /**
     * @return input offset at which connectivity was lost
     */
    public int position() {
        return position;
    }
}
