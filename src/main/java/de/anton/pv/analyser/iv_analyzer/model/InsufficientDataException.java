package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Thrown when a curve or a selection window does not hold enough samples for the
 * requested computation (too few distinct voltages, an empty regression window, ...).
 * There is no transient cause, so callers should not retry.
 */
public class InsufficientDataException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }
}
