package de.anton.pv.analyser.iv_analyzer.model;

/**
 * Raised in {@link ValidationMode#STRICT} when an extracted parameter lies outside its
 * physical range (FF outside [0, 1], non-positive resistance).
 */
public class ImplausibleParameterException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String parameterName;
    private final double value;

    public ImplausibleParameterException(String parameterName, double value, String message) {
        super(message);
        this.parameterName = parameterName;
        this.value = value;
    }

    public String getParameterName() { return parameterName; }
    public double getValue() { return value; }
}
