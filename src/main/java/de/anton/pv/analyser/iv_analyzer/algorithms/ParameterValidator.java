package de.anton.pv.analyser.iv_analyzer.algorithms;

import de.anton.pv.analyser.iv_analyzer.model.ImplausibleParameterException;
import de.anton.pv.analyser.iv_analyzer.model.PhotovoltaicParameters;
import de.anton.pv.analyser.iv_analyzer.model.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks extracted parameters for physical plausibility: 0 <= FF <= 1, Rs > 0 and Rsh > 0.
 * FF is only checked when the parameters carry density values.
 */
public final class ParameterValidator {

    private static final Logger logger = LoggerFactory.getLogger(ParameterValidator.class);

    private ParameterValidator() { throw new IllegalStateException("Utility class"); }

    /**
     * @param parameters the extracted parameters.
     * @param mode       PERMISSIVE logs every violation and returns; STRICT throws on the first one.
     * @return the same parameters, unchanged.
     * @throws ImplausibleParameterException in STRICT mode if a value is out of range.
     */
    public static PhotovoltaicParameters validate(PhotovoltaicParameters parameters, ValidationMode mode) {
        Objects.requireNonNull(parameters, "Parameters cannot be null.");
        Objects.requireNonNull(mode, "Validation mode cannot be null.");

        List<ImplausibleParameterException> violations = new ArrayList<>();
        if (parameters.hasDensityParameters()) {
            double ff = parameters.getFillFactor();
            if (!(ff >= 0 && ff <= 1)) {
                violations.add(new ImplausibleParameterException("FF", ff,
                        String.format("Fill factor %.4f is outside [0, 1].", ff)));
            }
        }
        checkResistance("Rs", parameters.getRsOhm(), violations);
        checkResistance("Rsh", parameters.getRshOhm(), violations);

        if (violations.isEmpty()) {
            return parameters;
        }
        if (mode == ValidationMode.STRICT) {
            ImplausibleParameterException first = violations.get(0);
            logger.error("Validation ({}) failed: {}", mode, first.getMessage());
            throw first;
        }
        for (ImplausibleParameterException violation : violations) {
            logger.warn("Implausible parameter {} = {}: {}", violation.getParameterName(), violation.getValue(), violation.getMessage());
        }
        return parameters;
    }

    private static void checkResistance(String name, double value, List<ImplausibleParameterException> violations) {
        if (!Double.isFinite(value) || value <= 0) {
            violations.add(new ImplausibleParameterException(name, value,
                    String.format("%s = %s Ohm is not a finite positive resistance.", name, value)));
        }
    }
}
