package de.anton.pv.analyser.iv_analyzer;

import de.anton.pv.analyser.iv_analyzer.algorithms.InterpolationMethod;
import de.anton.pv.analyser.iv_analyzer.model.CurrentUnit;
import de.anton.pv.analyser.iv_analyzer.model.IvFileFormat;
import de.anton.pv.analyser.iv_analyzer.model.IvMeasurement;
import de.anton.pv.analyser.iv_analyzer.model.PhotovoltaicParameters;
import de.anton.pv.analyser.iv_analyzer.model.ValidationMode;
import de.anton.pv.analyser.iv_analyzer.model.VoltageUnit;
import de.anton.pv.analyser.iv_analyzer.service.AnalysisConfiguration;
import de.anton.pv.analyser.iv_analyzer.service.IvAnalysisService;
import de.anton.pv.analyser.iv_analyzer.service.IvDataService;
import de.anton.pv.analyser.iv_analyzer.service.ResultExporter;
import de.anton.pv.analyser.iv_analyzer.view.CurveRenderer;
import de.anton.pv.analyser.iv_analyzer.view.IvCurveChartRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point. Loads one I-V file, runs the extraction and prints the parameters.
 * <pre>
 * App &lt;file&gt; [--voltage-col=..] [--current-col=..] [--voltage-unit=V|mV] [--current-unit=A|mA|A/cm2|mA/cm2]
 *     [--area=..] [--delimiter=..] [--decimal=..] [--points=..] [--method=linear|cubic|akima]
 *     [--low-limit=..] [--high-limit=..] [--high-factor=..] [--incident-power=..] [--strict]
 *     [--plot-dir=..] [--export=..]
 * </pre>
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the analysis described by the arguments and prints the result.
     *
     * @return 0 on success, 1 on any failure.
     */
    static int run(String[] args, PrintStream out) {
        try {
            Map<String, String> options = new LinkedHashMap<>();
            String fileName = parseArguments(args, options);
            if (fileName == null) {
                out.println(usage());
                return 1;
            }

            IvFileFormat format = toFileFormat(options);
            AnalysisConfiguration config = toConfiguration(options);
            File file = new File(fileName);

            logger.info("Creating application components...");
            IvDataService dataService = new IvDataService();
            CurveRenderer renderer = options.containsKey("plot-dir")
                    ? new IvCurveChartRenderer(new File(options.get("plot-dir")), baseName(file))
                    : CurveRenderer.NONE;
            IvAnalysisService analysisService = new IvAnalysisService(renderer);

            IvMeasurement measurement = dataService.loadMeasurement(file, format);
            IvAnalysisService.AnalysisResult result = analysisService.runFullAnalysis(measurement, config);
            printParameters(result.parameters, out);

            if (options.containsKey("export")) {
                new ResultExporter().export(result, options.get("export"));
                out.println("Exported to " + options.get("export"));
            }
            return 0;
        } catch (Exception e) {
            logger.error("Analysis failed: {}", e.getMessage(), e);
            out.println("Fehler: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return 1;
        }
    }

    /**
     * Splits {@code --key=value} options (and the {@code --strict} flag) from the single positional file argument.
     *
     * @return the file argument, or null if there is none.
     */
    static String parseArguments(String[] args, Map<String, String> options) {
        String fileName = null;
        for (String arg : args) {
            if (arg.startsWith("--")) {
                int eq = arg.indexOf('=');
                if (eq < 0) {
                    options.put(arg.substring(2), "true");
                } else {
                    options.put(arg.substring(2, eq), arg.substring(eq + 1));
                }
            } else if (fileName == null) {
                fileName = arg;
            } else {
                throw new IllegalArgumentException("Unexpected argument '" + arg + "', only one input file is supported.");
            }
        }
        return fileName;
    }

    static IvFileFormat toFileFormat(Map<String, String> options) {
        IvFileFormat defaults = IvFileFormat.defaults();
        return new IvFileFormat(
                options.getOrDefault("voltage-col", defaults.voltageColumn()),
                options.getOrDefault("current-col", defaults.currentColumn()),
                options.containsKey("voltage-unit") ? VoltageUnit.fromSymbol(options.get("voltage-unit")) : defaults.voltageUnit(),
                options.containsKey("current-unit") ? CurrentUnit.fromSymbol(options.get("current-unit")) : defaults.currentUnit(),
                options.containsKey("area") ? parseDouble(options, "area") : null,
                options.containsKey("delimiter") ? singleChar(options, "delimiter") : defaults.delimiter(),
                options.containsKey("decimal") ? singleChar(options, "decimal") : defaults.decimalSeparator());
    }

    static AnalysisConfiguration toConfiguration(Map<String, String> options) {
        AnalysisConfiguration config = AnalysisConfiguration.defaults();
        if (options.containsKey("points")) {
            config = config.withNumPoints(parseInt(options, "points"));
        }
        if (options.containsKey("method")) {
            config = config.withInterpolationMethod(InterpolationMethod.fromDisplayName(options.get("method")));
        }
        double low = options.containsKey("low-limit") ? parseDouble(options, "low-limit") : config.lowVoltageLimit();
        double high = options.containsKey("high-limit") ? parseDouble(options, "high-limit") : config.highVoltageLimit();
        config = config.withVoltageLimits(low, high);
        if (options.containsKey("high-factor")) {
            config = config.withHighVoltageFactor(parseDouble(options, "high-factor"));
        }
        if (options.containsKey("incident-power")) {
            config = config.withIncidentPower(parseDouble(options, "incident-power"));
        }
        if (Boolean.parseBoolean(options.getOrDefault("strict", "false"))) {
            config = config.withValidationMode(ValidationMode.STRICT);
        }
        return config.withRenderCurves(options.containsKey("plot-dir"));
    }

    static void printParameters(PhotovoltaicParameters parameters, PrintStream out) {
        if (parameters.hasDensityParameters()) {
            out.println(String.format(Locale.ROOT, "Jsc: %.2f mA/cm²", Math.abs(parameters.getJscMACm2())));
            out.println(String.format(Locale.ROOT, "Voc: %.2f V", parameters.getVocV()));
            out.println(String.format(Locale.ROOT, "FF: %.2f %%", parameters.getFillFactor() * 100));
            out.println(String.format(Locale.ROOT, "PCE: %.2f %%", parameters.getPcePercent()));
        } else {
            out.println("Jsc, Voc, FF, PCE: n/a (no cell area given)");
        }
        out.println(String.format(Locale.ROOT, "Rs: %.2f Ω", parameters.getRsOhm()));
        out.println(String.format(Locale.ROOT, "Rsh: %.2f Ω", parameters.getRshOhm()));
    }

    private static double parseDouble(Map<String, String> options, String key) {
        try {
            return Double.parseDouble(options.get(key).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + key + " expects a number, got '" + options.get(key) + "'.", e);
        }
    }

    private static int parseInt(Map<String, String> options, String key) {
        try {
            return Integer.parseInt(options.get(key).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option --" + key + " expects an integer, got '" + options.get(key) + "'.", e);
        }
    }

    private static char singleChar(Map<String, String> options, String key) {
        String value = options.get(key);
        if ("\\t".equals(value) || "tab".equalsIgnoreCase(value)) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException("Option --" + key + " expects a single character, got '" + value + "'.");
        }
        return value.charAt(0);
    }

    private static String baseName(File file) {
        String name = file.getName();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String usage() {
        return "Usage: App <file> [--voltage-col=..] [--current-col=..] [--voltage-unit=V|mV]"
                + " [--current-unit=A|mA|A/cm2|mA/cm2] [--area=..] [--delimiter=..] [--decimal=..]"
                + " [--points=..] [--method=linear|cubic|akima] [--low-limit=..] [--high-limit=..]"
                + " [--high-factor=..] [--incident-power=..] [--strict] [--plot-dir=..] [--export=..]";
    }
}
