package de.anton.pv.analyser.iv_analyzer.view;

import de.anton.pv.analyser.iv_analyzer.model.ResampledCurve;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.BasicStroke;
import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Plots a resampled curve with JFreeChart and saves it as PNG.
 * The interpolated grid is drawn as a line, the raw samples as unconnected markers.
 * Files are named {@code <prefix>_<y label>.png}; an existing file is overwritten.
 */
public class IvCurveChartRenderer implements CurveRenderer {

    private static final Logger logger = LoggerFactory.getLogger(IvCurveChartRenderer.class);

    public static final int DEFAULT_WIDTH = 800;
    public static final int DEFAULT_HEIGHT = 600;

    private static final Color INTERPOLATED_COLOR = new Color(31, 119, 180);
    private static final Color RAW_COLOR = new Color(214, 39, 40);

    private final File outputDirectory;
    private final String filePrefix;
    private final int width;
    private final int height;

    public IvCurveChartRenderer(File outputDirectory, String filePrefix) {
        this(outputDirectory, filePrefix, DEFAULT_WIDTH, DEFAULT_HEIGHT);
    }

    public IvCurveChartRenderer(File outputDirectory, String filePrefix, int width, int height) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "Output directory cannot be null.");
        this.filePrefix = (filePrefix == null || filePrefix.isBlank()) ? "iv_curve" : filePrefix;
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Chart size must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public void render(ResampledCurve curve) {
        File target = outputFileFor(curve);
        if (!outputDirectory.isDirectory() && !outputDirectory.mkdirs()) {
            throw new UncheckedIOException(new IOException("Ausgabeverzeichnis konnte nicht angelegt werden: " + outputDirectory));
        }
        try {
            ChartUtils.saveChartAsPNG(target, createChart(curve), width, height);
            logger.info("Chart for '{}' written to {}", curve.getYLabel(), target.getAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write chart " + target, e);
        }
    }

    /** PNG file the given curve is written to. */
    public File outputFileFor(ResampledCurve curve) {
        String slug = curve.getYLabel().replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return new File(outputDirectory, filePrefix + "_" + slug.toLowerCase() + ".png");
    }

    /**
     * Builds the chart without writing it, e.g. for display in a {@code ChartPanel}.
     */
    public JFreeChart createChart(ResampledCurve curve) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        XYSeries interpolated = new XYSeries("Interpolated Data", false, true);
        for (int i = 0; i < curve.size(); i++) {
            interpolated.add(curve.getX(i), curve.getY(i));
        }
        XYSeries raw = new XYSeries("Raw Data", false, true);
        double[] rawX = curve.getRawXValues();
        double[] rawY = curve.getRawYValues();
        for (int i = 0; i < rawX.length; i++) {
            raw.add(rawX[i], rawY[i]);
        }
        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(interpolated);
        dataset.addSeries(raw);

        String title = String.format("%s vs %s (%s)", curve.getYLabel(), curve.getXLabel(), curve.getMethod());
        JFreeChart chart = ChartFactory.createXYLineChart(
                title, curve.getXLabel(), curve.getYLabel(), dataset,
                PlotOrientation.VERTICAL, true, false, false);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer();
        renderer.setSeriesLinesVisible(0, true);
        renderer.setSeriesShapesVisible(0, false);
        renderer.setSeriesPaint(0, INTERPOLATED_COLOR);
        renderer.setSeriesStroke(0, new BasicStroke(2.0f));
        renderer.setSeriesLinesVisible(1, false);
        renderer.setSeriesShapesVisible(1, true);
        renderer.setSeriesPaint(1, RAW_COLOR);
        plot.setRenderer(renderer);
        return chart;
    }
}
