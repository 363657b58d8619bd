package de.anton.pv.analyser.iv_analyzer.service;

import de.anton.pv.analyser.iv_analyzer.model.IvDataReader;
import de.anton.pv.analyser.iv_analyzer.model.IvFileFormat;
import de.anton.pv.analyser.iv_analyzer.model.IvMeasurement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Objects;

/**
 * Service responsible for loading I-V measurements from delimited text or Excel files.
 */
public class IvDataService {

    private static final Logger logger = LoggerFactory.getLogger(IvDataService.class);
    private final IvDataReader dataReader;

    public IvDataService() {
        this(new IvDataReader());
    }

    IvDataService(IvDataReader dataReader) {
        this.dataReader = Objects.requireNonNull(dataReader, "Reader cannot be null.");
    }

    /**
     * Loads a measurement from the specified file.
     *
     * @param file   The file to load.
     * @param format Column names, units, area and separators of the file.
     * @return The measurement in V and mA.
     * @throws IOException          If the file cannot be read, lacks a column, holds no valid rows
     *                              or the format does not fit its content.
     * @throws NullPointerException if file or format is null.
     */
    public IvMeasurement loadMeasurement(File file, IvFileFormat format) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        Objects.requireNonNull(format, "File format cannot be null.");
        logger.info("Data Service: Attempting to load measurement file: {}", file.getAbsolutePath());
        try {
            IvMeasurement measurement = dataReader.read(file, format);
            logger.info("Data Service: {} samples loaded successfully from {}", measurement.size(), file.getName());
            return measurement;
        } catch (IOException | RuntimeException e) {
            logger.error("Data Service: Failed to load or parse measurement file: {}", file.getAbsolutePath(), e);
            throw new IOException("Fehler beim Lesen oder Verarbeiten der Messdatei " + file.getName() + ": " + e.getMessage(), e);
        }
    }
}
