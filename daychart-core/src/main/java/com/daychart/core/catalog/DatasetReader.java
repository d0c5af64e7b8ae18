package com.daychart.core.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads OHLC dataset JSON files into a {@link ChartCatalog}.
 */
public class DatasetReader {

    private static final Logger LOG = LoggerFactory.getLogger(DatasetReader.class);

    private final ObjectMapper mapper;
    private final int barNumberCeiling;

    public DatasetReader() {
        this(ChartCatalog.DEFAULT_BAR_NUMBER_CEILING);
    }

    public DatasetReader(int barNumberCeiling) {
        this.barNumberCeiling = barNumberCeiling;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // A null price would otherwise read as 0.0
        this.mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Read a dataset file.
     *
     * @throws IOException if the file cannot be read
     * @throws DatasetFormatException if the content is not a dataset
     */
    public ChartCatalog read(Path file) throws IOException {
        LOG.info("Reading dataset {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    /**
     * Read a dataset from a stream.
     */
    public ChartCatalog read(InputStream in) throws IOException {
        RawDataset dataset;
        try {
            dataset = mapper.readValue(in, RawDataset.class);
        } catch (JsonProcessingException e) {
            throw new DatasetFormatException("Malformed dataset: " + e.getOriginalMessage(), e);
        }
        return ChartCatalog.load(dataset, barNumberCeiling);
    }
}
