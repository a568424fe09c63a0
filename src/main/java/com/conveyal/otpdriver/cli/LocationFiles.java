package com.conveyal.otpdriver.cli;

import com.conveyal.otpdriver.OtpDriverException;
import com.conveyal.otpdriver.client.IsochroneRequest;
import com.conveyal.otpdriver.client.LatLon;
import com.conveyal.otpdriver.client.PlanRequest;
import com.csvreader.CsvReader;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads batches of locations from CSV files with a header row. Columns are found by name, so extra columns are
 * allowed and ignored.
 */
public class LocationFiles {

    public static final char CSV_DELIMITER = ',';

    /**
     * Origin-destination pairs, with columns:
     * <pre>
     *   fromId,fromLat,fromLon,toId,toLat,toLon
     * </pre>
     */
    public static List<PlanRequest> readPairs (File file) throws IOException {
        List<PlanRequest> requests = new ArrayList<>();
        CsvReader csvReader = open(file, "fromId", "fromLat", "fromLon", "toId", "toLat", "toLon");
        try {
            while (csvReader.readRecord()) {
                requests.add(new PlanRequest(
                        csvReader.get("fromId"),
                        latLon(csvReader, file, "fromLat", "fromLon"),
                        csvReader.get("toId"),
                        latLon(csvReader, file, "toLat", "toLon")
                ));
            }
        } finally {
            csvReader.close();
        }
        return requests;
    }

    /**
     * Isochrone origins, with columns:
     * <pre>
     *   id,lat,lon
     * </pre>
     */
    public static List<IsochroneRequest> readOrigins (File file) throws IOException {
        List<IsochroneRequest> requests = new ArrayList<>();
        CsvReader csvReader = open(file, "id", "lat", "lon");
        try {
            while (csvReader.readRecord()) {
                requests.add(new IsochroneRequest(csvReader.get("id"), latLon(csvReader, file, "lat", "lon")));
            }
        } finally {
            csvReader.close();
        }
        return requests;
    }

    private static CsvReader open (File file, String... requiredColumns) throws IOException {
        if (!file.isFile()) {
            throw OtpDriverException.badRequest("Input file does not exist: " + file);
        }
        CsvReader csvReader = new CsvReader(file.getAbsolutePath(), CSV_DELIMITER, StandardCharsets.UTF_8);
        csvReader.setTrimWhitespace(true);
        if (!csvReader.readHeaders()) {
            csvReader.close();
            throw OtpDriverException.badRequest("Input file is empty: " + file);
        }
        for (String column : requiredColumns) {
            if (csvReader.getIndex(column) < 0) {
                csvReader.close();
                throw OtpDriverException.badRequest("Input file " + file + " lacks column " + column);
            }
        }
        return csvReader;
    }

    private static LatLon latLon (CsvReader csvReader, File file, String latColumn, String lonColumn)
            throws IOException {
        try {
            return new LatLon(Double.parseDouble(csvReader.get(latColumn)),
                    Double.parseDouble(csvReader.get(lonColumn)));
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException, as are out of range coordinates.
            throw OtpDriverException.badRequest(String.format("%s line %d: invalid coordinates %s,%s",
                    file.getName(), csvReader.getCurrentRecord() + 2,
                    csvReader.get(latColumn), csvReader.get(lonColumn)));
        }
    }

}
