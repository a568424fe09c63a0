package com.conveyal.otpdriver.results;

import com.csvreader.CsvWriter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTWriter;

import java.io.IOException;
import java.io.Writer;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Writes result rows as CSV, with geometries in the WKT column format understood by most GIS software.
 */
public class CsvResultWriter {

    public static final char CSV_DELIMITER = ',';

    static final String[] LEG_HEADER = {
            "fromId", "toId", "itinerary", "duration", "startTime", "endTime", "walkTime", "transitTime",
            "waitingTime", "walkDistance", "transfers", "leg", "mode", "route", "agencyName", "distance",
            "legDuration", "legStartTime", "legEndTime", "fromPlace", "fromStopId", "toPlace", "toStopId", "geometry"
    };

    static final String[] ISOCHRONE_HEADER = { "fromId", "time", "geometry" };

    static final String[] ERROR_HEADER = { "fromId", "toId", "error" };

    private final WKTWriter wktWriter = new WKTWriter();

    public void writeLegRows (List<LegRow> rows, Writer out) throws IOException {
        CsvWriter csvWriter = new CsvWriter(out, CSV_DELIMITER);
        csvWriter.writeRecord(LEG_HEADER);
        for (LegRow row : rows) {
            csvWriter.writeRecord(new String[] {
                    row.fromId,
                    row.toId,
                    Integer.toString(row.itinerary),
                    Long.toString(row.duration),
                    time(row.startTime),
                    time(row.endTime),
                    Long.toString(row.walkTime),
                    Long.toString(row.transitTime),
                    Long.toString(row.waitingTime),
                    Double.toString(row.walkDistance),
                    Integer.toString(row.transfers),
                    Integer.toString(row.leg),
                    row.mode,
                    row.route,
                    row.agencyName,
                    Double.toString(row.distance),
                    Double.toString(row.legDuration),
                    time(row.legStartTime),
                    time(row.legEndTime),
                    row.fromPlace,
                    row.fromStopId,
                    row.toPlace,
                    row.toStopId,
                    wkt(row.geometry)
            });
        }
        csvWriter.flush();
    }

    public void writeIsochroneBands (List<IsochroneBand> bands, Writer out) throws IOException {
        CsvWriter csvWriter = new CsvWriter(out, CSV_DELIMITER);
        csvWriter.writeRecord(ISOCHRONE_HEADER);
        for (IsochroneBand band : bands) {
            csvWriter.writeRecord(new String[] { band.fromId, Integer.toString(band.time), wkt(band.geometry) });
        }
        csvWriter.flush();
    }

    /** One row per failed planner request, so the pairs can be inspected or retried. */
    public void writeErrors (List<PlanResult> results, Writer out) throws IOException {
        CsvWriter csvWriter = new CsvWriter(out, CSV_DELIMITER);
        csvWriter.writeRecord(ERROR_HEADER);
        for (PlanResult result : results) {
            if (!result.isSuccess()) {
                csvWriter.writeRecord(new String[] { result.request.fromId, result.request.toId, result.error });
            }
        }
        csvWriter.flush();
    }

    private String wkt (Geometry geometry) {
        return geometry == null ? "" : wktWriter.write(geometry);
    }

    private static String time (ZonedDateTime dateTime) {
        return dateTime == null ? "" : dateTime.toOffsetDateTime().toString();
    }

}
