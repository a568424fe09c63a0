package com.conveyal.otpdriver.model.json_serialization;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PolyUtilTest {

    private static final double DELTA = 1e-9;

    @Test
    public void testDecodeReferenceExample () {
        Coordinate[] coordinates = PolyUtil.decode("_p~iF~ps|U_ulLnnqC_mqNvxq`@");
        assertEquals(3, coordinates.length);
        assertEquals(38.5, coordinates[0].y, DELTA);
        assertEquals(-120.2, coordinates[0].x, DELTA);
        assertEquals(40.7, coordinates[1].y, DELTA);
        assertEquals(-120.95, coordinates[1].x, DELTA);
        assertEquals(43.252, coordinates[2].y, DELTA);
        assertEquals(-126.453, coordinates[2].x, DELTA);
    }

    @Test
    public void testEmptyAndTruncated () {
        assertEquals(0, PolyUtil.decode("").length);
        // Latitude present but longitude missing.
        assertThrows(IllegalArgumentException.class, () -> PolyUtil.decode("_p~iF"));
        assertThrows(IllegalArgumentException.class, () -> PolyUtil.decode("_p~iF~ps|"));
    }

}
