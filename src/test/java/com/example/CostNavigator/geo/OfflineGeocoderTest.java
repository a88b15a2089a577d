package com.example.CostNavigator.geo;

import com.example.CostNavigator.config.NavigatorProperties;
import com.example.CostNavigator.exception.UnknownLocationException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OfflineGeocoderTest {

    @Test
    void loadsGeoNamesColumnsAndSkipsBadRows() throws Exception {
        String table = String.join("\n",
                "# comment",
                "US\t10001\tNew York\tNew York\tNY\tNew York\t061\t\t\t40.7484\t-73.9967\t4",
                "US\t1234\tBad\tX\tX\tX\t0\t\t\t1.0\t1.0\t1",
                "US\t99999\tBroken\tX\tX\tX\t0\t\t\tnorth\t1.0\t1",
                "US\t90210\tBeverly Hills\tCalifornia\tCA\tLos Angeles\t037\t\t\t34.0901\t-118.4065\t4",
                "");

        Map<String, GeoPoint> points = OfflineGeocoder.load(
                new ByteArrayInputStream(table.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, points.size());
        assertEquals(new GeoPoint(34.0901, -118.4065), points.get("90210"));
    }

    @Test
    void resolvesZipPlusFour() {
        OfflineGeocoder geocoder = new OfflineGeocoder(Map.of("10001", new GeoPoint(40.7484, -73.9967)));

        assertTrue(geocoder.resolve("10001-1234").isPresent());
        assertTrue(geocoder.resolve(" 10001 ").isPresent());
        assertTrue(geocoder.resolve("1000").isEmpty());
        assertTrue(geocoder.resolve(null).isEmpty());
    }

    @Test
    void locateFailsForUnknownZip() {
        OfflineGeocoder geocoder = new OfflineGeocoder(Map.of());

        assertThrows(UnknownLocationException.class, () -> geocoder.locate("00000"));
    }

    @Test
    void bundledDatasetCoversNewYork() {
        OfflineGeocoder geocoder = new OfflineGeocoder(new DefaultResourceLoader(), new NavigatorProperties());

        assertTrue(geocoder.size() > 100);
        assertEquals(new GeoPoint(40.7484, -73.9967), geocoder.locate("10001"));
    }

    @Test
    void missingDatasetFailsStartup() {
        NavigatorProperties properties = new NavigatorProperties();
        properties.getGeocoding().setDataset("classpath:geo/missing.tsv");

        assertThrows(IllegalStateException.class,
                () -> new OfflineGeocoder(new DefaultResourceLoader(), properties));
    }
}
