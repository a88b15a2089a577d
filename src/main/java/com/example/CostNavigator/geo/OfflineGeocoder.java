package com.example.CostNavigator.geo;

import com.example.CostNavigator.config.NavigatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Postal code lookup over a GeoNames-style tab separated table:
 * <pre>
 * country  postal_code  place  admin1_name  admin1_code  admin2_name  admin2_code  admin3_name  admin3_code  latitude  longitude  accuracy
 * </pre>
 * The table is read once at startup and never changes afterwards.
 */
@Component
public class OfflineGeocoder implements Geocoder {

    private static final Logger log = LoggerFactory.getLogger(OfflineGeocoder.class);

    private static final Pattern ZIP5 = Pattern.compile("\\d{5}");
    private static final int COL_POSTAL_CODE = 1;
    private static final int COL_LATITUDE = 9;
    private static final int COL_LONGITUDE = 10;

    private final Map<String, GeoPoint> points;

    @Autowired
    public OfflineGeocoder(ResourceLoader resourceLoader, NavigatorProperties properties) {
        Resource dataset = resourceLoader.getResource(properties.getGeocoding().getDataset());
        if (!dataset.exists()) {
            throw new IllegalStateException("Geocoding dataset not found: " + properties.getGeocoding().getDataset());
        }
        try (InputStream in = dataset.getInputStream()) {
            this.points = load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read geocoding dataset " + dataset.getDescription(), e);
        }
        log.info("Loaded {} postal codes from {}", points.size(), dataset.getDescription());
    }

    OfflineGeocoder(Map<String, GeoPoint> points) {
        this.points = Collections.unmodifiableMap(new HashMap<>(points));
    }

    @Override
    public Optional<GeoPoint> resolve(String postalCode) {
        if (postalCode == null) {
            return Optional.empty();
        }
        String key = postalCode.trim();
        if (key.length() == 10 && key.charAt(5) == '-') {
            key = key.substring(0, 5);
        }
        if (!ZIP5.matcher(key).matches()) {
            return Optional.empty();
        }
        return Optional.ofNullable(points.get(key));
    }

    public int size() {
        return points.size();
    }

    static Map<String, GeoPoint> load(InputStream in) throws IOException {
        Map<String, GeoPoint> loaded = new HashMap<>();
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] cols = line.split("\t", -1);
                if (cols.length <= COL_LONGITUDE || !ZIP5.matcher(cols[COL_POSTAL_CODE].trim()).matches()) {
                    skipped++;
                    continue;
                }
                try {
                    GeoPoint point = new GeoPoint(
                            Double.parseDouble(cols[COL_LATITUDE].trim()),
                            Double.parseDouble(cols[COL_LONGITUDE].trim()));
                    loaded.putIfAbsent(cols[COL_POSTAL_CODE].trim(), point);
                } catch (IllegalArgumentException e) {
                    skipped++;
                }
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed geocoding rows", skipped);
        }
        return Collections.unmodifiableMap(loaded);
    }
}
