package com.ads.signaldetection.detector;

import com.ads.signaldetection.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Maps a detector type name to its constructor. Built once; unknown types fail at startup.
 */
@Slf4j
@Component
public class DetectorFactory {

    private final Map<String, Function<String, Detector>> constructors;

    public DetectorFactory() {
        this(Map.of(
                StatisticalDetector.TYPE, StatisticalDetector::new,
                EmaDeviationDetector.TYPE, EmaDeviationDetector::new
        ));
    }

    public DetectorFactory(Map<String, Function<String, Detector>> constructors) {
        this.constructors = Map.copyOf(constructors);
    }

    /**
     * Instantiate and configure a detector.
     *
     * @throws ConfigurationException for an unknown type or invalid options
     */
    public Detector create(String type, String detectorId, DetectorOptions options) {
        Function<String, Detector> constructor = constructors.get(normalize(type));
        if (constructor == null) {
            throw new ConfigurationException(
                    "Unknown detector type '" + type + "' for detector " + detectorId + ", known types: " + types());
        }
        Detector detector = constructor.apply(detectorId);
        detector.configure(options);
        log.info("Created detector {} (type={}, version={})", detectorId, type, detector.version());
        return detector;
    }

    public Set<String> types() {
        return constructors.keySet();
    }

    private static String normalize(String type) {
        if (type == null || type.isBlank()) {
            throw new ConfigurationException("Detector type is required");
        }
        return type.trim().toLowerCase(Locale.ROOT);
    }
}
