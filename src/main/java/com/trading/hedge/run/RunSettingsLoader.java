package com.trading.hedge.run;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.hedge.error.HedgeAnalyticsException;

/** Reads {@link RunSettings} from JSON files, classpath resources or strings. */
public final class RunSettingsLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RunSettingsLoader() {
    }

    public static RunSettings fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new HedgeAnalyticsException("Failed to load run settings from " + path, e);
        }
    }

    public static RunSettings fromResource(String resource) {
        InputStream in = RunSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new HedgeAnalyticsException("Run settings resource not found: " + resource);
        }
        try (in) {
            return read(in);
        } catch (IOException e) {
            throw new HedgeAnalyticsException("Failed to load run settings from " + resource, e);
        }
    }

    public static RunSettings parse(String json) {
        try {
            RunSettings settings = MAPPER.readValue(json, RunSettings.class);
            settings.validate();
            return settings;
        } catch (IOException e) {
            throw new HedgeAnalyticsException("Failed to parse run settings", e);
        }
    }

    private static RunSettings read(InputStream in) throws IOException {
        RunSettings settings = MAPPER.readValue(in, RunSettings.class);
        settings.validate();
        return settings;
    }
}
