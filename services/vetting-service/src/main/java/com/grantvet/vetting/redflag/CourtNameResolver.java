package com.grantvet.vetting.redflag;

import com.grantvet.common.exception.ErrorCode;
import com.grantvet.common.exception.GrantVetException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Resolves short federal court identifiers ("nysd", "ca9") to display names.
 * Unknown codes resolve to themselves.
 */
@Slf4j
public class CourtNameResolver {

    static final String DEFAULT_RESOURCE = "court-names.properties";

    private final Map<String, String> names;

    public CourtNameResolver(Map<String, String> names) {
        this.names = Map.copyOf(names);
    }

    public static CourtNameResolver fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static CourtNameResolver fromClasspath(String resource) {
        ClassLoader loader = CourtNameResolver.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Court name table {} not found, court codes will be shown as-is", resource);
                return new CourtNameResolver(Map.of());
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            Map<String, String> names = new HashMap<>();
            for (String code : properties.stringPropertyNames()) {
                names.put(code.toLowerCase(Locale.ROOT), properties.getProperty(code));
            }
            log.debug("Loaded {} court names from {}", names.size(), resource);
            return new CourtNameResolver(names);
        } catch (IOException e) {
            throw new GrantVetException(ErrorCode.CONFIGURATION_INVALID, "Unable to read court name table " + resource, e);
        }
    }

    public String resolve(String courtCode) {
        if (courtCode == null || courtCode.isBlank()) {
            return "Unknown court";
        }
        return names.getOrDefault(courtCode.trim().toLowerCase(Locale.ROOT), courtCode);
    }
}
