package com.quicklook.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Resolves the quick-look configuration.
 * Order: -Dquicklook.config file, classpath quicklook_config.json, defaults;
 * individual system properties override single settings afterwards.
 */
public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    public static final String DEFAULT_RESOURCE = "/quicklook_config.json";

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static QuicklookConfig resolve() {
        QuicklookConfig config = loadBase();
        applySystemOverrides(config);
        config.validate();
        logger.info("Active instrument: {}", config.getActiveInstrument());
        return config;
    }

    public static QuicklookConfig read(InputStream is) throws IOException {
        return mapper.readValue(is, QuicklookConfig.class);
    }

    private static QuicklookConfig loadBase() {
        // 1. External file
        String external = System.getProperty("quicklook.config");
        if (external != null && !external.isEmpty()) {
            File f = new File(external);
            try {
                return mapper.readValue(f, QuicklookConfig.class);
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration file " + f.getAbsolutePath(), e);
            }
        }

        // 2. Classpath
        try (InputStream is = ConfigResolver.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is != null) {
                return read(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse " + DEFAULT_RESOURCE, e);
        }

        // 3. Defaults
        logger.warn("No {} found, using built-in defaults", DEFAULT_RESOURCE);
        return new QuicklookConfig();
    }

    static void applySystemOverrides(QuicklookConfig config) {
        if (config.pipeline == null) {
            config.pipeline = new PipelineSettings();
        }
        String instrument = System.getProperty("quicklook.instrument");
        if (instrument != null && !instrument.isEmpty()) {
            config.activeInstrument = instrument;
        }
        String flatDir = System.getProperty("quicklook.flat.dir");
        if (flatDir != null && !flatDir.isEmpty()) {
            config.pipeline.flatDirectory = flatDir;
        }
        String useFlats = System.getProperty("quicklook.use.flats");
        if (useFlats != null && !useFlats.isEmpty()) {
            config.pipeline.useFlats = "true".equalsIgnoreCase(useFlats);
        }
        String dataDir = System.getProperty("quicklook.data.dir");
        if (dataDir != null && !dataDir.isEmpty()) {
            config.pipeline.dataDirectory = dataDir;
        }
    }

    public static String resolveCatalogDbPath(PipelineSettings settings) {
        if (settings.catalogDbPath != null && !settings.catalogDbPath.isEmpty()) {
            return settings.catalogDbPath;
        }
        return settings.dataDirectory + File.separator + "quicklook_catalog.db";
    }
}
