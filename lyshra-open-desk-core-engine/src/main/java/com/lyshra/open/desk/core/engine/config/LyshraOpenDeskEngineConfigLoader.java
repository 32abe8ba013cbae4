package com.lyshra.open.desk.core.engine.config;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskObjectMapper;
import com.lyshra.open.desk.core.engine.misc.LyshraOpenDeskObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@link LyshraOpenDeskEngineConfig} from a JSON classpath resource.
 */
@Slf4j
public final class LyshraOpenDeskEngineConfigLoader {

    public static final String DEFAULT_CONFIG_RESOURCE = "lyshra-open-desk-engine.json";

    private final ILyshraOpenDeskObjectMapper objectMapper;

    public LyshraOpenDeskEngineConfigLoader() {
        this(LyshraOpenDeskObjectMapper.getInstance());
    }

    public LyshraOpenDeskEngineConfigLoader(ILyshraOpenDeskObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public LyshraOpenDeskEngineConfig load() {
        return load(DEFAULT_CONFIG_RESOURCE, LyshraOpenDeskEngineConfigLoader.class.getClassLoader());
    }

    /**
     * Falls back to {@link LyshraOpenDeskEngineConfig#defaults()} when the resource is missing or unreadable.
     */
    public LyshraOpenDeskEngineConfig load(String resourceName, ClassLoader classLoader) {
        try (InputStream inputStream = classLoader.getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                log.info("Engine configuration [{}] not found on classpath, using defaults", resourceName);
                return LyshraOpenDeskEngineConfig.defaults();
            }
            LyshraOpenDeskEngineConfig config = objectMapper.readValue(inputStream, LyshraOpenDeskEngineConfig.class);
            log.info("Loaded engine configuration from [{}]: [{}]", resourceName, config);
            return config;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read engine configuration [{}], using defaults", resourceName, e);
            return LyshraOpenDeskEngineConfig.defaults();
        }
    }
}
