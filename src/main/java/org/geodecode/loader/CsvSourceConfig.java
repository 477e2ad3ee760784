package org.geodecode.loader;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Where {@link CsvLocationSource} reads its rows from.
 */
@Value
@Builder
public class CsvSourceConfig {
    public static final String DEFAULT_RESOURCE = "/rg_cities1000.csv";

    /**
     * Optional filesystem file. When set and present it wins over the classpath resource.
     */
    Path path;

    /**
     * Classpath resource used when {@link #path} is unset or missing.
     */
    @Builder.Default
    String resource = DEFAULT_RESOURCE;

    /**
     * @return config reading the bundled dataset.
     */
    public static CsvSourceConfig defaults() {
        return CsvSourceConfig.builder().build();
    }
}
