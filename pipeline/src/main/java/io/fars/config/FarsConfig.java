package io.fars.config;

import java.nio.file.Path;

/**
 * Driver settings. System properties win over environment variables, which win over defaults.
 */
public record FarsConfig(
        Path dataDir,
        Path outputDir,
        int workers,
        int mapWidth,
        int mapHeight
) {
    public FarsConfig {
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1: " + workers);
        if (mapWidth < 1 || mapHeight < 1) throw new IllegalArgumentException("map size must be positive: " + mapWidth + "x" + mapHeight);
    }

    public static FarsConfig defaults() {
        return new FarsConfig(Path.of("."), Path.of("./out"), 1, 800, 600);
    }

    public static FarsConfig fromEnv() {
        Path data = Path.of(setting("fars.data", "FARS_DATA", "."));
        Path out = Path.of(setting("fars.out", "FARS_OUT", "./out"));
        int workers = Integer.parseInt(setting("fars.workers", "FARS_WORKERS", "1"));
        int width = Integer.parseInt(setting("fars.map.width", "FARS_MAP_WIDTH", "800"));
        int height = Integer.parseInt(setting("fars.map.height", "FARS_MAP_HEIGHT", "600"));
        return new FarsConfig(data, out, workers, width, height);
    }

    public FarsConfig withDataDir(Path dir) {
        return new FarsConfig(dir, outputDir, workers, mapWidth, mapHeight);
    }

    public FarsConfig withWorkers(int n) {
        return new FarsConfig(dataDir, outputDir, n, mapWidth, mapHeight);
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
