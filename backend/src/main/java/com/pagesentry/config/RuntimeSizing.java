package com.pagesentry.config;

/**
 * Pool, queue and cache sizes resolved once from the detected core count.
 */
public record RuntimeSizing(
    int cores,
    int pageConcurrency,
    int hitQueueCapacity,
    int screenshotQueueCapacity,
    int htmlCacheCapacity,
    int cpuPoolSize,
    int ioPoolSize,
    int dbPoolSize,
    int screenshotWorkers
) {
    public static RuntimeSizing from(AnalyzerProperties properties) {
        AnalyzerProperties.Sizing sizing = properties.getSizing();
        int cores = sizing.getCores() > 0 ? sizing.getCores() : Runtime.getRuntime().availableProcessors();
        cores = Math.max(1, cores);
        int configuredWorkers = properties.getEvidence().getScreenshotWorkers();
        int screenshotWorkers = configuredWorkers > 0 ? configuredWorkers : Math.min(cores, 8);
        return new RuntimeSizing(
            cores,
            Math.min(cores * sizing.getPageConcurrencyPerCore(), sizing.getPageConcurrencyMax()),
            Math.min(cores * sizing.getHitQueuePerCore(), sizing.getHitQueueMax()),
            Math.min(cores * sizing.getScreenshotQueuePerCore(), sizing.getScreenshotQueueMax()),
            Math.min(cores * sizing.getHtmlCachePerCore(), sizing.getHtmlCacheMax()),
            Math.max(2, cores),
            Math.min(Math.max(4, cores * 4), 64),
            Math.min(Math.max(2, cores), 16),
            screenshotWorkers
        );
    }
}
