package com.pagesentry.analyze.storage;

import com.pagesentry.analyze.evidence.AnalyzerMetrics;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.analyze.util.HashUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

/**
 * Gzips page HTML into the archive bucket as {@code <task_id>/<sha256(url)>.html.gz}.
 */
@Component
public class HtmlArchiver {
    private static final Logger log = LoggerFactory.getLogger(HtmlArchiver.class);

    private final ObjectStore objectStore;
    private final AnalyzerProperties properties;
    private final AnalyzerMetrics metrics;

    public HtmlArchiver(ObjectStore objectStore, AnalyzerProperties properties, AnalyzerMetrics metrics) {
        this.objectStore = objectStore;
        this.properties = properties;
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return properties.getStorage().isArchiveHtml();
    }

    public StageResult<String> archive(String taskId, String url, String html) {
        if (!isEnabled() || html == null || html.isEmpty()) {
            return StageResult.failed(FailureReasons.DISABLED, "html archiving disabled");
        }
        String key = objectKey(taskId, url);
        StageResult<String> stored = objectStore.put(
            properties.getStorage().getArchiveBucket(), key, gzip(html), "application/gzip"
        );
        if (!stored.isOk()) {
            metrics.storageError();
            log.warn("HTML archive failed task={} url={} reason={}", taskId, url, stored.errorCode());
        }
        return stored;
    }

    static String objectKey(String taskId, String url) {
        return taskId + "/" + HashUtils.sha256Hex(url) + ".html.gz";
    }

    static byte[] gzip(String html) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(html.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
