package com.pagesentry.analyze.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.pagesentry.analyze.model.PageBatch;
import com.pagesentry.analyze.model.PageContent;
import com.pagesentry.analyze.util.PayloadAliases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps the fetcher's ingest payload, batched or legacy single-shot, onto a {@link PageBatch}.
 */
@Component
public class IngestPayloadParser {
    private static final Logger log = LoggerFactory.getLogger(IngestPayloadParser.class);
    static final String UNKNOWN_TASK = "unknown-task";
    private static final List<String> PAGE_URL_FIELDS = List.of("final_url", "finalUrl", "url", "URL");
    private static final List<String> BATCH_NUM_FIELDS = List.of("batch_num", "batchNum");
    private static final List<String> COMPLETE_FIELDS = List.of("is_complete", "isComplete");

    public PageBatch parse(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("ingest payload must be a JSON object");
        }
        String taskId = PayloadAliases.firstText(payload, PayloadAliases.TASK_ID_FIELDS);
        if (taskId == null) {
            taskId = UNKNOWN_TASK;
        }

        JsonNode pagesNode = PayloadAliases.firstArray(payload, PayloadAliases.PAGES_FIELDS);
        if (pagesNode == null && hasAny(payload, PayloadAliases.PAGES_FIELDS)) {
            throw new IllegalArgumentException("pages must be an array");
        }
        List<PageContent> pages = new ArrayList<>();
        if (pagesNode != null) {
            int index = 0;
            for (JsonNode page : pagesNode) {
                index++;
                if (!page.isObject()) {
                    log.warn("Skipping malformed page #{} in task {}: expected an object, got {}",
                        index, taskId, page.getNodeType());
                    continue;
                }
                pages.add(new PageContent(
                    PayloadAliases.firstText(page, PAGE_URL_FIELDS),
                    PayloadAliases.firstText(page, PayloadAliases.HTML_FIELDS)
                ));
            }
        }

        String mainUrl = PayloadAliases.firstText(payload, PayloadAliases.MAIN_URL_FIELDS);
        if (mainUrl == null) {
            throw new IllegalArgumentException("main_url is required");
        }

        boolean legacy = !hasAny(payload, BATCH_NUM_FIELDS) && !hasAny(payload, COMPLETE_FIELDS);
        if (legacy) {
            return PageBatch.singleShot(taskId, mainUrl, pages);
        }
        int batchNum = intField(payload, BATCH_NUM_FIELDS, 1);
        if (batchNum < 1) {
            throw new IllegalArgumentException("batch_num must be >= 1");
        }
        boolean complete = booleanField(payload, COMPLETE_FIELDS);
        return new PageBatch(taskId, mainUrl, batchNum, complete, pages);
    }

    private static boolean hasAny(JsonNode node, List<String> fields) {
        for (String field : fields) {
            if (node.has(field) && !node.get(field).isNull()) {
                return true;
            }
        }
        return false;
    }

    private static int intField(JsonNode node, List<String> fields, int defaultValue) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.canConvertToInt()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(field + " must be an integer", e);
                }
            }
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return defaultValue;
    }

    private static boolean booleanField(JsonNode node, List<String> fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isBoolean()) {
                return value.booleanValue();
            }
            return Boolean.parseBoolean(value.asText().trim());
        }
        return false;
    }
}
