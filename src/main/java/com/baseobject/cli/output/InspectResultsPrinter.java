package com.baseobject.cli.output;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.baseobject.cli.model.InspectOptions;
import com.baseobject.cli.model.ValidatedInspectOptions;
import com.baseobject.core.BaseObject;
import com.baseobject.core.ImmutableBaseObject;

/**
 * Responsible only for logging the "inspect" command's banner and summary.
 * The projected record itself goes to the command's output stream.
 */
public class InspectResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(InspectResultsPrinter.class);

    public void printBanner(InspectOptions o, ValidatedInspectOptions v) {
        log.info("=================================================");
        log.info("Record Inspector");
        log.info("=================================================");
        log.info("Source: {}", v.getSource());
        log.info("Variant: {}", o.isImmutable() ? "immutable" : "mutable");
        log.info("Excluded Fields: {}", v.getExcludedNames().isEmpty() ? "None" : String.join(", ", v.getExcludedNames()));
        log.info("Sort Order: {}", o.getSort());
        log.info("=================================================");
    }

    public void printSummary(BaseObject record) {
        log.info("");
        log.info("Record Summary:");
        log.info("  Type: {}", record.getClass().getSimpleName());
        log.info("  Fields: {}", record.size());
        for (Map.Entry<String, Object> entry : record) {
            Object value = entry.getValue();
            log.info("  {}: {}", entry.getKey(), value == null ? "null" : value.getClass().getSimpleName());
        }

        if (record instanceof ImmutableBaseObject immutable) {
            log.info("");
            log.info("Locks:");
            log.info("  Object Locked: {}", immutable.isLocked());
            log.info("  Locked Fields: {}", immutable.lockedFields().isEmpty() ? "None" : String.join(", ", immutable.lockedFields()));
        }
        log.info("=================================================");
    }

    public void printFailure(Exception e) {
        log.error("Inspection failed: {}", e.getMessage());
    }
}
