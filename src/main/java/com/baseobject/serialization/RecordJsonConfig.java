package com.baseobject.serialization;

import lombok.Builder;
import lombok.Value;

/**
 * Output settings of {@link RecordJson}.
 */
@Value
@Builder
public class RecordJsonConfig {

    /** Pretty-print the JSON text. */
    @Builder.Default
    boolean indentOutput = false;

    /** Sort mapping keys when the caller does not say otherwise. */
    @Builder.Default
    boolean sortKeys = false;
}
