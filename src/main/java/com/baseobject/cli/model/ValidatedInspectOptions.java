package com.baseobject.cli.model;

import java.util.Set;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Values derived from the options once they are known to be usable.
 */
@Data
@AllArgsConstructor
public class ValidatedInspectOptions {
    String jsonText;
    String source;
    Set<String> excludedNames;
}
