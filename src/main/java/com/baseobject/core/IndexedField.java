package com.baseobject.core;

import lombok.Value;

/**
 * A field together with its position in insertion order.
 */
@Value
public class IndexedField {

    int index;
    String name;
    Object value;
}
