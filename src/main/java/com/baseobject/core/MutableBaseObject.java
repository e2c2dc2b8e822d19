package com.baseobject.core;

import java.util.Map;

import com.baseobject.core.guard.OpenGuard;
import com.baseobject.core.ops.RecordFactory;

/**
 * Record whose fields can always be written, added and deleted.
 */
public class MutableBaseObject extends BaseObject {

    static {
        RecordFactory.register(MutableBaseObject.class, MutableBaseObject::new);
    }

    public MutableBaseObject() {
        this(Map.of());
    }

    public MutableBaseObject(Map<String, ?> values) {
        super(values, type -> OpenGuard.INSTANCE);
    }

    @Override
    public MutableBaseObject copy() {
        return RecordFactory.create(getClass(), toMapping());
    }
}
