package com.baseobject.serialization;

import java.io.IOException;

import com.baseobject.core.BaseObject;
import com.baseobject.core.Tuple;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Writes nested records as their field mappings and tuples as arrays.
 */
public class RecordJsonModule extends SimpleModule {

    private static final long serialVersionUID = 1L;

    public RecordJsonModule() {
        super("RecordJsonModule");
        addSerializer(BaseObject.class, new BaseObjectSerializer());
        addSerializer(Tuple.class, new TupleSerializer());
    }

    static class BaseObjectSerializer extends StdSerializer<BaseObject> {

        private static final long serialVersionUID = 1L;

        BaseObjectSerializer() {
            super(BaseObject.class);
        }

        @Override
        public void serialize(BaseObject value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            provider.defaultSerializeValue(value.toMapping(), gen);
        }
    }

    static class TupleSerializer extends StdSerializer<Tuple> {

        private static final long serialVersionUID = 1L;

        TupleSerializer() {
            super(Tuple.class);
        }

        @Override
        public void serialize(Tuple value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            for (Object element : value) {
                provider.defaultSerializeValue(element, gen);
            }
            gen.writeEndArray();
        }
    }
}
