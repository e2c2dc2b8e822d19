package com.baseobject.cli;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.baseobject.core.Attributes;
import com.baseobject.core.BaseObject;
import com.baseobject.core.ImmutableBaseObject;
import com.baseobject.core.MutableBaseObject;
import com.baseobject.core.exception.BaseObjectException;
import com.baseobject.core.exception.ImmutableFieldException;
import com.baseobject.core.ops.RecordFactory;
import com.baseobject.core.schema.FieldSchema;
import com.baseobject.core.schema.FieldSchemaRegistry;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Walks through the mutable and immutable record behaviours and prints each outcome.
 */
@Command(
        name = "demo",
        mixinStandardHelpOptions = true,
        description = "Demonstrates construction, locking, merging and cloning of records."
)
public class DemoCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DemoCommand.class);

    public static class Person extends MutableBaseObject {

        static {
            RecordFactory.register(Person.class, Person::new);
            FieldSchemaRegistry.register(Person.class, FieldSchema.builder()
                    .declare("name", String.class)
                    .declare("age", Integer.class)
                    .build());
        }

        public Person(Map<String, ?> values) {
            super(values);
        }
    }

    public static class FrozenPerson extends ImmutableBaseObject {

        static {
            RecordFactory.register(FrozenPerson.class, FrozenPerson::new);
            FieldSchemaRegistry.register(FrozenPerson.class, FieldSchema.builder()
                    .declare("name", String.class)
                    .declare("age", Integer.class)
                    .build());
        }

        public FrozenPerson(Map<String, ?> values) {
            super(values);
        }
    }

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            mutableWrite(out);
            immutableWrite(out);
            union(out);
            lockNewField(out);
            deepClone(out);
            textRoundTrip(out);
        } catch (BaseObjectException e) {
            log.error("Demo failed: {}", e.getMessage());
            return 1;
        } finally {
            out.flush();
        }
        log.info("Demo completed");
        return 0;
    }

    private void mutableWrite(PrintWriter out) {
        Person person = new Person(Attributes.of("name", "Alice", "age", "30"));
        out.println("Constructed: " + person);
        person.set("age", 31);
        out.println("After set age=31: age=" + person.get("age"));
    }

    private void immutableWrite(PrintWriter out) {
        FrozenPerson person = new FrozenPerson(Attributes.of("name", "Alice", "age", 30));
        try {
            person.set("age", 31);
            out.println("Unexpected: immutable write accepted");
        } catch (ImmutableFieldException e) {
            out.println("Immutable write rejected: " + e.getMessage());
        }
    }

    private void union(PrintWriter out) {
        MutableBaseObject left = new MutableBaseObject(Attributes.of("x", 1, "y", 2));
        MutableBaseObject right = new MutableBaseObject(Attributes.of("x", 5, "z", 9));
        out.println("Union: " + left.plus(right));
        out.println("Difference: " + left.minus(right));
    }

    private void lockNewField(PrintWriter out) {
        ImmutableBaseObject record = new ImmutableBaseObject(Attributes.of("name", "Bob"));
        record.lock("age", true, 40);
        out.println("Locked new field: age=" + record.get("age") + ", locked=" + record.isLocked("age"));
        try {
            record.set("age", 41);
            out.println("Unexpected: locked field accepted a write");
        } catch (ImmutableFieldException e) {
            out.println("Locked field rejected write: " + e.getMessage());
        }
    }

    private void deepClone(PrintWriter out) {
        List<Object> tags = new ArrayList<>(List.of("a", "b"));
        MutableBaseObject source = new MutableBaseObject(Attributes.of("tags", tags,
                "owner", new FrozenPerson(Attributes.of("name", "Carol", "age", 52))));
        BaseObject clone = source.deepClone(true);

        ((List<?>) clone.get("tags")).clear();
        ((BaseObject) clone.get("owner")).set("age", 53);

        out.println("Source after mutating clone: " + source);
        out.println("Clone: " + clone);
    }

    private void textRoundTrip(PrintWriter out) {
        Person person = new Person(Attributes.of("name", "Dave", "age", 44));
        String text = person.toText();
        Person parsed = BaseObject.fromText(Person.class, text);
        out.println("Text: " + text);
        out.println("Round trip equal: " + person.equals(parsed));
    }
}
