package com.baseobject.cli;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.baseobject.cli.exception.OptionsValidationException;
import com.baseobject.cli.logging.LoggingConfigurer;
import com.baseobject.cli.model.InspectOptions;
import com.baseobject.cli.model.ValidatedInspectOptions;
import com.baseobject.cli.output.InspectResultsPrinter;
import com.baseobject.cli.validation.InspectOptionsValidator;
import com.baseobject.core.BaseObject;
import com.baseobject.core.ImmutableBaseObject;
import com.baseobject.core.MutableBaseObject;
import com.baseobject.core.exception.BaseObjectException;
import com.baseobject.serialization.RecordJson;
import com.baseobject.serialization.RecordJsonConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Builds a record from a JSON object and prints its projection.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        description = "Builds a record from a JSON object and prints its field mapping as JSON."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    @Mixin
    private InspectOptions options;

    @Spec
    private CommandSpec spec;

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final InspectResultsPrinter printer = new InspectResultsPrinter();

    @Override
    public Integer call() {
        LoggingConfigurer.apply(options.getLogLevel());

        ValidatedInspectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error(error);
            }
            return 1;
        }

        printer.printBanner(options, validated);

        RecordJson json = new RecordJson(RecordJsonConfig.builder().indentOutput(options.isIndent()).build());
        try {
            Map<String, Object> mapping = json.readMapping(validated.getJsonText());
            BaseObject record = options.isImmutable()
                    ? BaseObject.fromMapping(ImmutableBaseObject.class, mapping)
                    : BaseObject.fromMapping(MutableBaseObject.class, mapping);
            log.debug("Built {} with fields {}", record.getClass().getSimpleName(), record.keys());

            Map<String, Object> projected = record.toMapping(validated.getExcludedNames(), options.getSort());
            PrintWriter out = spec.commandLine().getOut();
            out.println(json.writeMapping(projected, false));
            out.flush();

            if (options.isSummary()) {
                printer.printSummary(record);
            }
            return 0;
        } catch (BaseObjectException e) {
            printer.printFailure(e);
            return 1;
        }
    }
}
