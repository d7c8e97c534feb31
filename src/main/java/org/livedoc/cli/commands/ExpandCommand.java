package org.livedoc.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.livedoc.cli.CommandLineInterface;
import org.livedoc.compiler.LiveRegistry;
import org.livedoc.compiler.diagnostics.DiagnosticsEngine;
import org.livedoc.compiler.diagnostics.LiveFileError;
import org.livedoc.compiler.diagnostics.LiveParseException;
import org.livedoc.compiler.expansion.ExpansionSettings;
import org.livedoc.compiler.frontend.io.JsonLiveParser;
import org.livedoc.compiler.frontend.io.SourceLoader;
import org.livedoc.compiler.model.CrateModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that registers JSON node-tree files and runs one expansion pass over them.
 * <p>
 * Exit codes: 0 on success, 1 if expansion reported errors and
 * {@code livedoc.diagnostics.fail-on-error} is set, 2 if a file cannot be read or parsed.
 */
@Command(
    name = "expand",
    description = "Register live documents and expand them, printing diagnostics"
)
public class ExpandCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ExpandCommand.class);

    static final int EXIT_EXPANSION_ERRORS = 1;
    static final int EXIT_INPUT_ERROR = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec commandSpec;

    @Option(
        names = {"-m", "--module"},
        required = true,
        paramLabel = "CRATE:MODULE=FILE",
        description = "A module to register; repeat for several. Use classpath:<path> for classpath resources."
    )
    private List<String> modules;

    @Option(
        names = {"--json"},
        description = "Print the result as JSON instead of text"
    )
    private boolean json;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public Integer call() {
        PrintWriter out = commandSpec.commandLine().getOut();
        PrintWriter err = commandSpec.commandLine().getErr();

        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        LiveRegistry registry = new LiveRegistry(new JsonLiveParser(objectMapper), ExpansionSettings.fromConfig(config));
        for (String module : modules) {
            ModuleArgument argument;
            try {
                argument = ModuleArgument.parse(module);
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_INPUT_ERROR;
            }
            try {
                SourceLoader.LoadResult loaded = SourceLoader.load(argument.location());
                registry.parseLiveFile(loaded.logicalName(), argument.crateModule().crate(),
                        argument.crateModule().module(), loaded.content());
                LOG.debug("Registered {} from {}", argument.crateModule(), loaded.logicalName());
            } catch (IOException e) {
                err.println("Cannot read " + argument.location() + ": " + e.getMessage());
                return EXIT_INPUT_ERROR;
            } catch (LiveParseException e) {
                err.println(e.getError());
                return EXIT_INPUT_ERROR;
            }
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        registry.expandAllDocuments(diagnostics);
        List<LiveFileError> errors = diagnostics.render(registry::liveErrorToLiveFileError);

        if (json) {
            try {
                out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(registry, errors)));
            } catch (JsonProcessingException e) {
                err.println("Failed to write JSON: " + e.getMessage());
                return EXIT_INPUT_ERROR;
            }
        } else {
            errors.forEach(out::println);
            out.printf("Expanded %d module(s) with %d error(s)%n", registry.fileCount(), errors.size());
        }
        out.flush();

        boolean failOnError = config.getBoolean("livedoc.diagnostics.fail-on-error");
        return diagnostics.hasErrors() && failOnError ? EXIT_EXPANSION_ERRORS : 0;
    }

    private ObjectNode toJson(LiveRegistry registry, List<LiveFileError> errors) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode modulesNode = root.putArray("modules");
        registry.registeredModules().forEach((crateModule, fileId) -> {
            ObjectNode module = modulesNode.addObject();
            module.put("module", crateModule.toString());
            module.put("file", registry.getLiveFile(fileId).file());
            module.put("declarations", registry.getExpandedDocument(fileId).levelLength(0));
        });
        ArrayNode errorsNode = root.putArray("errors");
        for (LiveFileError error : errors) {
            ObjectNode node = errorsNode.addObject();
            node.put("file", error.file());
            node.put("line", error.line());
            node.put("column", error.column());
            node.put("message", error.message());
        }
        return root;
    }

    /**
     * A parsed {@code crate:module=location} argument.
     */
    record ModuleArgument(CrateModule crateModule, String location) {

        static ModuleArgument parse(String text) {
            int equals = text.indexOf('=');
            int colon = text.indexOf(':');
            if (equals < 0 || colon < 0 || colon > equals) {
                throw new IllegalArgumentException("Expected CRATE:MODULE=FILE, got " + text);
            }
            String crate = text.substring(0, colon);
            String module = text.substring(colon + 1, equals);
            String location = text.substring(equals + 1);
            if (crate.isEmpty() || module.isEmpty() || location.isEmpty()) {
                throw new IllegalArgumentException("Expected CRATE:MODULE=FILE, got " + text);
            }
            return new ModuleArgument(CrateModule.of(crate, module), location);
        }
    }
}
