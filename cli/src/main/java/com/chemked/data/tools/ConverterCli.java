package com.chemked.data.tools;

import com.chemked.data.Version;
import com.chemked.data.loader.DocumentParseException;
import com.chemked.data.loader.LoaderException;
import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.record.Author;
import com.chemked.data.respecth.ConversionException;
import com.chemked.data.respecth.ConversionReport;
import com.chemked.data.respecth.ReSpecThConverter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Converts between ReSpecTh XML and ChemKED YAML files, choosing the direction from the file
 * extensions. Exits with status 1 when the input cannot be parsed, validated or converted.
 */
@Command(
        name = "chemked-convert",
        mixinStandardHelpOptions = true,
        version = "chemked-convert " + Version.FULL,
        description = "Convert between ReSpecTh XML files and ChemKED YAML files based on file extension.")
public final class ConverterCli implements Callable<Integer> {

    static final int EXIT_FAILURE = 1;

    private enum Format {
        XML,
        YAML;

        static Format of(Path file) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            if (name.endsWith(".xml")) {
                return XML;
            }
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                return YAML;
            }
            return null;
        }
    }

    @Option(
            names = {"-i", "--input"},
            required = true,
            description = "Input filename (e.g., \"file1.yaml\" or \"file2.xml\")")
    private Path input;

    @Option(
            names = {"-o", "--output"},
            description = "Output filename (e.g., \"file1.xml\" or \"file2.yaml\"); "
                    + "defaults to the input name with the other extension")
    private Path output;

    @Option(
            names = {"-fa", "--file-author"},
            description = "File author name to add to the converted file")
    private String fileAuthor;

    @Option(
            names = {"-fo", "--file-author-orcid"},
            description = "File author ORCID")
    private String fileAuthorOrcid;

    @Spec
    private CommandSpec spec;

    private final Supplier<LookupServices> lookups;

    public ConverterCli() {
        this(LookupServices::fromSettings);
    }

    ConverterCli(Supplier<LookupServices> lookups) {
        this.lookups = lookups;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new ConverterCli());
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Format from = Format.of(input);
        if (from == null) {
            err.println("Error: Input/output args need to be .xml/.yaml");
            return EXIT_FAILURE;
        }
        Path target = output != null ? output : defaultOutput(input, from);
        Format to = Format.of(target);
        if (to == null) {
            err.println("Error: Input/output args need to be .xml/.yaml");
            return EXIT_FAILURE;
        }
        if (from == to) {
            String extension = from == Format.XML ? ".xml" : ".yaml";
            err.println("Error: Cannot convert " + extension + " to " + extension);
            return EXIT_FAILURE;
        }

        try {
            Author author = ReSpecThConverter.fileAuthor(fileAuthor, fileAuthorOrcid);
            ReSpecThConverter converter = new ReSpecThConverter(lookups.get());
            ConversionReport report =
                    from == Format.XML
                            ? converter.convertXmlToYaml(input, target, author)
                            : converter.convertYamlToXml(input, target, author);
            for (String note : report.getNotes()) {
                err.println("Warning: " + note);
            }
            for (String dropped : report.getDroppedFields()) {
                err.println("Warning: not converted: " + dropped);
            }
            out.println("Converted to " + target);
            return CommandLine.ExitCode.OK;
        } catch (LoaderException ex) {
            err.println("Error: " + input + " is not a valid ChemKED document");
            for (LoaderMessage error : ex.getErrors()) {
                err.println("  " + (error.getPath().isEmpty() ? "" : error.getPath() + ": ") + error.getMessage());
            }
            if (ex.getErrors().isEmpty()) {
                err.println("  " + ex.getMessage());
            }
        } catch (ConversionException | DocumentParseException ex) {
            err.println("Error: " + ex.getMessage());
        } catch (IOException ex) {
            err.println("Error: unable to convert " + input + ": " + ex.getMessage());
        }
        return EXIT_FAILURE;
    }

    private static Path defaultOutput(Path input, Format from) {
        String name = input.getFileName().toString();
        String stem = name.substring(0, name.lastIndexOf('.'));
        return input.resolveSibling(stem + (from == Format.XML ? ".yaml" : ".xml"));
    }
}
