package com.chemked.data.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chemked.data.loader.ChemKedLoader;
import com.chemked.data.lookup.BibliographicRecord;
import com.chemked.data.lookup.BibliographicRecord.RegisteredAuthor;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.record.ChemKedRecord;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

final class ConverterCliTest {

    private static final String DOI = "10.1016/j.ijhydene.2007.04.008";

    private static final String SHOCK_TUBE_YAML =
            "file-authors:\n"
                    + "  - name: Kyle E Niemeyer\n"
                    + "file-version: 0\n"
                    + "chemked-version: 0.4.1\n"
                    + "reference:\n"
                    + "  doi: " + DOI + "\n"
                    + "  authors:\n"
                    + "    - name: N. Chaumeix\n"
                    + "  journal: International Journal of Hydrogen Energy\n"
                    + "  year: 2007\n"
                    + "  volume: 32\n"
                    + "  pages: 2216-2226\n"
                    + "experiment-type: ignition delay\n"
                    + "apparatus:\n"
                    + "  kind: shock tube\n"
                    + "datapoints:\n"
                    + "  - temperature:\n"
                    + "      - 1164.48 K\n"
                    + "    ignition-delay:\n"
                    + "      - 471.54 us\n"
                    + "    pressure:\n"
                    + "      - 220 kPa\n"
                    + "    composition:\n"
                    + "      kind: mole fraction\n"
                    + "      species:\n"
                    + "        - species-name: H2\n"
                    + "          InChI: 1S/H2/h1H\n"
                    + "          amount:\n"
                    + "            - 0.00444\n"
                    + "        - species-name: O2\n"
                    + "          InChI: 1S/O2/c1-2\n"
                    + "          amount:\n"
                    + "            - 0.00556\n"
                    + "        - species-name: Ar\n"
                    + "          InChI: 1S/Ar\n"
                    + "          amount:\n"
                    + "            - 0.99\n"
                    + "    ignition-type:\n"
                    + "      target: pressure\n"
                    + "      type: d/dt max\n";

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(Supplier<LookupServices> lookups, String... args) {
        CommandLine commandLine = new CommandLine(new ConverterCli(lookups));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int run(String... args) {
        return run(LookupServices::offline, args);
    }

    private static LookupServices registryWithChaumeix() {
        BibliographicRecord work =
                new BibliographicRecord(
                        DOI,
                        "International Journal of Hydrogen Energy",
                        2007,
                        "32",
                        "2216-2226",
                        List.of(new RegisteredAuthor("N.", "Chaumeix", null)));
        return new LookupServices(
                orcid -> Optional.empty(), doi -> doi.equals(DOI) ? Optional.of(work) : Optional.empty());
    }

    private static Path writeDocument(String contents) throws Exception {
        Path dir = Files.createTempDirectory("chemked_cli");
        Path yaml = dir.resolve("shock_tube.yaml");
        Files.writeString(yaml, contents, StandardCharsets.UTF_8);
        return yaml;
    }

    @Test
    void convertsYamlToXmlAndBack() throws Exception {
        Path yaml = writeDocument(SHOCK_TUBE_YAML);
        Path xml = yaml.resolveSibling("shock_tube.xml");

        assertEquals(0, run("-i", yaml.toString()));
        assertEquals("Converted to " + xml, out.toString().strip());
        assertEquals("", err.toString());
        assertTrue(Files.readString(xml).contains("<fileAuthor>Kyle E Niemeyer</fileAuthor>"));

        Path back = yaml.resolveSibling("back.yml");
        assertEquals(
                0,
                run(ConverterCliTest::registryWithChaumeix, "--input", xml.toString(), "--output", back.toString()));
        assertTrue(
                err.toString()
                        .contains("Warning: Using DOI to obtain reference information, rather than preferredKey."),
                err.toString());

        ChemKedRecord record = new ChemKedLoader(registryWithChaumeix()).load(back).getRecord();
        assertEquals("Kyle E Niemeyer", record.getFileAuthors().get(0).getName());
        assertEquals("H2:0.00444, O2:0.00556, Ar:0.99", record.getDatapoints().get(0).getMoleFractionString());
    }

    @Test
    void fileAuthorIsWrittenToXml() throws Exception {
        Path yaml = writeDocument(SHOCK_TUBE_YAML);
        Path xml = yaml.resolveSibling("override.xml");

        assertEquals(
                0,
                run("-i", yaml.toString(), "-o", xml.toString(), "-fa", "Jane Doe", "-fo", "0000-0002-1825-0097"));
        assertTrue(Files.readString(xml).contains("<fileAuthor>Jane Doe</fileAuthor>"));
        String warnings = err.toString();
        assertTrue(
                warnings.contains(
                        "Warning: not converted: file author override ORCID "
                                + "(ReSpecTh has no field for author identifiers)"),
                warnings);
        assertTrue(
                warnings.contains("Warning: not converted: file-authors[0] (ReSpecTh holds a single file author)"),
                warnings);
    }

    @Test
    void rejectsUnknownExtensions() {
        assertEquals(ConverterCli.EXIT_FAILURE, run("-i", "document.txt"));
        assertEquals("Error: Input/output args need to be .xml/.yaml", err.toString().strip());
    }

    @Test
    void rejectsUnknownOutputExtension() {
        assertEquals(ConverterCli.EXIT_FAILURE, run("-i", "document.yaml", "-o", "document.json"));
        assertEquals("Error: Input/output args need to be .xml/.yaml", err.toString().strip());
    }

    @Test
    void rejectsSameFormatConversion() {
        assertEquals(ConverterCli.EXIT_FAILURE, run("-i", "first.xml", "-o", "second.xml"));
        assertEquals("Error: Cannot convert .xml to .xml", err.toString().strip());
    }

    @Test
    void orcidNeedsAuthorName() {
        assertEquals(ConverterCli.EXIT_FAILURE, run("-i", "document.yaml", "-fo", "0000-0002-1825-0097"));
        assertEquals(
                "Error: If a file author ORCID is specified, the file author name must be as well",
                err.toString().strip());
    }

    @Test
    void reportsValidationErrors() throws Exception {
        Path yaml = writeDocument(SHOCK_TUBE_YAML.replace("1164.48 K", "-1164.48 K"));

        assertEquals(ConverterCli.EXIT_FAILURE, run("-i", yaml.toString()));
        String errors = err.toString();
        assertTrue(errors.startsWith("Error: " + yaml + " is not a valid ChemKED document"), errors);
        assertTrue(errors.contains("  datapoints[0].temperature[0]: value must be greater than 0.0 K"), errors);
        assertTrue(Files.notExists(yaml.resolveSibling("shock_tube.xml")));
    }

    @Test
    void missingInputIsUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run("-o", "document.xml"));
        assertTrue(err.toString().contains("Missing required option: '--input=<input>'"), err.toString());
    }
}
