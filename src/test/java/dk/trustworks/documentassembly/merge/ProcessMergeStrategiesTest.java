package dk.trustworks.documentassembly.merge;

import dk.trustworks.documentassembly.process.BinaryResolver;
import dk.trustworks.documentassembly.process.ProcessRunner;
import dk.trustworks.documentassembly.utils.FakeTools;
import dk.trustworks.documentassembly.utils.TestDocumentAssemblyConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static dk.trustworks.documentassembly.utils.TestDataBuilders.pdfBytes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the subprocess strategies against shell scripts standing in for node, gs and pdfunite.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
@DisplayName("Process merge strategy Tests")
class ProcessMergeStrategiesTest {

    @TempDir
    Path tempDir;

    private Path bin;
    private Path workDir;
    private Path output;
    private List<Path> inputs;
    private TestDocumentAssemblyConfig config;
    private Map<String, String> environment;

    @BeforeEach
    void setUp() throws Exception {
        bin = tempDir.resolve("bin");
        Files.createDirectories(bin);
        workDir = Files.createDirectory(tempDir.resolve("work"));
        output = workDir.resolve("merged.pdf");
        inputs = List.of(
                Files.write(workDir.resolve("base.pdf"), pdfBytes("base")),
                Files.write(workDir.resolve("attachment-1.pdf"), pdfBytes("a")));
        config = new TestDocumentAssemblyConfig();
        environment = Map.of();
    }

    private <T extends ProcessMergeStrategy> T wire(T strategy) {
        strategy.config = config;
        strategy.binaryResolver = new BinaryResolver(FakeTools.environment(bin, environment));
        strategy.processRunner = new ProcessRunner();
        return strategy;
    }

    // =========================================================================
    // Shared flow
    // =========================================================================

    @Nested
    @DisplayName("Shared flow")
    class SharedFlowTests {

        @Test
        @DisplayName("Ghostscript writes the -sOutputFile target")
        void ghostscript_success() throws Exception {
            FakeTools.install(bin, "gs", FakeTools.GHOSTSCRIPT);

            wire(new GhostscriptMergeStrategy()).merge(inputs, output, workDir);

            assertEquals("%PDF-1.4 ghostscript", Files.readString(output));
        }

        @Test
        @DisplayName("pdfunite writes the last argument")
        void pdfunite_success() throws Exception {
            FakeTools.install(bin, "pdfunite", FakeTools.PDFUNITE);

            wire(new PdfuniteMergeStrategy()).merge(inputs, output, workDir);

            assertEquals("%PDF-1.4 pdfunite", Files.readString(output));
        }

        @Test
        @DisplayName("Non-zero exit → stderr is the diagnostic")
        void nonZeroExit() throws Exception {
            FakeTools.install(bin, "gs", FakeTools.failing("Error: /syntaxerror in xref", 1));

            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new GhostscriptMergeStrategy()).merge(inputs, output, workDir));

            assertEquals("Error: /syntaxerror in xref", e.getMessage());
        }

        @Test
        @DisplayName("Exit 0 without an output file is a failure")
        void successWithoutOutput() throws Exception {
            FakeTools.install(bin, "pdfunite", FakeTools.SILENT);

            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new PdfuniteMergeStrategy()).merge(inputs, output, workDir));

            assertEquals("exited successfully but wrote no output", e.getMessage());
        }

        @Test
        @DisplayName("Binary not on PATH → lookup list in the diagnostic")
        void binaryMissing() {
            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new GhostscriptMergeStrategy()).merge(inputs, output, workDir));

            assertTrue(e.getMessage().contains("not found"), e.getMessage());
            assertTrue(e.getMessage().contains("gs"));
        }

        @Test
        @DisplayName("Hanging tool is killed at the merge timeout")
        void timeout() throws Exception {
            config.mergeTimeoutSeconds(1);
            FakeTools.install(bin, "pdfunite", FakeTools.sleeping(10));

            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new PdfuniteMergeStrategy()).merge(inputs, output, workDir));

            assertEquals("timed out after 1 seconds", e.getMessage());
        }

        @Test
        @DisplayName("No inputs → refused without running anything")
        void emptyInputs() {
            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new PdfuniteMergeStrategy()).merge(List.of(), output, workDir));

            assertEquals("no pdf files provided for merging", e.getMessage());
        }
    }

    // =========================================================================
    // node + pdf-lib
    // =========================================================================

    @Nested
    @DisplayName("node + pdf-lib")
    class NodeTests {

        @Test
        @DisplayName("Configured modules path is passed as NODE_PATH, bundled script is used")
        void configuredModulesPath() throws Exception {
            Path modules = Files.createDirectories(tempDir.resolve("node_modules/pdf-lib")).getParent();
            config.modulesPath(modules.toString());
            FakeTools.install(bin, "node", FakeTools.NODE);

            wire(new NodePdfLibMergeStrategy()).merge(inputs, output, workDir);

            assertEquals("%PDF-1.4 node " + modules.toAbsolutePath(), Files.readString(output));
            assertTrue(Files.exists(workDir.resolve(NodePdfLibMergeStrategy.BUNDLED_SCRIPT)));
        }

        @Test
        @DisplayName("First NODE_PATH entry holding pdf-lib is chosen")
        void modulesFromEnvironment() throws Exception {
            Path empty = Files.createDirectories(tempDir.resolve("empty"));
            Path modules = Files.createDirectories(tempDir.resolve("lib/pdf-lib")).getParent();
            environment = Map.of("NODE_PATH", empty + File.pathSeparator + modules);
            FakeTools.install(bin, "nodejs", FakeTools.NODE);

            NodePdfLibMergeStrategy strategy = wire(new NodePdfLibMergeStrategy());

            assertEquals(modules, strategy.modulesDirectory());
            strategy.merge(inputs, output, workDir);
            assertTrue(Files.readString(output).endsWith(modules.toAbsolutePath().toString()));
        }

        @Test
        @DisplayName("pdf-lib nowhere → strategy fails with a configuration hint")
        void libraryMissing() throws Exception {
            FakeTools.install(bin, "node", FakeTools.NODE);

            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new NodePdfLibMergeStrategy()).merge(inputs, output, workDir));

            assertTrue(e.getMessage().startsWith("pdf-lib dependency not found"), e.getMessage());
            assertFalse(Files.exists(output));
        }

        @Test
        @DisplayName("Configured modules path without pdf-lib is rejected")
        void configuredModulesPathWithoutLibrary() throws Exception {
            config.modulesPath(Files.createDirectories(tempDir.resolve("node_modules")).toString());
            FakeTools.install(bin, "node", FakeTools.NODE);

            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new NodePdfLibMergeStrategy()).merge(inputs, output, workDir));

            assertTrue(e.getMessage().startsWith("pdf-lib dependency not found in "));
        }

        @Test
        @DisplayName("Configured script that does not exist is reported")
        void configuredScriptMissing() throws Exception {
            Path modules = Files.createDirectories(tempDir.resolve("node_modules/pdf-lib")).getParent();
            config.modulesPath(modules.toString()).scriptPath(tempDir.resolve("missing.js").toString());
            FakeTools.install(bin, "node", FakeTools.NODE);

            PdfMergeStrategyException e = assertThrows(PdfMergeStrategyException.class,
                    () -> wire(new NodePdfLibMergeStrategy()).merge(inputs, output, workDir));

            assertTrue(e.getMessage().startsWith("merge script not found at"));
        }
    }
}
