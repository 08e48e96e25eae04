package dk.trustworks.documentassembly.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Optional;

/**
 * Configuration for template conversion and PDF merging.
 *
 * <p>Example configuration in application.properties:
 * <pre>
 * document-assembly.converter.binary.override-env=LIBREOFFICE
 * document-assembly.converter.binary.candidates=soffice,libreoffice
 * document-assembly.converter.timeout-seconds=60
 * document-assembly.merge.node.modules-path=/opt/pdf-tools/node_modules
 * document-assembly.merge.ghostscript.binary.candidates=gs
 * </pre>
 *
 * <p>Binary overrides are read from the environment on every call, so a changed
 * environment takes effect without a restart.
 */
@ConfigMapping(prefix = "document-assembly")
public interface DocumentAssemblyConfig {

    /**
     * Office converter (template to PDF) configuration.
     */
    Converter converter();

    /**
     * PDF merge cascade configuration.
     */
    Merge merge();

    interface Converter {

        Binary binary();

        /**
         * Timeout in seconds for one conversion subprocess.
         * Default: 60
         */
        @WithDefault("60")
        int timeoutSeconds();

        /**
         * Maximum concurrent conversions (semaphore permits).
         * LibreOffice is memory-intensive (~200MB per process).
         * Default: 3
         */
        @WithDefault("3")
        int maxConcurrent();

        /**
         * Run every conversion with its own throw-away LibreOffice user profile.
         * Default: true
         */
        @WithDefault("true")
        boolean isolatedProfile();
    }

    interface Merge {

        /**
         * Timeout in seconds for each merge subprocess.
         * Default: 60
         */
        @WithDefault("60")
        int timeoutSeconds();

        Node node();

        Tool ghostscript();

        Tool pdfunite();
    }

    /**
     * Script driven merge via node and pdf-lib.
     */
    interface Node {

        Binary binary();

        /**
         * Merge script to run. When absent the bundled merge-pdf.js is used.
         */
        Optional<String> scriptPath();

        /**
         * Directory containing the pdf-lib package.
         */
        Optional<String> modulesPath();

        /**
         * Environment variable consulted for the library directory when no modules path is configured.
         */
        @WithDefault("NODE_PATH")
        String modulesEnv();
    }

    interface Tool {

        Binary binary();
    }

    /**
     * How one external binary is located.
     */
    interface Binary {

        /**
         * Environment variable holding an explicit binary path or name.
         */
        String overrideEnv();

        /**
         * Configured binary path, used when the environment variable is not set.
         */
        Optional<String> path();

        /**
         * Names looked up on PATH, in order.
         */
        List<String> candidates();
    }
}
