package run.telo.kernel.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import run.telo.kernel.support.KernelTestSupport;

class MainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsTheRunResultAsJson() {
        var manifest = KernelTestSupport.fixture("manifests", "greeter", "app.yaml").toString();

        int exitCode = commandLine().execute(manifest, "--json", "--max-discovery-passes", "5");

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("\"status\" : \"success\""), out.toString());
    }

    @Test
    void rejectsMissingManifests() {
        int exitCode = commandLine().execute("does/not/exist.yaml");

        assertEquals(CommandLine.ExitCode.USAGE, exitCode);
        assertTrue(err.toString().contains("Manifest not found"), err.toString());
    }

    @Test
    void rejectsInvalidPassLimits() {
        var manifest = KernelTestSupport.fixture("manifests", "greeter", "app.yaml").toString();

        assertEquals(CommandLine.ExitCode.USAGE, commandLine().execute(manifest, "--max-resolution-passes", "0"));
        assertTrue(err.toString().contains("maxResolutionPasses must be at least 1"), err.toString());
    }

    @Test
    void printsTheVersion() {
        assertEquals(0, commandLine().execute("--version"));
        assertTrue(out.toString().startsWith("telo (java) "), out.toString());
    }

    private CommandLine commandLine() {
        return new CommandLine(new TeloRunCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setOut(new PrintWriter(out, true))
            .setErr(new PrintWriter(err, true));
    }
}
