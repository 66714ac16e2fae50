package info.isaksson.erland.componentir;

import info.isaksson.erland.componentir.ir.IrDocument;
import info.isaksson.erland.componentir.ir.IrJson;
import info.isaksson.erland.componentir.ir.IrTagHelper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainSmokeTest {

    @Test
    void processesFixtureAndWritesDocumentAndReport() throws IOException {
        Path tmpDir = Files.createTempDirectory("cir-cli-");
        Path in = copyFixture(tmpDir);
        Path outDir = tmpDir.resolve("out");
        Path report = outDir.resolve("report.md");

        int code = Main.run(new String[] {
                "--input", in.toString(),
                "--output", outDir.toString(),
                "--report", report.toString()
        });

        assertEquals(0, code);
        Path written = outDir.resolve("document.ir.json");
        assertTrue(Files.exists(written), "document must be written: " + written);
        IrDocument doc = IrJson.read(written);
        IrTagHelper counter = (IrTagHelper) doc.children.get(0);
        assertEquals(1, counter.children.size());
        assertEquals(1, counter.diagnostics.size());

        assertTrue(Files.readString(report).contains("CMP9986"));
    }

    @Test
    void failOnErrorsReturnsExitCode3() throws IOException {
        Path tmpDir = Files.createTempDirectory("cir-cli-");
        Path in = copyFixture(tmpDir);

        int code = Main.run(new String[] {
                in.toString(),
                "--output", tmpDir.resolve("result.json").toString(),
                "--fail-on-errors", "true"
        });

        assertEquals(3, code);
        assertTrue(Files.exists(tmpDir.resolve("result.json")));
    }

    @Test
    void nonComponentKindLeavesDocumentWithoutErrors() throws IOException {
        Path tmpDir = Files.createTempDirectory("cir-cli-");
        Path in = copyFixture(tmpDir);

        int code = Main.run(new String[] {
                "--input", in.toString(),
                "--output", tmpDir.resolve("result.json").toString(),
                "--component-kind", "Nothing.Matches",
                "--fail-on-errors", "true"
        });

        assertEquals(0, code);
    }

    @Test
    void missingOrInvalidInputIsAUsageOrIoError() throws IOException {
        Path tmpDir = Files.createTempDirectory("cir-cli-");
        assertEquals(1, Main.run(new String[] {}));
        assertEquals(1, Main.run(new String[] {"--input", tmpDir.resolve("missing.json").toString()}));
        assertEquals(0, Main.run(new String[] {"--help"}));

        Path broken = tmpDir.resolve("broken.json");
        Files.writeString(broken, "{ not json");
        assertEquals(2, Main.run(new String[] {"--input", broken.toString(), "--output", tmpDir.toString()}));
    }

    private static Path copyFixture(Path tmpDir) throws IOException {
        Path in = tmpDir.resolve("page.ir.json");
        try (var res = MainSmokeTest.class.getResourceAsStream("/ir/page.ir.json")) {
            assertNotNull(res, "fixture must exist in test resources");
            Files.copy(res, in);
        }
        return in;
    }
}
