package com.mtg.forgescript;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line.
 */
class MainTest {

    @TempDir
    Path workDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private Path copyFixture() throws Exception {
        Path xml = workDir.resolve("cards.xml");
        try (InputStream is = getClass().getClassLoader().getResourceAsStream("cards.xml")) {
            assertNotNull(is, "cards.xml test resource missing");
            Files.copy(is, xml);
        }
        return xml;
    }

    private int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testConvert() throws Exception {
        Path xml = copyFixture();
        Path output = workDir.resolve("forge_cards");

        assertEquals(0, execute("convert", xml.toString(), "-o", output.toString()));

        Path scout = output.resolve("g").resolve("gnome_scout.txt");
        assertTrue(Files.exists(scout));
        assertTrue(Files.readString(scout).contains("SVar:Effect1:GainLife | Defined$ You | LifeAmount$ 1"));
        assertTrue(Files.exists(output.resolve("t").resolve("tinkers_lamp.txt")));
        assertTrue(Files.exists(output.resolve("z").resolve("zappy_storm_caller.txt")));

        String console = output();
        assertTrue(console.contains("Found 6 cards in XML"));
        assertTrue(console.contains("✓ Beer [TOKEN]"));
        assertTrue(console.contains("Records processed: 6"));
        assertTrue(console.contains("Total cards converted: 5"));
        assertTrue(console.contains("Tokens: 1"));
        assertTrue(console.contains("Skipped: 1"));
    }

    @Test
    void testDryRun() throws Exception {
        Path xml = copyFixture();
        Path output = workDir.resolve("dry");

        assertEquals(0, execute("convert", xml.toString(), "--output", output.toString(), "--dry-run"));

        assertFalse(Files.exists(output));
        assertTrue(output().contains("Total cards converted: 5"));
    }

    @Test
    void testConvertMissingFile() {
        assertEquals(1, execute("convert", workDir.resolve("nope.xml").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("✗ Failed to load cards"));
    }

    @Test
    void testConvertMalformedFile() throws Exception {
        Path xml = workDir.resolve("broken.xml");
        Files.writeString(xml, "<cockatrice_carddatabase><cards><card>");

        assertEquals(1, execute("convert", xml.toString(), "-o", workDir.resolve("out").toString()));
    }

    @Test
    void testCompile() {
        assertEquals(0, execute("compile", "{T}: Draw a card.", "--name", "Tinker's Lamp", "--cost", "2U/B",
                "--type", "Artifact"));

        String script = output();
        assertTrue(script.contains("Name:Tinker's Lamp"));
        assertTrue(script.contains("ManaCost:2 U/B"));
        assertTrue(script.contains("Types:Artifact"));
        assertTrue(script.contains("A:AB$ Draw | Defined$ You | NumCards$ 1 | Cost$ T"));
    }

    @Test
    void testCompileEscapedLineBreak() {
        assertEquals(0, execute("compile", "Flying\\nThis creature likes pie."));

        assertTrue(output().contains("Oracle:Flying\\nThis creature likes pie."));
        assertTrue(output().contains("Name:Unnamed Card"));
    }

    @Test
    void testCompileBlankName() {
        assertEquals(1, execute("compile", "Draw a card.", "--name", " "));
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        assertEquals(0, execute());
        assertTrue(output().contains("convert"));
    }
}
