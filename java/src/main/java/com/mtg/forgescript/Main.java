package com.mtg.forgescript;

import com.mtg.forgescript.card.CardDocument;
import com.mtg.forgescript.card.CardDocumentException;
import com.mtg.forgescript.card.CardRecord;
import com.mtg.forgescript.compiler.CompiledCard;
import com.mtg.forgescript.script.CardScriptConverter;
import com.mtg.forgescript.script.CardScriptWriter;
import com.mtg.forgescript.script.ConversionSummary;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Forge script converter CLI - Main entry point.
 */
@Command(name = "forge-script",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Converts Cockatrice card databases to Forge card scripts",
        subcommands = {
                Main.ConvertCommand.class,
                Main.CompileCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== CONVERT COMMAND ==========
    @Command(name = "convert", description = "Convert a Cockatrice XML database into Forge card scripts")
    static class ConvertCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Cockatrice XML card database")
        String xmlPath;

        @Option(names = {"-o", "--output"}, defaultValue = "forge_cards",
                description = "Output directory (default: ${DEFAULT-VALUE})")
        String outputDir;

        @Option(names = {"-n", "--dry-run"},
                description = "Compile every card but write nothing")
        boolean dryRun;

        @Override
        public Integer call() throws Exception {
            CardDocument document;
            try {
                document = CardDocument.fromFile(xmlPath);
            } catch (CardDocumentException e) {
                System.err.println("✗ Failed to load cards: " + e.getMessage());
                return 1;
            }

            System.out.println("Found " + document.cardCount() + " cards in XML");
            System.out.println("Converting to Forge format with ability parsing...\n");

            CardScriptConverter converter = new CardScriptConverter();
            CardScriptWriter writer = new CardScriptWriter(Path.of(outputDir));
            int converted = 0;
            int skipped = 0;
            int tokens = 0;

            for (CardRecord card : document.getCards()) {
                Optional<CompiledCard> script = converter.convert(card);
                if (script.isEmpty()) {
                    skipped++;
                    System.out.println("Skipped: card without a name");
                    continue;
                }
                if (!dryRun) {
                    try {
                        writer.write(card.getName(), script.get());
                    } catch (CardScriptWriter.WriteException e) {
                        System.err.println("✗ " + e.getMessage());
                        return 1;
                    }
                }
                converted++;
                if (card.isToken()) {
                    tokens++;
                }
                System.out.println("✓ " + card.getName() + (card.isToken() ? " [TOKEN]" : ""));
            }

            printSummary(new ConversionSummary(converted, skipped, tokens, writer.getOutputDirectory()), dryRun);
            return 0;
        }
    }

    // ========== COMPILE COMMAND ==========
    @Command(name = "compile", description = "Compile one card's rules text and print its script")
    static class CompileCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Rules text; a literal \\n starts a new line")
        String rulesText;

        @Option(names = "--name", defaultValue = "Unnamed Card", description = "Card name")
        String name;

        @Option(names = "--cost", defaultValue = "", description = "Mana cost, e.g. 2U/B")
        String manaCost;

        @Option(names = "--type", defaultValue = "", description = "Type line, e.g. \"Creature - Human\"")
        String type;

        @Option(names = "--pt", defaultValue = "", description = "Power/toughness")
        String powerToughness;

        @Option(names = "--loyalty", defaultValue = "", description = "Starting loyalty")
        String loyalty;

        @Override
        public Integer call() {
            CardRecord card = new CardRecord(name, manaCost, type, powerToughness, loyalty,
                    rulesText.replace("\\n", "\n"));
            Optional<CompiledCard> script = new CardScriptConverter().convert(card);
            if (script.isEmpty()) {
                System.err.println("✗ A card name is required");
                return 1;
            }
            System.out.println(script.get().render());
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Print the end-of-run summary.
     */
    private static void printSummary(ConversionSummary summary, boolean dryRun) {
        System.out.println("\nConversion complete!" + (dryRun ? " (dry run, nothing written)" : ""));
        System.out.println("Records processed: " + summary.total());
        System.out.println("Total cards converted: " + summary.converted());
        if (summary.tokens() > 0) {
            System.out.println("Tokens: " + summary.tokens());
        }
        System.out.println("Skipped: " + summary.skipped());
        System.out.println("Output directory: " + summary.outputDirectory());
    }
}
