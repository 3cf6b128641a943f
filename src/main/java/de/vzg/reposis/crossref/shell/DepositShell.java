package de.vzg.reposis.crossref.shell;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import de.vzg.reposis.crossref.config.CrossrefProperties;
import de.vzg.reposis.crossref.deposit.CrossrefDeposit;
import de.vzg.reposis.crossref.deposit.CrossrefDepositBuilder;
import de.vzg.reposis.crossref.deposit.DepositGenerationException;
import de.vzg.reposis.crossref.io.ArticleModelReader;
import de.vzg.reposis.crossref.io.DepositFileWriter;
import de.vzg.reposis.crossref.model.Article;

@ShellComponent
public class DepositShell {

    private static final Logger log = LoggerFactory.getLogger(DepositShell.class);

    private static final String DEFAULT_INDENT = "  ";

    private final ArticleModelReader articleModelReader;

    private final CrossrefDepositBuilder depositBuilder;

    private final DepositFileWriter depositFileWriter;

    private final CrossrefProperties properties;

    @Autowired
    public DepositShell(ArticleModelReader articleModelReader, CrossrefDepositBuilder depositBuilder,
        DepositFileWriter depositFileWriter, CrossrefProperties properties) {
        this.articleModelReader = articleModelReader;
        this.depositBuilder = depositBuilder;
        this.depositFileWriter = depositFileWriter;
        this.properties = properties;
    }

    @ShellMethod(key = "crossref-deposit", value = "Generates a Crossref deposit file from article metadata JSON.")
    public void deposit(
        @ShellOption(value = { "-i", "--input" }, help = "Path to the article metadata JSON file.") String input,
        @ShellOption(value = { "-o", "--output" }, help = "Directory for the deposit file. Defaults to crossref.output-dir.",
            defaultValue = ShellOption.NULL) String output,
        @ShellOption(value = { "--pretty" }, help = "Indent the generated XML.") boolean pretty,
        @ShellOption(value = { "--indent" }, help = "Indentation unit used with --pretty.",
            defaultValue = DEFAULT_INDENT) String indent) {

        Path outputDir = Paths.get(output != null ? output : properties.getOutputDir());
        try {
            CrossrefDeposit deposit = generate(input);
            Path written = depositFileWriter.write(deposit, outputDir, pretty ? indent : null);
            System.out.println("Crossref deposit written to " + written);
        } catch (FileNotFoundException | NoSuchFileException e) {
            log.error("Input file not found: {}", input, e);
            System.err.println("Error: Input file not found: " + e.getMessage());
        } catch (IOException e) {
            log.error("I/O error while generating deposit from {}", input, e);
            System.err.println("Error during file I/O: " + e.getMessage());
        } catch (DepositGenerationException e) {
            log.error("Deposit generation failed for {}", input, e);
            System.err.println("Error generating deposit: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration or input for {}", input, e);
            System.err.println("Invalid configuration or input: " + e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error while generating deposit from {}", input, e);
            System.err.println("An unexpected error occurred during deposit generation: " + e.getMessage());
        }
    }

    @ShellMethod(key = "crossref-print", value = "Prints the Crossref deposit for article metadata JSON.")
    public void print(
        @ShellOption(value = { "-i", "--input" }, help = "Path to the article metadata JSON file.") String input) {
        try {
            System.out.println(generate(input).toXml(DEFAULT_INDENT));
        } catch (IOException e) {
            log.error("Could not read {}", input, e);
            System.err.println("Error during file I/O: " + e.getMessage());
        } catch (DepositGenerationException e) {
            log.error("Deposit generation failed for {}", input, e);
            System.err.println("Error generating deposit: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration or input for {}", input, e);
            System.err.println("Invalid configuration or input: " + e.getMessage());
        }
    }

    CrossrefDeposit generate(String input) throws IOException {
        List<Article> articles = articleModelReader.read(Paths.get(input));
        if (articles.isEmpty()) {
            log.warn("No articles in {}, generating an empty batch", input);
        }
        return depositBuilder.build(articles);
    }
}
