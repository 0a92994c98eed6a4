package ai.docsite.markdown.cli;

import ai.docsite.markdown.MarkdownException;
import ai.docsite.markdown.ast.TocEntry;
import ai.docsite.markdown.config.Config;
import ai.docsite.markdown.config.ConfigLoader;
import ai.docsite.markdown.config.SystemEnvironmentReader;
import ai.docsite.markdown.logging.LoggingConfigurator;
import ai.docsite.markdown.parser.DocumentStatistics;
import ai.docsite.markdown.parser.MarkdownParser;
import ai.docsite.markdown.parser.ValidationResult;
import ai.docsite.markdown.plugin.ExternalLinkPlugin;
import ai.docsite.markdown.plugin.LazyImagePlugin;
import ai.docsite.markdown.plugin.StructureValidatorPlugin;
import ai.docsite.markdown.render.HtmlRenderer;
import ai.docsite.markdown.render.MarkdownRenderer;
import ai.docsite.markdown.render.PageMeta;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and markdown parser.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.verbose());
            LOGGER.info("Running {} on {}", config.command().name().toLowerCase(Locale.ROOT), config.input());
            return execute(config);
        } catch (MarkdownException | IllegalArgumentException | UncheckedIOException ex) {
            err.println("Error: " + ex.getMessage());
            LOGGER.debug("Command failed", ex);
            return EXIT_FAILURE;
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int execute(Config config) {
        MarkdownParser parser = createParser(config);
        String text = readInput(config.input());
        return switch (config.command()) {
            case CONVERT -> convert(config, parser, text);
            case VALIDATE -> validate(parser, text);
            case STATS -> stats(parser, text);
            case TOC -> toc(config, parser, text);
        };
    }

    private MarkdownParser createParser(Config config) {
        MarkdownParser parser = new MarkdownParser(config.parserOptions());
        parser.use(ExternalLinkPlugin.NAME, new ExternalLinkPlugin());
        parser.use(LazyImagePlugin.NAME, new LazyImagePlugin());
        parser.use(StructureValidatorPlugin.NAME, new StructureValidatorPlugin());
        return parser;
    }

    private int convert(Config config, MarkdownParser parser, String text) {
        String content = switch (config.outputFormat()) {
            case HTML -> renderHtml(config, parser, text);
            case JSON -> parser.exportAsJson(text);
            case MARKDOWN -> parser.render(text, new MarkdownRenderer());
        };
        Path target = config.resolveOutput();
        writeOutput(target, content);
        LOGGER.info("Wrote {} output to {}", config.outputFormat().name().toLowerCase(Locale.ROOT), target);
        return EXIT_OK;
    }

    private String renderHtml(Config config, MarkdownParser parser, String text) {
        String html = parser.parse(text);
        if (!config.fullPage()) {
            return html + "\n";
        }
        HtmlRenderer renderer = parser.newHtmlRenderer();
        String title = config.title().orElseGet(() -> baseName(config.input()));
        return renderer.generateFullPage(html, PageMeta.titled(title));
    }

    private int validate(MarkdownParser parser, String text) {
        ValidationResult result = parser.validate(text);
        if (result.valid()) {
            out.println("valid");
            return EXIT_OK;
        }
        for (String error : result.errors()) {
            out.println(error);
        }
        return EXIT_FAILURE;
    }

    private int stats(MarkdownParser parser, String text) {
        DocumentStatistics statistics = parser.statistics(text);
        out.println("lines: " + statistics.lines());
        out.println("characters: " + statistics.characters());
        out.println("tokens: " + statistics.tokens());
        out.println("nodes: " + statistics.nodes());
        out.println("headings: " + statistics.headings());
        out.println("links: " + statistics.links());
        out.println("images: " + statistics.images());
        out.println("lists: " + statistics.lists());
        out.println("codeBlocks: " + statistics.codeBlocks());
        out.println("tables: " + statistics.tables());
        return EXIT_OK;
    }

    private int toc(Config config, MarkdownParser parser, String text) {
        String toc = formatToc(parser.tableOfContents(text));
        if (config.output().isPresent()) {
            writeOutput(config.output().get(), toc);
            LOGGER.info("Wrote table of contents to {}", config.output().get());
        } else {
            out.print(toc);
        }
        return EXIT_OK;
    }

    /**
     * Renders the forest as a nested bullet list. Indentation is shifted left so the shallowest bullet
     * starts at column zero even when the document skips the top levels.
     */
    static String formatToc(List<TocEntry> entries) {
        StringBuilder builder = new StringBuilder();
        appendToc(builder, entries, 0);
        String[] lines = builder.toString().split("\n");
        int indent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (!line.isEmpty()) {
                indent = Math.min(indent, line.length() - line.stripLeading().length());
            }
        }
        StringBuilder dedented = new StringBuilder();
        for (String line : lines) {
            if (!line.isEmpty()) {
                dedented.append(line.substring(indent)).append('\n');
            }
        }
        return dedented.toString();
    }

    /**
     * Heading entries print one bullet and indent what they hold. Group entries print nothing and only
     * indent their nested groups.
     */
    private static void appendToc(StringBuilder builder, List<TocEntry> entries, int depth) {
        for (TocEntry entry : entries) {
            if (entry.isGroup()) {
                appendToc(builder, entry.items(), depth);
                appendToc(builder, entry.children(), depth + 1);
                continue;
            }
            builder.append("  ".repeat(depth))
                    .append("- [").append(entry.text().orElse("")).append("](#")
                    .append(entry.id().orElse("")).append(")\n");
            appendToc(builder, entry.items(), depth + 1);
            appendToc(builder, entry.children(), depth + 1);
        }
    }

    private static String readInput(Path input) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + input, ex);
        }
    }

    private static void writeOutput(Path target, String content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        }
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
