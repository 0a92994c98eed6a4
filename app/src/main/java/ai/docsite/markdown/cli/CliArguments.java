package ai.docsite.markdown.cli;

import ai.docsite.markdown.config.Command;
import ai.docsite.markdown.config.LogFormat;
import ai.docsite.markdown.config.OutputFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "docsite-markdown", mixinStandardHelpOptions = true, version = "docsite-markdown 1.0.0",
        description = "Parses markdown documents into HTML, JSON trees or normalized markdown")
public class CliArguments {

    @CommandLine.Parameters(index = "0", converter = CommandConverter.class, paramLabel = "COMMAND",
            description = "convert, validate, stats or toc")
    private Command command;

    @CommandLine.Parameters(index = "1", paramLabel = "INPUT", description = "Markdown file to read")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file (convert and toc)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class,
            description = "Convert output: html, json or markdown")
    private OutputFormat format;

    @CommandLine.Option(names = "--full-page", description = "Wrap HTML output in a standalone page")
    private boolean fullPage;

    @CommandLine.Option(names = "--title", description = "Page title used with --full-page", paramLabel = "TITLE")
    private String title;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Log parser details at debug level")
    private boolean verbose;

    @CommandLine.Option(names = "--no-strikethrough", description = "Do not recognise ~~strikethrough~~")
    private boolean noStrikethrough;

    @CommandLine.Option(names = "--sanitize", description = "Replace raw HTML blocks with a comment")
    private boolean sanitize;

    @CommandLine.Option(names = "--breaks", description = "Render newlines inside paragraphs as <br />")
    private boolean breaks;

    public Command command() {
        return command;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public OutputFormat format() {
        return format;
    }

    public boolean fullPage() {
        return fullPage;
    }

    public String title() {
        return title;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean noStrikethrough() {
        return noStrikethrough;
    }

    public boolean sanitize() {
        return sanitize;
    }

    public boolean breaks() {
        return breaks;
    }
}
