package ai.docsite.markdown.config;

import ai.docsite.markdown.parser.ParserOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one command-line run, assembled from CLI arguments and environment values.
 */
public record Config(
        Command command,
        Path input,
        Optional<Path> output,
        OutputFormat outputFormat,
        boolean fullPage,
        Optional<String> title,
        LogFormat logFormat,
        boolean verbose,
        ParserOptions parserOptions
) {

    public Config {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(input, "input");
        output = output == null ? Optional.empty() : output;
        outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        title = title == null ? Optional.empty() : title.filter(value -> !value.isBlank());
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        parserOptions = Objects.requireNonNull(parserOptions, "parserOptions");
        if (fullPage && outputFormat != OutputFormat.HTML) {
            throw new IllegalArgumentException("--full-page can only be used with html output");
        }
    }

    /**
     * Target of the convert command: the explicit output, or the input path with the format's extension.
     * A name that would overwrite the input gets a {@code .formatted} infix.
     */
    public Path resolveOutput() {
        return output.orElseGet(() -> {
            String fileName = input.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            String base = dot > 0 ? fileName.substring(0, dot) : fileName;
            String target = base + "." + outputFormat.extension();
            if (target.equals(fileName)) {
                target = base + ".formatted." + outputFormat.extension();
            }
            return input.resolveSibling(target);
        });
    }
}
