package ai.docsite.markdown.config;

import ai.docsite.markdown.cli.CliArguments;
import ai.docsite.markdown.parser.ParserOptions;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * Values given on the command line always win.
 */
public class ConfigLoader {

    static final String ENV_OUTPUT_FORMAT = "MARKDOWN_OUTPUT_FORMAT";
    static final String ENV_STRIKETHROUGH = "MARKDOWN_STRIKETHROUGH";
    static final String ENV_SANITIZE = "MARKDOWN_SANITIZE";
    static final String ENV_BREAKS = "MARKDOWN_BREAKS";
    static final String ENV_LANG_PREFIX = "MARKDOWN_LANG_PREFIX";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.command() == null) {
            throw new IllegalArgumentException("A command must be provided");
        }
        if (arguments.input() == null) {
            throw new IllegalArgumentException("An input file must be provided");
        }

        OutputFormat outputFormat = resolveOutputFormat(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        ParserOptions defaults = ParserOptions.defaults();

        boolean strikethrough = arguments.noStrikethrough()
                ? false
                : readBoolean(ENV_STRIKETHROUGH).orElse(defaults.strikethrough());
        boolean sanitize = arguments.sanitize() || readBoolean(ENV_SANITIZE).orElse(defaults.sanitize());
        boolean breaks = arguments.breaks() || readBoolean(ENV_BREAKS).orElse(defaults.breaks());
        String langPrefix = environmentReader.get(ENV_LANG_PREFIX)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(defaults.langPrefix());

        ParserOptions parserOptions = new ParserOptions(strikethrough, sanitize, breaks, langPrefix);
        return new Config(arguments.command(), arguments.input(), Optional.ofNullable(arguments.output()),
                outputFormat, arguments.fullPage(), Optional.ofNullable(arguments.title()), logFormat,
                arguments.verbose(), parserOptions);
    }

    private OutputFormat resolveOutputFormat(CliArguments arguments) {
        OutputFormat cliFormat = arguments.format();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_OUTPUT_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(OutputFormat::from)
                .orElse(OutputFormat.HTML);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Boolean> readBoolean(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parseBoolean(key, value));
    }

    static boolean parseBoolean(String key, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new IllegalArgumentException(key + " must be true, false, 1 or 0 but was: " + raw);
        };
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
