package ai.docsite.markdown.cli;

import ai.docsite.markdown.config.OutputFormat;
import picocli.CommandLine;

/**
 * Parses {@code --format} values, accepting {@code md} as a short form of markdown.
 */
public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
    @Override
    public OutputFormat convert(String value) {
        return OutputFormat.from(value);
    }
}
