package ai.docsite.markdown.cli;

import ai.docsite.markdown.config.Command;
import picocli.CommandLine;

public class CommandConverter implements CommandLine.ITypeConverter<Command> {
    @Override
    public Command convert(String value) {
        return Command.from(value);
    }
}
