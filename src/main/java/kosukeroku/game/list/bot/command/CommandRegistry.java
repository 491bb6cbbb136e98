package kosukeroku.game.list.bot.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class CommandRegistry {

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z]+");

    private final Map<String, CommandSpec> commands;

    private CommandRegistry(Map<String, CommandSpec> commands) {
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CommandSpec> lookup(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    // registration order
    public List<CommandSpec> listAll() {
        return List.copyOf(commands.values());
    }

    public static class Builder {

        private final Map<String, CommandSpec> commands = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, String argHint, String helpText, CommandHandler handler) {
            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Command names are lowercase words: " + name);
            }
            if (commands.containsKey(name)) {
                throw new IllegalArgumentException("Command registered twice: " + name);
            }
            commands.put(name, new CommandSpec(name, handler, argHint, helpText));
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(commands);
        }
    }
}
