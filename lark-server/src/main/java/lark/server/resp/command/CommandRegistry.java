package lark.server.resp.command;

import lark.core.storage.KeyValueStore;
import lark.server.resp.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Commands keyed by upper-case name. Built once at startup and only read afterwards.
 */
public class CommandRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, Command> commands;

    private CommandRegistry(Map<String, Command> commands) {
        this.commands = Collections.unmodifiableMap(new HashMap<>(commands));
    }

    public static CommandRegistry defaults() {
        return builder()
                .register(new PingCommand())
                .register(new EchoCommand())
                .register(new GetCommand())
                .register(new SetCommand())
                .register(new RPushCommand())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RespValue dispatch(String name, List<RespValue> arguments, KeyValueStore store) {
        Command command = commands.get(normalize(name));
        if (command == null) {
            logger.debug("Rejected unknown command {}", name);
            return new RespValue.SimpleError("ERR Command (" + name + ") is not valid");
        }
        logger.trace("Dispatching {} with {} arguments", command.name(), arguments.size());
        return command.handle(arguments, store);
    }

    public RespValue dispatch(CommandRequest request, KeyValueStore store) {
        return dispatch(request.name(), request.arguments(), store);
    }

    public Optional<Command> lookup(String name) {
        return Optional.ofNullable(commands.get(normalize(name)));
    }

    public Set<String> names() {
        return commands.keySet();
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    public static class Builder {
        private final Map<String, Command> commands = new HashMap<>();

        private Builder() {
        }

        public Builder register(Command command) {
            String name = normalize(command.name());
            if (commands.putIfAbsent(name, command) != null) {
                throw new IllegalArgumentException("Command " + name + " is already registered");
            }
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(commands);
        }
    }
}
