package com.tinykv.command;

import com.tinykv.core.Entry;
import com.tinykv.core.KVStore;
import com.tinykv.network.protocol.Command;
import com.tinykv.network.protocol.Reply;
import com.tinykv.util.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps parsed commands onto store operations and builds the reply.
 *
 * The interpreter holds no per-connection state, so one instance is shared by
 * every session. Error replies never mutate the store.
 */
public class CommandInterpreter {

    private static final Logger logger = LoggerFactory.getLogger(CommandInterpreter.class);

    public static final String ERR_UNKNOWN = "ERROR: unknown command";
    public static final String ERR_ARITY = "ERROR: wrong number of arguments";
    public static final String ERR_EXPIRE = "ERROR: invalid expire time";
    public static final String ERR_SYNTAX = "ERROR: syntax error";
    public static final String ERR_INTERNAL = "ERROR: internal error";

    private static final long MAX_EXPIRE_SECONDS = Long.MAX_VALUE / 1000;

    private final KVStore store;
    private final MetricsCollector metrics;

    public CommandInterpreter(KVStore store, MetricsCollector metrics) {
        if (store == null) {
            throw new IllegalArgumentException("Store cannot be null");
        }
        this.store = store;
        this.metrics = metrics != null ? metrics : new MetricsCollector();
    }

    /**
     * Execute a single command against the store.
     *
     * @param command the parsed command
     * @return the reply to send; never null
     */
    public Reply execute(Command command) {
        long startTime = System.nanoTime();
        CommandType type = CommandType.lookup(command.getNormalizedName());
        if (type == null) {
            logger.debug("Unknown command: {}", command.getName());
            return fail(ERR_UNKNOWN);
        }
        if (!type.acceptsArgCount(command.argCount())) {
            return fail(ERR_ARITY);
        }

        Reply reply;
        try {
            reply = dispatch(type, command);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid argument for command {}: {}", type, e.getMessage());
            reply = Reply.error("ERROR: invalid argument: " + singleLine(e.getMessage()));
        }

        if (reply.isError()) {
            metrics.recordError();
        } else {
            metrics.recordCommand(type.getWireName(), System.nanoTime() - startTime);
        }
        return reply;
    }

    private Reply dispatch(CommandType type, Command command) {
        switch (type) {
            case SET:
                return handleSet(command);
            case GET:
                return handleGet(command);
            case DEL:
            case DELETE:
                return Reply.integer(store.delete(command.getArgKey(0)) ? 1 : 0);
            case EXISTS:
                return Reply.integer(store.exists(command.getArgKey(0)) ? 1 : 0);
            case MGET:
                return handleMget(command);
            case MSET:
                return handleMset(command);
            case FLUSH:
                return Reply.integer(store.clear());
            case PING:
                return command.argCount() == 0 ? Reply.pong() : Reply.bulk(command.getArg(0));
            default:
                return Reply.error(ERR_UNKNOWN);
        }
    }

    /**
     * SET key value [ttl-ms | EX seconds | PX millis]
     */
    private Reply handleSet(Command command) {
        String key = command.getArgKey(0);
        long ttlMillis = 0;

        if (command.argCount() == 3) {
            ttlMillis = parsePositive(command.getArgString(2));
            if (ttlMillis <= 0) {
                return Reply.error(ERR_EXPIRE);
            }
        } else if (command.argCount() == 4) {
            String option = command.getArgString(2).toUpperCase(Locale.ROOT);
            long amount = parsePositive(command.getArgString(3));
            if ("EX".equals(option)) {
                if (amount <= 0 || amount > MAX_EXPIRE_SECONDS) {
                    return Reply.error(ERR_EXPIRE);
                }
                ttlMillis = amount * 1000;
            } else if ("PX".equals(option)) {
                if (amount <= 0) {
                    return Reply.error(ERR_EXPIRE);
                }
                ttlMillis = amount;
            } else {
                return Reply.error(ERR_SYNTAX);
            }
        }

        store.set(key, command.getArg(1), ttlMillis);
        return Reply.ok();
    }

    private Reply handleGet(Command command) {
        Optional<Entry> entry = store.get(command.getArgKey(0));
        metrics.recordGetResult(entry.isPresent());
        return entry.map(e -> Reply.bulk(e.getValueUnsafe())).orElse(Reply.nil());
    }

    private Reply handleMget(Command command) {
        List<Reply> values = new ArrayList<>(command.argCount());
        for (int i = 0; i < command.argCount(); i++) {
            Optional<Entry> entry = store.get(command.getArgKey(i));
            metrics.recordGetResult(entry.isPresent());
            values.add(entry.map(e -> Reply.bulk(e.getValueUnsafe())).orElse(Reply.nil()));
        }
        return Reply.array(values);
    }

    /**
     * MSET writes each pair independently; it is not a transaction.
     */
    private Reply handleMset(Command command) {
        if (command.argCount() % 2 != 0) {
            return Reply.error(ERR_ARITY);
        }
        // Validate every key first so a bad pair doesn't leave a partial write
        List<String> keys = new ArrayList<>(command.argCount() / 2);
        for (int i = 0; i < command.argCount(); i += 2) {
            if (command.getArgUnsafe(i).length == 0) {
                throw new IllegalArgumentException("Key cannot be null or empty");
            }
            keys.add(command.getArgKey(i));
        }
        for (int i = 0; i < keys.size(); i++) {
            store.set(keys.get(i), command.getArg(2 * i + 1));
        }
        return Reply.integer(keys.size());
    }

    /**
     * Parse a strictly positive decimal number.
     *
     * @return the value, or -1 if the text is not a positive integer
     */
    private static long parsePositive(String text) {
        if (text.isEmpty() || text.length() > 19) {
            return -1;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private Reply fail(String message) {
        metrics.recordError();
        return Reply.error(message);
    }

    private static String singleLine(String message) {
        if (message == null) {
            return "";
        }
        return message.replace('\r', ' ').replace('\n', ' ');
    }
}
