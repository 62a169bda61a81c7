package com.tinykv.command;

import java.util.HashMap;
import java.util.Map;

/**
 * Commands understood by the interpreter, with the argument counts they accept
 * (not counting the command name itself).
 */
public enum CommandType {

    SET("SET", 2, 4),
    GET("GET", 1, 1),
    DEL("DEL", 1, 1),
    DELETE("DELETE", 1, 1),
    EXISTS("EXISTS", 1, 1),
    MGET("MGET", 1, Integer.MAX_VALUE),
    MSET("MSET", 2, Integer.MAX_VALUE),
    FLUSH("FLUSH", 0, 0),
    PING("PING", 0, 1);

    private static final Map<String, CommandType> BY_NAME = new HashMap<>();

    static {
        for (CommandType type : values()) {
            BY_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;
    private final int minArgs;
    private final int maxArgs;

    CommandType(String wireName, int minArgs, int maxArgs) {
        this.wireName = wireName;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    /**
     * Look up a command by its upper-cased wire name.
     *
     * @return the command type, or null if unknown
     */
    public static CommandType lookup(String normalizedName) {
        return BY_NAME.get(normalizedName);
    }

    public boolean acceptsArgCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    public String getWireName() {
        return wireName;
    }
}
