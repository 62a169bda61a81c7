package com.tinykv.network.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Immutable parsed client request: a command name followed by zero or more
 * binary-safe arguments.
 */
public final class Command {

    private final String name;
    private final List<byte[]> args;

    /**
     * Create a new command.
     *
     * @param name the command name, matched case-insensitively
     * @param args the arguments, copied
     */
    public Command(String name, List<byte[]> args) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Command name cannot be null or empty");
        }
        this.name = name;
        List<byte[]> copy = new ArrayList<>(args.size());
        for (byte[] arg : args) {
            copy.add(Arrays.copyOf(arg, arg.length));
        }
        this.args = Collections.unmodifiableList(copy);
    }

    /**
     * Create a command from string parts, UTF-8 encoded.
     */
    public static Command of(String name, String... args) {
        List<byte[]> encoded = new ArrayList<>(args.length);
        for (String arg : args) {
            encoded.add(arg.getBytes(StandardCharsets.UTF_8));
        }
        return new Command(name, encoded);
    }

    /**
     * Build a command from the raw parts of a request, the first part being the name.
     */
    static Command fromParts(List<byte[]> parts) {
        String name = new String(parts.get(0), StandardCharsets.UTF_8);
        return new Command(name, parts.subList(1, parts.size()));
    }

    /**
     * Get the command name as sent by the client.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the upper-cased command name used for dispatch.
     */
    public String getNormalizedName() {
        return name.toUpperCase(Locale.ROOT);
    }

    public int argCount() {
        return args.size();
    }

    /**
     * Get the raw argument bytes without copying.
     * Use with caution - do not modify the returned array.
     */
    public byte[] getArgUnsafe(int index) {
        return args.get(index);
    }

    public byte[] getArg(int index) {
        byte[] arg = args.get(index);
        return Arrays.copyOf(arg, arg.length);
    }

    public String getArgString(int index) {
        return new String(args.get(index), StandardCharsets.UTF_8);
    }

    /**
     * Decode an argument used as a key.
     * Malformed UTF-8 is rejected instead of replaced, so two different byte
     * strings never name the same key.
     *
     * @throws IllegalArgumentException if the bytes are not valid UTF-8
     */
    public String getArgKey(int index) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(args.get(index)))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Key is not valid UTF-8");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Command command = (Command) o;
        if (!name.equals(command.name) || args.size() != command.args.size()) {
            return false;
        }
        for (int i = 0; i < args.size(); i++) {
            if (!Arrays.equals(args.get(i), command.args.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        for (byte[] arg : args) {
            result = 31 * result + Arrays.hashCode(arg);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Command{" +
               "name=" + name +
               ", args=" + args.size() +
               '}';
    }
}
