package com.tinykv.command;

import com.tinykv.core.InMemoryStore;
import com.tinykv.core.MutableClock;
import com.tinykv.network.protocol.Command;
import com.tinykv.network.protocol.Reply;
import com.tinykv.util.MetricsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class CommandInterpreterTest {

    private MutableClock clock;
    private InMemoryStore store;
    private MetricsCollector metrics;
    private CommandInterpreter interpreter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        store = new InMemoryStore(0, clock);
        metrics = new MetricsCollector();
        interpreter = new CommandInterpreter(store, metrics);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private Reply run(String name, String... args) {
        return interpreter.execute(Command.of(name, args));
    }

    @Test
    void constructor_rejectsNullStore() {
        assertThatThrownBy(() -> new CommandInterpreter(null, metrics))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void setThenGet_returnsValue() {
        assertThat(run("SET", "k", "v")).isEqualTo(Reply.ok());
        assertThat(run("GET", "k")).isEqualTo(Reply.bulk("v"));
    }

    @Test
    void get_missingKey_returnsNil() {
        assertThat(run("GET", "missing").isNil()).isTrue();
    }

    @Test
    void commandNames_areCaseInsensitive() {
        assertThat(run("set", "k", "v")).isEqualTo(Reply.ok());
        assertThat(run("Get", "k")).isEqualTo(Reply.bulk("v"));
        assertThat(run("eXiStS", "k")).isEqualTo(Reply.integer(1));
    }

    @Test
    void del_reportsWhetherKeyWasRemoved() {
        run("SET", "k", "v");

        assertThat(run("DEL", "k")).isEqualTo(Reply.integer(1));
        assertThat(run("DEL", "k")).isEqualTo(Reply.integer(0));
    }

    @Test
    void delete_isAliasForDel() {
        run("SET", "k", "v");

        assertThat(run("DELETE", "k")).isEqualTo(Reply.integer(1));
        assertThat(run("EXISTS", "k")).isEqualTo(Reply.integer(0));
    }

    @Test
    void exists_reportsLiveness() {
        assertThat(run("EXISTS", "k")).isEqualTo(Reply.integer(0));
        run("SET", "k", "v");
        assertThat(run("EXISTS", "k")).isEqualTo(Reply.integer(1));
    }

    @Test
    void set_withBareTtl_expiresAfterMillis() {
        assertThat(run("SET", "k", "v", "500")).isEqualTo(Reply.ok());

        clock.advance(499);
        assertThat(run("GET", "k")).isEqualTo(Reply.bulk("v"));
        clock.advance(1);
        assertThat(run("GET", "k").isNil()).isTrue();
    }

    @Test
    void set_withEx_expiresAfterSeconds() {
        assertThat(run("SET", "k", "v", "ex", "2")).isEqualTo(Reply.ok());

        clock.advance(1999);
        assertThat(run("EXISTS", "k")).isEqualTo(Reply.integer(1));
        clock.advance(1);
        assertThat(run("EXISTS", "k")).isEqualTo(Reply.integer(0));
    }

    @Test
    void set_withPx_expiresAfterMillis() {
        assertThat(run("SET", "k", "v", "PX", "10")).isEqualTo(Reply.ok());

        clock.advance(10);
        assertThat(run("GET", "k").isNil()).isTrue();
    }

    @Test
    void set_withoutTtl_clearsEarlierTtl() {
        run("SET", "k", "v1", "PX", "10");
        run("SET", "k", "v2");

        clock.advance(1000);
        assertThat(run("GET", "k")).isEqualTo(Reply.bulk("v2"));
    }

    @Test
    void set_invalidTtl_returnsErrorAndLeavesStoreUnchanged() {
        run("SET", "k", "original");
        long sequence = store.sequence();

        assertThat(run("SET", "k", "v", "0")).isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "-5")).isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "abc")).isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "EX", "0")).isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "EX", Long.toString(Long.MAX_VALUE)))
                .isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "PX", "1.5")).isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "PX", "99999999999999999999"))
                .isEqualTo(Reply.error(CommandInterpreter.ERR_EXPIRE));
        assertThat(run("SET", "k", "v", "XX", "10")).isEqualTo(Reply.error(CommandInterpreter.ERR_SYNTAX));

        assertThat(run("GET", "k")).isEqualTo(Reply.bulk("original"));
        assertThat(store.sequence()).isEqualTo(sequence);
    }

    @Test
    void set_emptyKey_isRejected() {
        Reply reply = run("SET", "", "v");

        assertThat(reply.isError()).isTrue();
        assertThat(reply.getText()).startsWith("ERROR: invalid argument");
        assertThat(store.size()).isZero();
    }

    @Test
    void malformedUtf8Key_isRejectedWithoutTouchingStore() {
        byte[] ff = {(byte) 0xff};
        byte[] fe = {(byte) 0xfe};

        Reply set = interpreter.execute(new Command("SET", List.of(ff, "a".getBytes(StandardCharsets.UTF_8))));
        Reply get = interpreter.execute(new Command("GET", List.of(fe)));
        Reply mset = interpreter.execute(new Command("MSET",
                List.of("ok".getBytes(StandardCharsets.UTF_8), new byte[]{1}, fe, new byte[]{2})));

        assertThat(set.getText()).isEqualTo("ERROR: invalid argument: Key is not valid UTF-8");
        assertThat(get.getText()).isEqualTo("ERROR: invalid argument: Key is not valid UTF-8");
        assertThat(mset.isError()).isTrue();
        assertThat(store.size()).isZero();
        assertThat(store.sequence()).isZero();
    }

    @Test
    void distinctMultibyteKeys_stayDistinct() {
        run("SET", "é", "1");
        run("SET", "è", "2");

        assertThat(run("GET", "é")).isEqualTo(Reply.bulk("1"));
        assertThat(run("GET", "è")).isEqualTo(Reply.bulk("2"));
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void set_valueIsBinarySafe() {
        byte[] value = {0, '\r', '\n', (byte) 0xff};
        interpreter.execute(new Command("SET", List.of("k".getBytes(StandardCharsets.UTF_8), value)));

        assertThat(run("GET", "k").getBulk()).isEqualTo(value);
    }

    @Test
    void unknownCommand_returnsError() {
        assertThat(run("INCR", "k")).isEqualTo(Reply.error(CommandInterpreter.ERR_UNKNOWN));
        assertThat(metrics.getTotalErrors()).isEqualTo(1);
    }

    @Test
    void wrongArity_returnsError() {
        assertThat(run("GET")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("GET", "a", "b")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("SET", "k")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("SET", "k", "v", "EX", "1", "extra")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("DEL")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("EXISTS")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("FLUSH", "now")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("MGET")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("MSET", "k")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));
        assertThat(run("MSET", "a", "1", "b")).isEqualTo(Reply.error(CommandInterpreter.ERR_ARITY));

        assertThat(store.sequence()).isZero();
    }

    @Test
    void ping_withAndWithoutMessage() {
        assertThat(run("PING")).isEqualTo(Reply.pong());
        assertThat(run("PING", "hello")).isEqualTo(Reply.bulk("hello"));
    }

    @Test
    void flush_removesEverythingAndReturnsCount() {
        run("SET", "a", "1");
        run("SET", "b", "2");

        assertThat(run("FLUSH")).isEqualTo(Reply.integer(2));
        assertThat(run("EXISTS", "a")).isEqualTo(Reply.integer(0));
        assertThat(run("FLUSH")).isEqualTo(Reply.integer(0));
    }

    @Test
    void mset_thenMget() {
        assertThat(run("MSET", "a", "1", "b", "2")).isEqualTo(Reply.integer(2));

        Reply reply = run("MGET", "a", "missing", "b");

        assertThat(reply.getType()).isEqualTo(Reply.Type.ARRAY);
        assertThat(reply.getElements())
                .containsExactly(Reply.bulk("1"), Reply.nil(), Reply.bulk("2"));
    }

    @Test
    void mset_emptyKeyAnywhere_writesNothing() {
        Reply reply = run("MSET", "a", "1", "", "2");

        assertThat(reply.isError()).isTrue();
        assertThat(run("EXISTS", "a")).isEqualTo(Reply.integer(0));
        assertThat(store.sequence()).isZero();
    }

    @Test
    void metrics_recordCommandsAndHits() {
        run("SET", "k", "v");
        run("GET", "k");
        run("GET", "missing");
        run("get", "k");

        assertThat(metrics.getCommandCount("SET")).isEqualTo(1);
        assertThat(metrics.getCommandCount("GET")).isEqualTo(3);
        assertThat(metrics.getHitRate()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(metrics.getTotalErrors()).isZero();
    }

    @Test
    void randomOperations_matchReferenceModel() {
        Random random = new Random(42);
        Map<String, String> model = new HashMap<>();
        String[] keys = {"a", "b", "c", "d", "e"};

        for (int i = 0; i < 5000; i++) {
            String key = keys[random.nextInt(keys.length)];
            switch (random.nextInt(4)) {
                case 0: {
                    String value = "v" + random.nextInt(100);
                    assertThat(run("SET", key, value)).isEqualTo(Reply.ok());
                    model.put(key, value);
                    break;
                }
                case 1: {
                    String expected = model.get(key);
                    Reply reply = run("GET", key);
                    if (expected == null) {
                        assertThat(reply.isNil()).isTrue();
                    } else {
                        assertThat(reply).isEqualTo(Reply.bulk(expected));
                    }
                    break;
                }
                case 2:
                    assertThat(run("DEL", key))
                            .isEqualTo(Reply.integer(model.remove(key) != null ? 1 : 0));
                    break;
                default:
                    assertThat(run("EXISTS", key))
                            .isEqualTo(Reply.integer(model.containsKey(key) ? 1 : 0));
            }
        }

        assertThat(store.size()).isEqualTo(model.size());
    }
}
