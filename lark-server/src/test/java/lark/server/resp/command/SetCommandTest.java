package lark.server.resp.command;

import lark.core.storage.Entry;
import lark.core.storage.InMemoryStore;
import lark.server.resp.RespValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SetCommandTest {

    private static final RespValue OK = new RespValue.SimpleString("OK");

    private AtomicLong now;
    private InMemoryStore store;
    private final SetCommand command = new SetCommand();

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000);
        store = new InMemoryStore(now::get);
    }

    private RespValue set(String... arguments) {
        List<RespValue> args = Arrays.stream(arguments)
                .map(RespValue.BulkString::new)
                .collect(Collectors.toList());
        return command.handle(args, store);
    }

    @Test
    void testSetWithoutExpiry() {
        assertEquals(OK, set("key", "value"));
        assertEquals(Entry.ofString("value"), store.lookup("key").orElseThrow());
    }

    @Test
    void testSetWithExpiry() {
        assertEquals(OK, set("key", "value", "PX", "50"));

        Entry entry = store.lookup("key").orElseThrow();
        assertEquals(OptionalLong.of(1_000 + TimeUnit.MILLISECONDS.toNanos(50)), entry.deletionTime());

        now.addAndGet(TimeUnit.MILLISECONDS.toNanos(50) - 1);
        assertTrue(store.lookup("key").isPresent());
        now.incrementAndGet();
        assertTrue(store.lookup("key").isEmpty());
    }

    @Test
    void testOptionNameIsCaseInsensitive() {
        assertEquals(OK, set("key", "value", "px", "10"));
        assertTrue(store.lookup("key").orElseThrow().deletionTime().isPresent());
    }

    @Test
    void testLastExpiryWins() {
        assertEquals(OK, set("key", "value", "PX", "10", "pX", "20"));
        assertEquals(OptionalLong.of(1_000 + TimeUnit.MILLISECONDS.toNanos(20)),
                store.lookup("key").orElseThrow().deletionTime());
    }

    @Test
    void testOverwriteReplacesTypeAndExpiry() {
        store.upsert("key", Entry.ofList(List.of("a")).withDeletion(5_000));

        assertEquals(OK, set("key", "v2"));

        assertEquals(Entry.ofString("v2"), store.lookup("key").orElseThrow());
    }

    @Test
    void testMissingArguments() {
        assertEquals(new RespValue.BulkError("ERR Missing key for 'SET' command"), set());
        assertEquals(new RespValue.BulkError("ERR Missing value for 'SET' command"), set("key"));
        assertEquals(0, store.size());
    }

    @Test
    void testArgumentsWithoutText() {
        RespValue badKey = command.handle(List.of(RespValue.NULL, new RespValue.BulkString("v")), store);
        assertEquals(new RespValue.BulkError("ERR Failed to extract key for 'SET' command"), badKey);

        RespValue badValue = command.handle(List.of(new RespValue.BulkString("k"), new RespValue.Integer(1)), store);
        assertEquals(new RespValue.BulkError("ERR Failed to extract value for 'SET' command"), badValue);

        RespValue badOption = command.handle(List.of(
                new RespValue.BulkString("k"), new RespValue.BulkString("v"), RespValue.Array.of()), store);
        assertEquals(new RespValue.BulkError("ERR Failed to extract option for 'SET' command"), badOption);
    }

    @Test
    void testUnknownOption() {
        assertEquals(new RespValue.BulkError("ERR EX is not a valid option for 'SET' command"),
                set("key", "value", "EX", "10"));
        assertFalse(store.contains("key"));
    }

    @Test
    void testMissingMilliseconds() {
        assertEquals(new RespValue.BulkError("ERR Missing milliseconds for PX option for 'SET' command"),
                set("key", "value", "PX"));
    }

    @Test
    void testInvalidMilliseconds() {
        RespValue expected = new RespValue.BulkError(
                "ERR Failed to convert PX duration string to a number for 'SET' command");

        assertEquals(expected, set("key", "value", "PX", "soon"));
        assertEquals(expected, set("key", "value", "PX", "-5"));
        assertFalse(store.contains("key"));
    }

    @Test
    void testDurationWithoutText() {
        RespValue response = command.handle(List.of(
                new RespValue.BulkString("k"),
                new RespValue.BulkString("v"),
                new RespValue.BulkString("PX"),
                RespValue.BulkString.absent()), store);

        assertEquals(new RespValue.BulkError("ERR Failed to extract duration string for 'SET' command"), response);
    }

    @Test
    void testHugeExpiryDoesNotExpireImmediately() {
        assertEquals(OK, set("key", "value", "PX", Long.toString(Long.MAX_VALUE)));
        assertTrue(store.lookup("key").isPresent());
    }
}
