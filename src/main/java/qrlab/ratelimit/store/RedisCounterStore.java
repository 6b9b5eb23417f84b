package qrlab.ratelimit.store;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.CounterStoreUnavailableException;
import qrlab.config.QrLabConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Counters in Redis, shared by every process pointing at the same server.
 *
 * <p>{@link #incrementIfAllBelow} runs as one Lua script, so no other client can slip an increment between
 * the check and the update. The connection is opened on first use and Lettuce reconnects on its own, so a
 * store created while Redis is down starts working once Redis is back.
 */
public class RedisCounterStore implements CounterStore, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    static final int SCAN_BATCH = 500;

    /*
     * KEYS: counters. ARGV: limits, then TTLs in seconds, one each per key.
     * Returns {0, new counts...} when applied, {blocked index (1-based), current counts...} otherwise.
     */
    static final String INCREMENT_IF_ALL_BELOW =
            "local n = #KEYS\n"
            + "local counts = {}\n"
            + "for i = 1, n do\n"
            + "  counts[i] = tonumber(redis.call('GET', KEYS[i]) or '0')\n"
            + "end\n"
            + "for i = 1, n do\n"
            + "  if counts[i] >= tonumber(ARGV[i]) then\n"
            + "    local out = {i}\n"
            + "    for j = 1, n do out[j + 1] = counts[j] end\n"
            + "    return out\n"
            + "  end\n"
            + "end\n"
            + "local out = {0}\n"
            + "for i = 1, n do\n"
            + "  out[i + 1] = redis.call('INCR', KEYS[i])\n"
            + "  redis.call('EXPIRE', KEYS[i], tonumber(ARGV[n + i]))\n"
            + "end\n"
            + "return out\n";

    private final RedisClient client;
    private final RedisURI uri;
    private volatile StatefulRedisConnection<String, String> connection;

    /**
     * @param redisUrl e.g. {@code redis://localhost:6379/0}
     * @param timeout  connect and command timeout
     */
    public RedisCounterStore(String redisUrl, Duration timeout) {
        this.uri = RedisURI.create(redisUrl);
        this.uri.setTimeout(timeout);
        this.client = RedisClient.create();
        this.client.setOptions(ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .timeoutOptions(TimeoutOptions.enabled(timeout))
                .build());
    }

    public static RedisCounterStore create(QrLabConfig config) {
        return new RedisCounterStore(config.redisUrl(), config.redisTimeout());
    }

    @Override
    public BatchOutcome incrementIfAllBelow(String scope, List<CounterSpec> counters) {
        var keys = new String[counters.size()];
        var args = new String[counters.size() * 2];
        for (int i = 0; i < counters.size(); i++) {
            var spec = counters.get(i);
            keys[i] = spec.key();
            args[i] = Long.toString(spec.limit());
            args[counters.size() + i] = Long.toString(Math.max(1, spec.ttl().toSeconds()));
        }
        List<Object> reply;
        try {
            reply = commands().eval(INCREMENT_IF_ALL_BELOW, ScriptOutputType.MULTI, keys, args);
        } catch (RedisException e) {
            throw unavailable("increment " + scope, e);
        }
        return toOutcome(reply, counters.size());
    }

    static BatchOutcome toOutcome(List<Object> reply, int expected) {
        if (reply == null || reply.size() != expected + 1) {
            throw new IllegalStateException("unexpected script reply " + reply);
        }
        var counts = new ArrayList<Long>(expected);
        for (int i = 1; i < reply.size(); i++) {
            counts.add(((Number) reply.get(i)).longValue());
        }
        int blocked = ((Number) reply.get(0)).intValue();
        return blocked == 0 ? BatchOutcome.applied(counts) : BatchOutcome.blocked(blocked - 1, counts);
    }

    @Override
    public long get(String key) {
        try {
            var value = commands().get(key);
            return value == null ? 0 : Long.parseLong(value);
        } catch (RedisException e) {
            throw unavailable("get " + key, e);
        }
    }

    /** SCAN + DEL in batches, never KEYS, so a large keyspace does not block the server. */
    @Override
    public long deleteByPrefix(String prefix) {
        var args = ScanArgs.Builder.matches(escapeGlob(prefix) + "*").limit(SCAN_BATCH);
        long removed = 0;
        try {
            var redis = commands();
            KeyScanCursor<String> cursor = redis.scan(args);
            while (true) {
                if (!cursor.getKeys().isEmpty()) {
                    removed += redis.del(cursor.getKeys().toArray(new String[0]));
                }
                if (cursor.isFinished()) {
                    break;
                }
                cursor = redis.scan(cursor, args);
            }
        } catch (RedisException e) {
            throw unavailable("delete " + prefix + "*", e);
        }
        log.debug("deleted {} keys with prefix {}", removed, prefix);
        return removed;
    }

    @Override
    public boolean ping() {
        try {
            return "PONG".equalsIgnoreCase(commands().ping());
        } catch (RedisException | CounterStoreUnavailableException e) {
            log.debug("ping failed: {}", e.toString());
            return false;
        }
    }

    /** Backslash-escapes the characters SCAN MATCH treats as glob syntax. */
    static String escapeGlob(String literal) {
        var out = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private RedisCommands<String, String> commands() {
        var current = connection;
        if (current == null) {
            synchronized (this) {
                current = connection;
                if (current == null) {
                    try {
                        current = client.connect(uri);
                    } catch (RedisException e) {
                        throw unavailable("connect " + uri.getHost() + ":" + uri.getPort(), e);
                    }
                    connection = current;
                    log.info("connected to redis at {}:{}", uri.getHost(), uri.getPort());
                }
            }
        }
        return current.sync();
    }

    private static CounterStoreUnavailableException unavailable(String operation, RedisException e) {
        return new CounterStoreUnavailableException("counter store unavailable: " + operation, e);
    }

    @Override
    public void close() {
        var current = connection;
        if (current != null) {
            current.close();
        }
        client.shutdown();
    }
}
