package in.greenhouse.infrastructure.cache;

import in.greenhouse.application.port.output.FastCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Redis implementation of {@link FastCache}.
 *
 * Uses a {@link JedisPool}; a single {@link Jedis} connection is not safe to share
 * between the scheduler, decision and MQTT threads.
 */
public class RedisFastCache implements FastCache, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RedisFastCache.class);

    private final JedisPool pool;

    public RedisFastCache(String host, int port) {
        this(new JedisPool(poolConfig(), host, port));
        log.info("[CACHE] Redis pool created for {}:{}", host, port);
    }

    public RedisFastCache(JedisPool pool) {
        this.pool = pool;
    }

    private static JedisPoolConfig poolConfig() {
        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(8);
        config.setMinIdle(1);
        config.setTestOnBorrow(true);
        return config;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(withJedis(key, jedis -> jedis.get(key)));
    }

    @Override
    public void set(String key, String value) {
        withJedis(key, jedis -> jedis.set(key, value));
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        withJedis(key, jedis -> jedis.set(key, value, SetParams.setParams().ex(ttl.toSeconds())));
    }

    @Override
    public void delete(String key) {
        withJedis(key, jedis -> jedis.del(key));
    }

    @Override
    public void expire(String key, Duration ttl) {
        withJedis(key, jedis -> jedis.expire(key, ttl.toSeconds()));
    }

    @Override
    public void listPush(String key, String value) {
        withJedis(key, jedis -> jedis.lpush(key, value));
    }

    @Override
    public void listTrim(String key, long start, long stop) {
        withJedis(key, jedis -> jedis.ltrim(key, start, stop));
    }

    @Override
    public List<String> listRange(String key, long start, long stop) {
        List<String> items = withJedis(key, jedis -> jedis.lrange(key, start, stop));
        return items == null ? List.of() : items;
    }

    private <T> T withJedis(String key, Function<Jedis, T> command) {
        try (Jedis jedis = pool.getResource()) {
            return command.apply(jedis);
        } catch (JedisException e) {
            throw new CacheException(key, "Redis command failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
