package com.gs.ep.pdftranslator.cache;

import com.gs.ep.pdftranslator.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed translation store, shared between machines.
 *
 * <p>
 * Each (engine, params) pair owns one hash at
 * {@code translation:{engine}:{md5(params)}}; the original text is the hash field
 * and the translation its value, so {@code HSET} replaces an existing row
 * atomically.
 * </p>
 */
public class RedisCacheStore implements CacheStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisCacheStore.class);
    static final String KEY_PREFIX = "translation:";
    static final int SCAN_COUNT = 500;

    private final JedisPool jedisPool;
    private final int cacheTtl;

    public RedisCacheStore(TranslationConfig config) {
        this(createPool(config), config.getRedisCacheTtl());
        LOGGER.info("Translation cache using Redis {}:{} db={}", config.getRedisHost(), config.getRedisPort(),
                config.getRedisDb());
    }

    public RedisCacheStore(JedisPool jedisPool, int cacheTtl) {
        this.jedisPool = jedisPool;
        this.cacheTtl = cacheTtl;
    }

    private static JedisPool createPool(TranslationConfig config) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(10);
        poolConfig.setMaxIdle(5);
        poolConfig.setMinIdle(1);
        poolConfig.setTestOnBorrow(true);

        String password = config.getRedisPassword();
        return new JedisPool(poolConfig,
                config.getRedisHost(),
                config.getRedisPort(),
                2000,
                password == null || password.isEmpty() ? null : password,
                config.getRedisDb());
    }

    @Override
    public Optional<String> find(String engine, String params, String originalText) throws IOException {
        try (Jedis jedis = jedisPool.getResource()) {
            return Optional.ofNullable(jedis.hget(hashKey(engine, params), originalText));
        } catch (RuntimeException e) {
            throw new IOException("Redis lookup failed", e);
        }
    }

    @Override
    public void upsert(String engine, String params, String originalText, String translation) throws IOException {
        String key = hashKey(engine, params);
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.hset(key, originalText, translation);
            if (cacheTtl > 0) {
                jedis.expire(key, cacheTtl);
            }
        } catch (RuntimeException e) {
            throw new IOException("Redis write failed", e);
        }
    }

    @Override
    public long count() throws IOException {
        try (Jedis jedis = jedisPool.getResource()) {
            long total = 0;
            for (String key : scanKeys(jedis)) {
                total += jedis.hlen(key);
            }
            return total;
        } catch (RuntimeException e) {
            throw new IOException("Redis count failed", e);
        }
    }

    @Override
    public void clear() throws IOException {
        try (Jedis jedis = jedisPool.getResource()) {
            List<String> keys = scanKeys(jedis);
            if (!keys.isEmpty()) {
                jedis.del(keys.toArray(new String[0]));
            }
            LOGGER.info("Removed {} cached translation hashes from Redis", keys.size());
        } catch (RuntimeException e) {
            throw new IOException("Redis clear failed", e);
        }
    }

    /**
     * Every translation hash key, walked with SCAN so the server is never blocked
     * by a full keyspace listing. SCAN may repeat a key; the result does not.
     */
    static List<String> scanKeys(Jedis jedis) {
        ScanParams params = new ScanParams().match(KEY_PREFIX + "*").count(SCAN_COUNT);
        Set<String> keys = new LinkedHashSet<>();
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            ScanResult<String> page = jedis.scan(cursor, params);
            keys.addAll(page.getResult());
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        return new ArrayList<>(keys);
    }

    @Override
    public void close() {
        jedisPool.close();
    }

    /**
     * Hash key for one (engine, params) pair:
     * translation:{engine}:{md5(params)}
     */
    static String hashKey(String engine, String params) {
        return KEY_PREFIX + engine + ":" + md5(params);
    }

    static String md5(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
