package com.scorebench.evaluator.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis lists as the compute queue. Producers RPUSH, workers BLPOP, so runs
 * are consumed in publish order per list.
 *
 * Keys:
 *   {prefix}:{queue}                    shared default namespace
 *   {prefix}:vhost:{vhost}:{queue}      a competition's isolated namespace
 */
@Component
public class RedisWorkQueue implements WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(RedisWorkQueue.class);
    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private final StringRedisTemplate redis;
    private final String              keyPrefix;

    public RedisWorkQueue(StringRedisTemplate redis,
                          @Value("${scorebench.queue.key-prefix:scorebench}") String keyPrefix) {
        this.redis     = redis;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void publish(String queueName, RunEnvelope envelope, Duration softTimeLimit, QueueRoute route) {
        String key = key(queueName, route);
        String payload = serialize(new QueuedRun(envelope, softTimeLimit.toSeconds()));
        Long depth;
        try {
            depth = redis.opsForList().rightPush(key, payload);
        } catch (RuntimeException e) {
            throw new DispatchException("Could not publish job " + envelope.id() + " to " + key, e);
        }
        if (depth == null) {
            throw new DispatchException("Redis returned no queue depth for " + key);
        }
        log.debug("Published job {} to {} (depth {})", envelope.id(), key, depth);
    }

    @Override
    public Optional<QueuedRun> poll(String queueName, QueueRoute route, Duration timeout) {
        // BLPOP treats 0 as "block forever".
        long seconds = Math.max(1, timeout.toSeconds());
        String payload = redis.opsForList().leftPop(key(queueName, route), seconds, TimeUnit.SECONDS);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(payload, QueuedRun.class));
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable queue payload from {}: {}", queueName, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    String key(String queueName, QueueRoute route) {
        if (route.isolated()) {
            return keyPrefix + ":vhost:" + route.vhost() + ":" + queueName;
        }
        return keyPrefix + ":" + queueName;
    }

    private static String serialize(QueuedRun run) {
        try {
            return MAPPER.writeValueAsString(run);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Failed to serialize run " + run.envelope().id(), e);
        }
    }
}
