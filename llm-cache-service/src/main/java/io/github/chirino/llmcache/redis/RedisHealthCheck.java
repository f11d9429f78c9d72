package io.github.chirino.llmcache.redis;

import io.quarkus.redis.client.RedisClientName;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

@Readiness
@ApplicationScoped
public class RedisHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(RedisHealthCheck.class);

    public enum Status {
        OK("ok"),
        ERROR("error"),
        DISABLED("disabled");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }
    }

    @ConfigProperty(name = "llm-cache.storage.type", defaultValue = "redis")
    String storageType;

    @ConfigProperty(name = "llm-cache.redis.timeout", defaultValue = "PT5S")
    Duration timeout;

    @Any @Inject Instance<ReactiveRedisDataSource> redisSources;

    @ConfigProperty(name = "llm-cache.redis.client")
    Optional<String> clientName;

    @Override
    public HealthCheckResponse call() {
        if (!redisSelected()) {
            return HealthCheckResponse.named("Redis").up().withData("redis", "disabled").build();
        }
        try {
            Response response = ping();
            if (response == null) {
                return HealthCheckResponse.named("Redis")
                        .down()
                        .withData("reason", "No Redis client available")
                        .build();
            }
            return HealthCheckResponse.named("Redis")
                    .up()
                    .withData("response", response.toString())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("Redis")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }

    /** Connectivity summary reported by the public health endpoint. */
    public Status status() {
        if (!redisSelected()) {
            return Status.DISABLED;
        }
        try {
            return ping() != null ? Status.OK : Status.ERROR;
        } catch (Exception e) {
            LOG.debugf(e, "Redis ping failed");
            return Status.ERROR;
        }
    }

    private boolean redisSelected() {
        return storageType != null && "redis".equalsIgnoreCase(storageType.trim());
    }

    /** Null when no Redis client is configured. */
    private Response ping() {
        Instance<ReactiveRedisDataSource> selected =
                clientName
                        .filter(name -> !name.isBlank())
                        .map(name -> redisSources.select(RedisClientName.Literal.of(name)))
                        .orElse(redisSources);
        if (selected.isUnsatisfied()) {
            return null;
        }
        return selected.get().execute("PING").await().atMost(timeout);
    }
}
