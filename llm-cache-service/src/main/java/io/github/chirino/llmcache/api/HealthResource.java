package io.github.chirino.llmcache.api;

import io.github.chirino.llmcache.redis.RedisHealthCheck;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.health.Readiness;

@Path("/health")
public class HealthResource {

    @Inject @Readiness RedisHealthCheck redisHealthCheck;

    @GET
    @Blocking
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, String> health() {
        RedisHealthCheck.Status redis = redisHealthCheck.status();
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", redis == RedisHealthCheck.Status.ERROR ? "degraded" : "ok");
        body.put("redis", redis.value());
        return body;
    }
}
