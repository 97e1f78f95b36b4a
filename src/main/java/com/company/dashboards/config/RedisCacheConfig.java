package com.company.dashboards.config;

import com.company.dashboards.cache.CacheStore;
import com.company.dashboards.cache.RedisCacheStore;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Configuration
@Slf4j
@ConditionalOnProperty(value = "dashboards.cache.type", havingValue = "redis")
public class RedisCacheConfig {

    static final String CIRCUIT_BREAKER = "redisCache";

    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .build();

        // Short command timeout: a slow cache must not eat the cold-path latency budget
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(Duration.ofMillis(500))
                .build();

        RedisStandaloneConfiguration serverConfig = new RedisStandaloneConfiguration();
        serverConfig.setHostName(System.getenv().getOrDefault("REDIS_HOST", "localhost"));
        serverConfig.setPort(Integer.parseInt(System.getenv().getOrDefault("REDIS_PORT", "6379")));

        String password = System.getenv("REDIS_PASSWORD");
        if (password != null && !password.isEmpty()) {
            serverConfig.setPassword(password);
        }

        log.info("Using Redis cache at {}:{}", serverConfig.getHostName(), serverConfig.getPort());
        return new LettuceConnectionFactory(serverConfig, clientConfig);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate,
                                      CircuitBreakerRegistry circuitBreakerRegistry) {
        return new RedisCacheStore(redisTemplate, RedisCacheStore.cacheObjectMapper(),
                circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER));
    }
}
