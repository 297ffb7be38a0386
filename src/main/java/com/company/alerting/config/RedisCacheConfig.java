package com.company.alerting.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.Map;

/**
 * Redis holds two things: the reference data caches (escalation policies and service
 * mappings) and the per channel notification cooldown keys. Both tolerate Redis being
 * down; the commands time out fast and callers go to the database.
 */
@Configuration
@Slf4j
public class RedisCacheConfig {

    public static final String ESCALATION_POLICIES = "escalationPolicies";
    public static final String SERVICE_MAPPINGS = "serviceMappings";

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(2);

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties) {
        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(redisProperties.getConnectTimeout() != null
                                ? redisProperties.getConnectTimeout()
                                : Duration.ofSeconds(5))
                        .keepAlive(true)
                        .build())
                .autoReconnect(true)
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(redisProperties.getTimeout() != null ? redisProperties.getTimeout() : COMMAND_TIMEOUT)
                .build();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());
        if (redisProperties.getPassword() != null && !redisProperties.getPassword().isEmpty()) {
            server.setPassword(redisProperties.getPassword());
        }

        log.info("Redis at {}:{} (command timeout {})", redisProperties.getHost(), redisProperties.getPort(),
                clientConfig.getCommandTimeout());
        return new LettuceConnectionFactory(server, clientConfig);
    }

    /**
     * String keys and values; used for cooldown markers.
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new GenericJackson2JsonRedisSerializer(cacheObjectMapper()));
        template.setEnableTransactionSupport(false);
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    @Primary
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory, AlertingProperties properties) {
        RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new GenericJackson2JsonRedisSerializer(cacheObjectMapper())))
                .disableCachingNullValues()
                .prefixCacheNameWith("alerting:");

        AlertingProperties.Cache ttl = properties.getCache();
        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaults.entryTtl(ttl.getPolicyTtl()))
                .withInitialCacheConfigurations(Map.of(
                        ESCALATION_POLICIES, defaults.entryTtl(ttl.getPolicyTtl()),
                        SERVICE_MAPPINGS, defaults.entryTtl(ttl.getMappingTtl())))
                .transactionAware()
                .build();
    }

    // Typed JSON so cached policies and mapping lists come back as domain objects
    private static ObjectMapper cacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder()
                        .allowIfSubType("com.company.alerting.domain.")
                        .allowIfSubType("java.util.")
                        .allowIfSubType("java.time.")
                        .allowIfSubType("java.lang.")
                        .build(),
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY);
        return mapper;
    }
}
