package com.gentrade.backtester.config;

import com.gentrade.backtester.infrastructure.broker.RedisBrokerConnectionPool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis configuration for the job queue.
 * Publishing goes through a bounded connection pool; consuming uses the shared template.
 */
@Configuration
public class RedisConfig {

        @Bean
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
                return new StringRedisTemplate(connectionFactory);
        }

        @Bean(destroyMethod = "close")
        public RedisBrokerConnectionPool brokerConnectionPool(
                        RedisProperties redisProperties,
                        @Value("${backtest.broker.queue:backtest-jobs}") String queueName,
                        @Value("${backtest.broker.pool.max-idle:4}") int maxIdle,
                        @Value("${backtest.broker.pool.max-total:8}") int maxTotal,
                        @Value("${backtest.broker.pool.borrow-timeout:5s}") Duration borrowTimeout) {
                // Not a bean: a second RedisConnectionFactory would switch off Boot's auto-configured one
                LettuceConnectionFactory brokerFactory = brokerConnectionFactory(redisProperties);
                brokerFactory.afterPropertiesSet();
                brokerFactory.start();
                return new RedisBrokerConnectionPool(brokerFactory, queueName, maxIdle, maxTotal, borrowTimeout);
        }

        /**
         * Connection factory owned by the broker pool. Every connection it hands out has its
         * own native Lettuce connection, so discarding a pool entry closes its transport.
         */
        static LettuceConnectionFactory brokerConnectionFactory(RedisProperties properties) {
                RedisStandaloneConfiguration standalone =
                                new RedisStandaloneConfiguration(properties.getHost(), properties.getPort());
                standalone.setDatabase(properties.getDatabase());
                standalone.setUsername(properties.getUsername());
                if (properties.getPassword() != null) {
                        standalone.setPassword(RedisPassword.of(properties.getPassword()));
                }

                LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder();
                if (properties.getTimeout() != null) {
                        client.commandTimeout(properties.getTimeout());
                }

                LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, client.build());
                factory.setShareNativeConnection(false);
                return factory;
        }
}
