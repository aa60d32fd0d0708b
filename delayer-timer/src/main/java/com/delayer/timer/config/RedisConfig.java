package com.delayer.timer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.scripting.support.ResourceScriptSource;

import java.util.List;

/**
 * Redis configuration for the job pool, job buckets and ready queues.
 * Connection and pool settings come from {@code spring.data.redis.*}.
 */
@Configuration
public class RedisConfig {

        @Bean
        public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
                RedisTemplate<String, String> template = new RedisTemplate<>();
                template.setConnectionFactory(connectionFactory);

                // Producers and consumers exchange plain strings, so no JSON here
                StringRedisSerializer serializer = new StringRedisSerializer();
                template.setKeySerializer(serializer);
                template.setValueSerializer(serializer);
                template.setHashKeySerializer(serializer);
                template.setHashValueSerializer(serializer);

                template.afterPropertiesSet();
                return template;
        }

        /**
         * Moves job ids from the job pool to a ready queue, pushing only the ids it removed.
         * Replies with the queue length followed by the moved ids.
         */
        @Bean
        @SuppressWarnings("rawtypes")
        public RedisScript<List> promoteJobsScript() {
                DefaultRedisScript<List> script = new DefaultRedisScript<>();
                script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/promote-jobs.lua")));
                script.setResultType(List.class);
                return script;
        }
}
