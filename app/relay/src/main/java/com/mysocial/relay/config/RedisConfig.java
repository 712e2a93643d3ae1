/*
 * Where: Relay infrastructure configuration
 * What: StringRedisTemplate and the Lua scripts behind the unread counters
 * Why: Counter changes must be single atomic server-side operations, never read-modify-write
 */
package com.mysocial.relay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  @Bean
  RedisScript<Long> applyNotificationScript() {
    return loadScript("redis/apply-notification.lua");
  }

  @Bean
  RedisScript<Long> decrementUnreadScript() {
    return loadScript("redis/decrement-unread.lua");
  }

  @Bean
  RedisScript<Long> rebuildUnreadScript() {
    return loadScript("redis/rebuild-unread.lua");
  }

  private static RedisScript<Long> loadScript(String location) {
    final DefaultRedisScript<Long> script = new DefaultRedisScript<>();
    script.setLocation(new ClassPathResource(location));
    script.setResultType(Long.class);
    return script;
  }
}
