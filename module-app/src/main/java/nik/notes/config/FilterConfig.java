package nik.notes.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import nik.notes.global.filter.RateLimitingFilter;
import nik.notes.infrastructure.config.RateLimitProperties;
import nik.notes.infrastructure.executor.LogicExecutor;
import nik.notes.infrastructure.ratelimit.RateLimiter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/** 서블릿 필터 등록 (MDCFilter 다음 순서로 RateLimitingFilter) */
@Configuration
public class FilterConfig {

  @Bean
  public RateLimitingFilter rateLimitingFilter(
      RateLimiter rateLimiter,
      RateLimitProperties properties,
      ObjectMapper objectMapper,
      LogicExecutor executor) {
    return new RateLimitingFilter(rateLimiter, properties, objectMapper, executor);
  }

  @Bean
  public FilterRegistrationBean<RateLimitingFilter> rateLimitingFilterRegistration(
      RateLimitingFilter rateLimitingFilter) {
    FilterRegistrationBean<RateLimitingFilter> registration =
        new FilterRegistrationBean<>(rateLimitingFilter);
    registration.addUrlPatterns("/api/*");
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }
}
