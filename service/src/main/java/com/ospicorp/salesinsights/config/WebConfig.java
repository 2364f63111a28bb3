package com.ospicorp.salesinsights.config;

import com.ospicorp.salesinsights.web.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.ShallowEtagHeaderFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final List<String> allowedOrigins;

  public WebConfig(@Value("${insights.web.allowed-origins:}") List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(0, new CsvHttpMessageConverter());
  }

  @Override
  public void addCorsMappings(@NonNull CorsRegistry registry) {
    if (allowedOrigins.isEmpty()) {
      return;
    }
    registry.addMapping("/v1/**")
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .allowedMethods("GET")
        .exposedHeaders("X-Forecast-Source", "ETag");
  }

  // read endpoints only
  @Bean
  FilterRegistrationBean<ShallowEtagHeaderFilter> shallowEtagHeaderFilter() {
    FilterRegistrationBean<ShallowEtagHeaderFilter> registration =
        new FilterRegistrationBean<>(new ShallowEtagHeaderFilter());
    registration.addUrlPatterns("/v1/*");
    return registration;
  }
}
