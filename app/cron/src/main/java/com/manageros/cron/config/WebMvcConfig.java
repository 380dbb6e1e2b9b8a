/*
 * Where: Cron web configuration
 * What: Applies RequestMdcInterceptor to the cron API
 * Why: API logs carry the request id next to the run id the runner adds
 */
package com.manageros.cron.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@ConditionalOnWebApplication
public class WebMvcConfig implements WebMvcConfigurer {

  @Bean
  RequestMdcInterceptor requestMdcInterceptor() {
    return new RequestMdcInterceptor();
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor()).addPathPatterns("/api/cron/**");
  }
}
