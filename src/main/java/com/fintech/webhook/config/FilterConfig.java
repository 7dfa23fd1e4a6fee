package com.fintech.webhook.config;

import com.fintech.webhook.security.WebhookAdmissionFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<WebhookAdmissionFilter> webhookAdmissionFilterRegistration(
            WebhookAdmissionFilter admissionFilter) {
        FilterRegistrationBean<WebhookAdmissionFilter> registrationBean = new FilterRegistrationBean<>();

        registrationBean.setFilter(admissionFilter);

        // /health and /actuator stay outside the gates
        registrationBean.addUrlPatterns("/webhook/*");
        registrationBean.addUrlPatterns("/admin/*");
        registrationBean.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);

        return registrationBean;
    }
}
