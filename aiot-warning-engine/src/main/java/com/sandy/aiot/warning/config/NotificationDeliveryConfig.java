package com.sandy.aiot.warning.config;

import com.sandy.aiot.warning.service.NotificationDeliveryService;
import com.sandy.aiot.warning.service.impl.LoggingNotificationDeliveryService;
import com.sandy.aiot.warning.service.impl.MailNotificationDeliveryService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Arrays;
import java.util.List;

@Configuration
public class NotificationDeliveryConfig {

    @Bean
    @ConditionalOnProperty(name = "warning.mail.enabled", havingValue = "true")
    public NotificationDeliveryService mailNotificationDeliveryService(JavaMailSender mailSender,
                                                                       @Value("${warning.mail.from:aiot-warning@localhost}") String from,
                                                                       @Value("${warning.mail.recipients:}") String recipients) {
        List<String> to = Arrays.stream(recipients.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return new MailNotificationDeliveryService(mailSender, from, to);
    }

    @Bean
    @ConditionalOnMissingBean(NotificationDeliveryService.class)
    public NotificationDeliveryService loggingNotificationDeliveryService() {
        return new LoggingNotificationDeliveryService();
    }
}
