package com.eduhub.enrollment.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over WebSocket configuration for realtime enrollment updates.
 *
 * Outbound topics:
 * - /topic/class/{classId}     - counts and roster changes for everyone watching a class
 * - /topic/student/{studentId} - personal status, position and offer updates
 * - /topic/teacher/{teacherId} - roster changes for classes the teacher owns
 *
 * Inbound (prefix /app): enrollment.request, enrollment.drop, waitlist.respond.
 * Results go back to the caller on /user/queue/enrollment-results.
 *
 * @author Enrollment Team
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConfig.class);

    @Value("${enrollment.realtime.allowed-origins:*}")
    private String allowedOrigins;

    @Value("${enrollment.realtime.heartbeat-ms:25000}")
    private long heartbeatMs;

    /**
     * In-memory broker for /topic and /queue, /app for inbound messages.
     * Publish order is preserved so a client sees one class's events in commit order.
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue")
                .setHeartbeatValue(new long[]{heartbeatMs, heartbeatMs})
                .setTaskScheduler(heartBeatScheduler());

        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
        config.setPreservePublishOrder(true);

        logger.info("WebSocket message broker configured (heartbeat: {}ms)", heartbeatMs);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins.split(","))
                .withSockJS()
                .setDisconnectDelay(30 * 1000);

        logger.info("STOMP endpoint registered: /ws (SockJS enabled)");
    }

    /**
     * Slow clients are dropped rather than allowed to back up the broker.
     */
    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        registry
                .setSendBufferSizeLimit(512 * 1024)
                .setSendTimeLimit(15000)
                .setMessageSizeLimit(64 * 1024);
    }

    /**
     * Inbound frames block on the class lock, so the pool is sized for waiting threads.
     */
    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.taskExecutor()
                .corePoolSize(16)
                .maxPoolSize(64)
                .keepAliveSeconds(60)
                .queueCapacity(1000);
    }

    @Bean
    public TaskScheduler heartBeatScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.initialize();
        return scheduler;
    }
}
