package com.eduhub.enrollment.infrastructure.realtime;

import com.eduhub.enrollment.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs and counts realtime sessions.
 * A lost connection is a silent unsubscribe: operations hold no
 * per-connection state, so nothing needs cleaning up.
 *
 * @author Enrollment Team
 */
@Component
public class RealtimeConnectionListener {

    private static final Logger logger = LoggerFactory.getLogger(RealtimeConnectionListener.class);

    private final CloudWatchMetricsService metricsService;
    private final AtomicLong activeConnections = new AtomicLong();

    public RealtimeConnectionListener(CloudWatchMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @EventListener
    public void onConnected(SessionConnectedEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        long active = activeConnections.incrementAndGet();
        metricsService.recordConnection("connected");
        logger.info("Realtime session connected: {} (active: {})", accessor.getSessionId(), active);
    }

    @EventListener
    public void onDisconnected(SessionDisconnectEvent event) {
        long active = activeConnections.updateAndGet(current -> Math.max(0, current - 1));
        metricsService.recordConnection("disconnected");
        logger.info("Realtime session disconnected: {} (status: {}, active: {})",
                event.getSessionId(), event.getCloseStatus(), active);
    }

    @EventListener
    public void onSubscribe(SessionSubscribeEvent event) {
        if (logger.isDebugEnabled()) {
            StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
            logger.debug("Subscribe: {} -> {}", accessor.getSessionId(), accessor.getDestination());
        }
    }

    public long getActiveConnections() {
        return activeConnections.get();
    }
}
