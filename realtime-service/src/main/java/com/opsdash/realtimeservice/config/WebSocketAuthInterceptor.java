package com.opsdash.realtimeservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Validates the JWT carried in the Authorization header of the STOMP CONNECT frame.
 *
 * The principal name becomes the JWT subject, so user destinations resolve per user.
 * The dashboard role claim is kept in the session attributes for mount requests.
 *
 * Client usage:
 * <pre>
 * stompClient.connect({ 'Authorization': 'Bearer ' + jwtToken }, onConnect, onError);
 * </pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketAuthInterceptor implements ChannelInterceptor {

    public static final String ROLE_CLAIM = "role";
    public static final String SESSION_ROLE_ATTRIBUTE = "opsdash.role";

    private final JwtDecoder jwtDecoder;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);

        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        List<String> authorizationHeaders = accessor.getNativeHeader("Authorization");
        if (authorizationHeaders == null || authorizationHeaders.isEmpty()) {
            log.warn("WebSocket connection attempt without Authorization header");
            throw new IllegalArgumentException("Missing Authorization header");
        }

        String authHeader = authorizationHeaders.get(0);
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            log.warn("WebSocket connection attempt without Bearer token");
            throw new IllegalArgumentException("Authorization header must start with 'Bearer '");
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(authHeader.substring(7));
        } catch (Exception e) {
            log.error("WebSocket JWT validation failed: {}", e.getMessage());
            throw new IllegalArgumentException("Invalid JWT token");
        }

        String userId = jwt.getSubject();
        String role = jwt.getClaimAsString(ROLE_CLAIM);

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                userId,
                null,
                Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER")));
        accessor.setUser(authentication);

        Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
        if (sessionAttributes != null && role != null) {
            sessionAttributes.put(SESSION_ROLE_ATTRIBUTE, role);
        }

        log.info("WebSocket authentication successful: userId={}, role={}", userId, role);
        return message;
    }
}
