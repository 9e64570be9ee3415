package com.opsdash.realtimeservice.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WebSocketAuthInterceptor.
 * Covers token validation on CONNECT and the dashboard role kept for the session.
 */
@ExtendWith(MockitoExtension.class)
class WebSocketAuthInterceptorTest {

  private static final String TOKEN = "header.payload.signature";

  @Mock
  private JwtDecoder jwtDecoder;

  @Mock
  private MessageChannel messageChannel;

  @InjectMocks
  private WebSocketAuthInterceptor interceptor;

  private static Jwt jwt(String subject, String role) {
    Map<String, Object> claims = new HashMap<>();
    claims.put("sub", subject);
    if (role != null) {
      claims.put(WebSocketAuthInterceptor.ROLE_CLAIM, role);
    }
    return new Jwt(TOKEN, Instant.now(), Instant.now().plusSeconds(3600), Map.of("alg", "HS256"), claims);
  }

  private static StompHeaderAccessor connect(String authorization, Map<String, Object> sessionAttributes) {
    StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
    if (authorization != null) {
      accessor.setNativeHeader("Authorization", authorization);
    }
    accessor.setSessionAttributes(sessionAttributes);
    return accessor;
  }

  @Test
  void preSend_ValidToken_SetsPrincipalAndStoresRole() {
    // Arrange
    when(jwtDecoder.decode(TOKEN)).thenReturn(jwt("user-1", "Project Manager"));
    Map<String, Object> session = new HashMap<>();
    StompHeaderAccessor accessor = connect("Bearer " + TOKEN, session);
    Message<?> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());

    // Act
    Message<?> result = interceptor.preSend(message, messageChannel);

    // Assert
    StompHeaderAccessor resultAccessor = StompHeaderAccessor.wrap(result);
    assertThat(resultAccessor.getUser()).isNotNull();
    assertThat(resultAccessor.getUser().getName()).isEqualTo("user-1");
    assertThat(session).containsEntry(WebSocketAuthInterceptor.SESSION_ROLE_ATTRIBUTE, "Project Manager");
  }

  @Test
  void preSend_TokenWithoutRole_ConnectsWithoutRole() {
    // Arrange
    when(jwtDecoder.decode(TOKEN)).thenReturn(jwt("user-1", null));
    Map<String, Object> session = new HashMap<>();
    Message<?> message = MessageBuilder.createMessage(new byte[0],
        connect("Bearer " + TOKEN, session).getMessageHeaders());

    // Act
    interceptor.preSend(message, messageChannel);

    // Assert
    assertThat(session).doesNotContainKey(WebSocketAuthInterceptor.SESSION_ROLE_ATTRIBUTE);
  }

  @Test
  void preSend_MissingAuthorization_IsRejected() {
    // Arrange
    Message<?> message = MessageBuilder.createMessage(new byte[0],
        connect(null, new HashMap<>()).getMessageHeaders());

    // Act & Assert
    assertThatThrownBy(() -> interceptor.preSend(message, messageChannel))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Missing Authorization header");
    verify(jwtDecoder, never()).decode(anyString());
  }

  @Test
  void preSend_NonBearerScheme_IsRejected() {
    // Arrange
    Message<?> message = MessageBuilder.createMessage(new byte[0],
        connect("Basic dXNlcjpwYXNz", new HashMap<>()).getMessageHeaders());

    // Act & Assert
    assertThatThrownBy(() -> interceptor.preSend(message, messageChannel))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must start with 'Bearer '");
  }

  @Test
  void preSend_InvalidToken_IsRejected() {
    // Arrange
    when(jwtDecoder.decode(TOKEN)).thenThrow(new JwtException("expired"));
    Message<?> message = MessageBuilder.createMessage(new byte[0],
        connect("Bearer " + TOKEN, new HashMap<>()).getMessageHeaders());

    // Act & Assert
    assertThatThrownBy(() -> interceptor.preSend(message, messageChannel))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid JWT token");
  }

  @Test
  void preSend_SendFrame_PassesThroughWithoutDecoding() {
    // Arrange
    StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.SEND);
    Message<?> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());

    // Act
    Message<?> result = interceptor.preSend(message, messageChannel);

    // Assert
    assertThat(result).isSameAs(message);
    verify(jwtDecoder, never()).decode(anyString());
  }
}
