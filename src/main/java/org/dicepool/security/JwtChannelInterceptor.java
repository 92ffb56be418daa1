package org.dicepool.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authentifie le CONNECT STOMP via JWT. Les observateurs du flux d'événements
 * doivent être connectés ; un token absent ou invalide fait échouer la connexion.
 * Le flux est en lecture seule : toute trame SEND d'un client est refusée.
 */
@Slf4j
@Component
public class JwtChannelInterceptor implements ChannelInterceptor {

    @Autowired
    private JwtUtil jwtUtil;

    @Autowired
    private UserDetailsService userDetailsService;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(message);
        if (StompCommand.SEND.equals(acc.getCommand())) {
            throw new IllegalArgumentException("Dice event stream is read-only");
        }
        if (!StompCommand.CONNECT.equals(acc.getCommand())) return message;

        acc.setLeaveMutable(true);
        String token = extractToken(acc);
        if (token == null || !jwtUtil.validerToken(token)) {
            throw new IllegalArgumentException("Invalid or missing JWT token");
        }
        String email = jwtUtil.extraireSubject(token);
        UserDetails ud = userDetailsService.loadUserByUsername(email);
        Authentication auth = new UsernamePasswordAuthenticationToken(ud, null, ud.getAuthorities());
        acc.setUser(auth);
        log.debug("WebSocket CONNECT - session {} -> {}", acc.getSessionId(), email);
        return MessageBuilder.createMessage(message.getPayload(), acc.getMessageHeaders());
    }

    private String extractToken(StompHeaderAccessor acc) {
        List<String> auths = acc.getNativeHeader("Authorization");
        if (auths != null && !auths.isEmpty()) {
            String v = auths.get(0);
            if (v != null && v.startsWith("Bearer ")) return v.substring(7);
        }
        List<String> toks = acc.getNativeHeader("token");
        if (toks != null && !toks.isEmpty()) return toks.get(0);

        // token posé par le handshake interceptor
        var attrs = acc.getSessionAttributes();
        if (attrs != null) {
            Object sessTok = attrs.get("token");
            if (sessTok instanceof String s && !s.isBlank()) return s;
        }
        return null;
    }
}
