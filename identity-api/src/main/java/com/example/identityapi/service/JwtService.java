package com.example.identityapi.service;

import com.example.identityapi.entity.Role;
import com.example.identityapi.entity.User;
import com.example.identityapi.security.ActingPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JWT Service for token generation and validation.
 *
 * Algorithm: HS256
 * Signing Key: jwt.secret
 * Access Token TTL: 1 hour by default
 */
@Service
public class JwtService {

    private final SecretKey secretKey;
    private final String issuer;
    private final long accessTokenExpiration;

    public JwtService(
            @Value("${jwt.secret}") String jwtSecret,
            @Value("${jwt.issuer:identity-api}") String issuer,
            @Value("${jwt.access-token-expiration:3600000}") long accessTokenExpiration) {
        // HS256 requires at least 256 bits (32 bytes) key
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.accessTokenExpiration = accessTokenExpiration;
    }

    /**
     * Generate Access Token (JWT) for authenticated user.
     *
     * Claims:
     * - sub: User ID
     * - username: User name
     * - roles: role display names (User, Admin, SuperAdmin)
     * - iss, iat, exp
     *
     * @param user Authenticated user
     * @return JWT access token string
     */
    public String generateAccessToken(User user) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + accessTokenExpiration);

        List<String> roles = user.getRoles().stream()
                .sorted()
                .map(Role::getDisplayName)
                .toList();

        return Jwts.builder()
                .subject(user.getId())
                .issuer(issuer)
                .claim("username", user.getUserName())
                .claim("roles", roles)
                .claim("token_type", "ACCESS")
                .issuedAt(now)
                .expiration(expiration)
                .signWith(secretKey)
                .compact();
    }

    /**
     * Parse a token into the acting principal it was issued for.
     * Unknown role names are ignored.
     *
     * @param token JWT token
     * @return principal, empty if the token is invalid, expired or issued by someone else
     */
    public Optional<ActingPrincipal> parsePrincipal(String token) {
        Claims claims;
        try {
            claims = extractAllClaims(token);
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }

        if (!issuer.equals(claims.getIssuer()) || claims.getSubject() == null) {
            return Optional.empty();
        }

        Set<Role> roles = EnumSet.noneOf(Role.class);
        Object rawRoles = claims.get("roles");
        if (rawRoles instanceof Collection<?> names) {
            names.forEach(name -> Role.fromName(String.valueOf(name)).ifPresent(roles::add));
        }

        return Optional.of(new ActingPrincipal(
                claims.getSubject(),
                claims.get("username", String.class),
                roles));
    }

    public long getAccessTokenExpirationSeconds() {
        return accessTokenExpiration / 1000;
    }

    /**
     * Extract all claims from token. Expired tokens fail signature parsing.
     */
    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
