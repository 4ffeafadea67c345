package com.minicrm.backend.service;

import com.minicrm.backend.BaseE2ETest;
import com.minicrm.backend.model.User;
import com.minicrm.backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.core.user.DefaultOAuth2User;
import org.springframework.security.oauth2.core.user.OAuth2User;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserServiceE2ETest extends BaseE2ETest {

    @Autowired
    private UserService userService;

    @Autowired
    private UserRepository userRepository;

    @BeforeEach
    void setUp() {
        userRepository.deleteAll();
    }

    private static OAuth2User googleUser(String sub, String email, String name) {
        return new DefaultOAuth2User(List.of(new SimpleGrantedAuthority("ROLE_USER")),
                Map.of("sub", sub, "email", email, "name", name, "picture", "https://example.com/a.png"), "sub");
    }

    @Test
    void shouldPersistUserFoundByProviderAndSubject() {
        // Given
        User created = userService.findOrCreateFromOAuth(googleUser("g-0", "test@example.com", "Test User"),
                UserService.GOOGLE);

        // When
        var found = userRepository.findByOauthProviderAndOauthId(UserService.GOOGLE, "g-0");

        // Then
        assertTrue(found.isPresent());
        assertEquals(created.getId(), found.get().getId());
        assertEquals("Test User", found.get().getName());
    }

    @Test
    void shouldCreateUserOnFirstLogin() {
        // When
        User user = userService.findOrCreateFromOAuth(googleUser("g-1", "ana@example.com", "Ana"), UserService.GOOGLE);

        // Then
        assertNotNull(user.getId());
        assertEquals("g-1", user.getOauthId());
        assertEquals("ana@example.com", user.getEmail());
        assertEquals("https://example.com/a.png", user.getAvatarUrl());
        assertNotNull(user.getLastLoginAt());
    }

    @Test
    void shouldReuseUserOnLaterLogins() {
        User first = userService.findOrCreateFromOAuth(googleUser("g-2", "raj@example.com", "Raj"), UserService.GOOGLE);
        User second = userService.findOrCreateFromOAuth(googleUser("g-2", "raj@example.com", "Raj"), UserService.GOOGLE);

        assertEquals(first.getId(), second.getId());
        assertEquals(1, userRepository.count());
        assertFalse(second.getLastLoginAt().isBefore(first.getLastLoginAt()));
    }

    @Test
    void shouldUseSubjectAsOwnerId() {
        assertEquals("g-3", UserService.oauthId(googleUser("g-3", "x@example.com", "X")));
    }
}
