package com.minicrm.backend.service;

import com.minicrm.backend.model.User;
import com.minicrm.backend.repository.UserRepository;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class UserService {

    public static final String GOOGLE = "google";

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * Find or create a user from a Google login, recording the sign-in time.
     */
    public User findOrCreateFromOAuth(OAuth2User oAuth2User, String provider) {
        String oauthId = oauthId(oAuth2User);

        User user = userRepository.findByOauthProviderAndOauthId(provider, oauthId)
                .orElseGet(() -> User.builder()
                        .email(oAuth2User.getAttribute("email"))
                        .name(oAuth2User.getAttribute("name"))
                        .avatarUrl(oAuth2User.getAttribute("picture"))
                        .oauthProvider(provider)
                        .oauthId(oauthId)
                        .build());
        user.setLastLoginAt(Instant.now());
        return userRepository.save(user);
    }

    /**
     * Stable subject identifier of an OAuth user, used as segment owner.
     */
    public static String oauthId(OAuth2User oAuth2User) {
        Object sub = oAuth2User.getAttribute("sub");
        return sub != null ? sub.toString() : oAuth2User.getName();
    }
}
