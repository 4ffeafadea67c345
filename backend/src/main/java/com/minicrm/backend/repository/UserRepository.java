package com.minicrm.backend.repository;

import com.minicrm.backend.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends MongoRepository<User, String> {

    Optional<User> findByOauthProviderAndOauthId(String oauthProvider, String oauthId);
}
