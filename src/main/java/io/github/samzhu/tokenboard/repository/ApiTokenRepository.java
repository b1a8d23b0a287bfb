package io.github.samzhu.tokenboard.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenboard.document.ApiToken;

public interface ApiTokenRepository extends MongoRepository<ApiToken, String> {

    Optional<ApiToken> findByTokenHash(String tokenHash);
}
