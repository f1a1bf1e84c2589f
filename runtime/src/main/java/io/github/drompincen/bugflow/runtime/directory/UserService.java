package io.github.drompincen.bugflow.runtime.directory;

import io.github.drompincen.bugflow.persistence.document.UserDocument;
import io.github.drompincen.bugflow.persistence.repository.UserRepository;
import io.github.drompincen.bugflow.protocol.api.CreateUserRequest;
import io.github.drompincen.bugflow.runtime.result.LifecycleError;
import io.github.drompincen.bugflow.runtime.result.LifecycleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Plain user records. Only existence and role lookups matter to the lifecycle.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    public LifecycleResult<UserDocument> create(CreateUserRequest request) {
        String email = request.email().trim().toLowerCase();
        if (userRepository.findByEmail(email).isPresent()) {
            return LifecycleResult.failure(LifecycleError.conflict("A user with email " + email + " already exists"));
        }
        Instant now = clock.instant();
        UserDocument user = new UserDocument();
        user.setUserId(UUID.randomUUID().toString());
        user.setName(request.name());
        user.setEmail(email);
        user.setRole(request.role());
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        UserDocument saved = userRepository.insert(user);
        log.info("User {} created with role {}", saved.getUserId(), saved.getRole().label());
        return LifecycleResult.success(saved);
    }

    public Optional<UserDocument> findById(String userId) {
        return userRepository.findById(userId);
    }

    public Optional<UserDocument> findByEmail(String email) {
        return userRepository.findByEmail(email.trim().toLowerCase());
    }

    public List<UserDocument> findAll() {
        return userRepository.findAll();
    }
}
