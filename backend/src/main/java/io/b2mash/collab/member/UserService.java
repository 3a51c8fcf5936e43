package io.b2mash.collab.member;

import io.b2mash.collab.exception.InvalidStateException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.persistence.PersistenceExecutor;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Service
public class UserService {

  private static final Logger log = LoggerFactory.getLogger(UserService.class);

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final PersistenceExecutor executor;

  public UserService(
      UserRepository userRepository,
      PasswordEncoder passwordEncoder,
      PersistenceExecutor executor) {
    this.userRepository = userRepository;
    this.passwordEncoder = passwordEncoder;
    this.executor = executor;
  }

  public User register(String username, String rawPassword, String fullName, String email) {
    if (username == null || username.isBlank()) {
      throw new ValidationException("Username is required");
    }
    if (rawPassword == null || rawPassword.length() < 6) {
      throw new ValidationException("Password must be at least 6 characters");
    }
    String hash = passwordEncoder.encode(rawPassword);
    var user =
        executor.executeTransactionWithRetry(
            () -> {
              if (userRepository.existsByUsername(username)) {
                throw new InvalidStateException(
                    "Username taken", "Username " + username + " is already registered");
              }
              return userRepository.save(new User(username, hash, fullName, email));
            },
            "registerUser");
    log.info("Registered user {} ({})", user.getId(), username);
    return user;
  }

  /** Returns the user when the password matches, otherwise {@code null}. */
  public User authenticate(String username, String rawPassword) {
    var user =
        executor.executeReadOnly(
            () -> userRepository.findByUsername(username).orElse(null), "findUserByUsername");
    if (user == null || rawPassword == null) {
      return null;
    }
    return passwordEncoder.matches(rawPassword, user.getPasswordHash()) ? user : null;
  }

  public User getUser(Long userId) {
    return executor
        .executeReadOnly(() -> userRepository.findById(userId), "getUser")
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  public boolean exists(Long userId) {
    return executor.executeReadOnly(() -> userRepository.existsById(userId), "userExists");
  }

  public List<User> listUsers() {
    return executor.executeReadOnly(userRepository::findAllByOrderByUsernameAsc, "listUsers");
  }

  /** Loads the given users keyed by id; ids with no row are absent from the map. */
  public Map<Long, User> findAllById(Collection<Long> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    return executor
        .executeReadOnly(() -> userRepository.findByIdIn(userIds), "findUsersById")
        .stream()
        .collect(Collectors.toMap(User::getId, Function.identity()));
  }

  public UserSummary summarize(Long userId) {
    return executor
        .executeReadOnly(() -> userRepository.findById(userId), "summarizeUser")
        .map(UserSummary::from)
        .orElseGet(() -> UserSummary.unknown(userId));
  }
}
