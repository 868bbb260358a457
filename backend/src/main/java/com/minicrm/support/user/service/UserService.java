package com.minicrm.support.user.service;

import com.minicrm.support.user.repo.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * Returns the id of the user with this identifier, creating the row on first sight.
     * <p>
     * Runs in the caller's transaction and connection. When a concurrent creator wins, the insert is
     * skipped and the existing row is read back and used. Users are never deleted.
     */
    @Transactional
    public String getOrCreate(String identifier) {
        var existing = userRepository.findByIdentifier(identifier);
        if (existing.isPresent()) {
            return existing.get().id();
        }

        var created = userRepository.createIfAbsent(identifier);
        var id = userRepository.findByIdentifier(identifier)
                .map(UserRepository.UserRow::id)
                .orElseThrow(() -> new IllegalStateException("user_missing_after_insert"));
        if (created > 0) {
            log.debug("user_created userId={}", id);
        } else {
            log.info("user_create_conflict userId={} action=reuse", id);
        }
        return id;
    }
}
