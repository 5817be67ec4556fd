package com.astralcore.mfa.infrastructure.adapters;

import com.astralcore.mfa.domain.mfa.UserAccount;
import com.astralcore.mfa.domain.ports.UserDirectory;
import com.astralcore.mfa.infrastructure.jpa.SpringUserRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
public class JpaUserDirectoryAdapter implements UserDirectory {

    private final SpringUserRepository users;

    public JpaUserDirectoryAdapter(SpringUserRepository users) {
        this.users = users;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findById(String userId) {
        return users.findById(userId).map(u -> new UserAccount(u.getId(), u.getEmail(), u.getRole()));
    }
}
